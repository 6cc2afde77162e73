package com.reversiontrader.domain.enums;

/** Outcome of a trade attempt as recorded in the append-only trade log. */
public enum TradeStatus {
    PENDING,
    SUCCESS,
    FAILED
}
