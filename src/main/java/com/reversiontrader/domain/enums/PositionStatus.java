package com.reversiontrader.domain.enums;

/**
 * Lifecycle of a position: PENDING until the opening trade fills, OPEN while
 * it is marked to market, CLOSED exactly once after which it is history.
 */
public enum PositionStatus {
    PENDING,
    OPEN,
    CLOSED
}
