package com.reversiontrader.domain.enums;

/**
 * Run mode of the application.
 * PAPER runs scheduled live cycles against the simulated execution sink.
 * BACKTEST replays historical bars once at startup and exits.
 */
public enum TradingMode {
    PAPER,
    BACKTEST
}
