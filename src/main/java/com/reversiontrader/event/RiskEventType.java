package com.reversiontrader.event;

/**
 * Classifies the risk condition behind a {@link RiskEvent}.
 */
public enum RiskEventType {

    /** A proposed trade failed pre-trade validation. */
    TRADE_REJECTED,

    /** Realized losses for the current day exceed the configured cap. */
    DAILY_LOSS_LIMIT_BREACH,

    /** Equity has fallen more than 5% below its peak. */
    DRAWDOWN_WARNING,

    /** An open position hit stop-loss, take-profit, age or emergency exit. */
    POSITION_EXIT_TRIGGERED,

    /** Periodic snapshot of the risk counters, published once per live cycle. */
    RISK_METRICS_SNAPSHOT
}
