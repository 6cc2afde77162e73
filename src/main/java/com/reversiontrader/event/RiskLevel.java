package com.reversiontrader.event;

/**
 * Severity level for a {@link RiskEvent}.
 *
 * <p>INFO is for routine snapshots, WARNING for rejected trades and elevated
 * drawdown, CRITICAL for limit breaches that block further trading.
 */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
