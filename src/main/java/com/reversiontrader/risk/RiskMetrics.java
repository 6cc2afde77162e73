package com.reversiontrader.risk;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time snapshot of the risk counters together with the configured
 * limits. Drawdowns are fractions (0.05 = 5%).
 */
@Value
@Builder
public class RiskMetrics {

    BigDecimal dailyLoss;
    LocalDate dailyLossResetAt;
    BigDecimal peakBalance;
    BigDecimal maxDrawdown;

    BigDecimal maxPositionSize;
    int maxOpenPositions;
    BigDecimal riskPerTrade;
    BigDecimal maxDailyLoss;
    BigDecimal maxDrawdownLimit;
}
