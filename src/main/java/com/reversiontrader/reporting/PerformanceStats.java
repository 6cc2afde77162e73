package com.reversiontrader.reporting;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Trade statistics over closed positions. {@code winRate} is a percentage;
 * {@code averageLoss} is a positive magnitude.
 */
@Value
@Builder
public class PerformanceStats {

    int totalTrades;
    int winningTrades;
    int losingTrades;
    BigDecimal winRate;
    BigDecimal averageWin;
    BigDecimal averageLoss;
    BigDecimal profitFactor;
    BigDecimal sharpeRatio;
}
