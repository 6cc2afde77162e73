package com.reversiontrader.execution;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Summary over closed positions. {@code winRate} is a percentage. */
@Value
@Builder
public class PortfolioStats {

    int totalTrades;
    int winningTrades;
    int losingTrades;
    BigDecimal winRate;
    BigDecimal totalPnl;
    BigDecimal averagePnl;
}
