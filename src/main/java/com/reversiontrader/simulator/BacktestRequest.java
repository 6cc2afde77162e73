package com.reversiontrader.simulator;

import com.reversiontrader.risk.RiskParameters;
import com.reversiontrader.strategy.StrategyParameters;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Parameters of one backtest run. {@code from}/{@code to} bound the bars
 * requested from the price provider; null means unbounded.
 */
@Value
@Builder(toBuilder = true)
public class BacktestRequest {

    LocalDateTime from;
    LocalDateTime to;

    @Builder.Default
    BigDecimal initialBalance = new BigDecimal("10000");

    @Builder.Default
    BigDecimal feeRate = new BigDecimal("0.0025");

    @Builder.Default
    StrategyParameters strategyParameters = StrategyParameters.defaults();

    @Builder.Default
    RiskParameters riskParameters = RiskParameters.defaults();
}
