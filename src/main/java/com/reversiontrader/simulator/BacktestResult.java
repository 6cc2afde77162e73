package com.reversiontrader.simulator;

import com.reversiontrader.domain.model.Position;
import com.reversiontrader.domain.model.Trade;
import com.reversiontrader.strategy.StrategyParameters;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Aggregate outcome of one backtest run, computed once at the end and
 * read-only afterwards.
 *
 * <p>{@code totalReturnPercent} and {@code winRate} are percentages;
 * {@code maxDrawdown} is a fraction of peak equity. {@code totalTrades} counts
 * closed positions (round trips), while {@code trades} is the full fill log.
 */
@Value
@Builder
public class BacktestResult {

    LocalDateTime startDate;
    LocalDateTime endDate;
    int barsProcessed;
    StrategyParameters strategyParameters;

    BigDecimal initialBalance;
    BigDecimal finalBalance;
    BigDecimal totalReturn;
    BigDecimal totalReturnPercent;
    BigDecimal totalFees;

    int totalTrades;
    int winningTrades;
    int losingTrades;
    BigDecimal winRate;
    BigDecimal averageWin;
    BigDecimal averageLoss;
    BigDecimal profitFactor;
    BigDecimal sharpeRatio;
    BigDecimal maxDrawdown;

    List<Trade> trades;
    List<Position> positions;
}
