package com.reversiontrader.reporting;

import com.reversiontrader.domain.model.Position;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes trade statistics over closed positions.
 *
 * <p>Winners have pnl &gt; 0, losers pnl &lt; 0; break-even trades count toward
 * the total only. Profit factor is averageWin / averageLoss (0 when there are
 * no losers). The Sharpe ratio is simplified and not annualized: mean of the
 * per-trade fractional returns divided by their population standard
 * deviation, 0 with fewer than two trades or zero deviation.
 */
public class PerformanceCalculator {

    private static final Logger log = LoggerFactory.getLogger(PerformanceCalculator.class);

    private static final MathContext MC = MathContext.DECIMAL128;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public PerformanceStats calculate(List<Position> positions) {
        List<Position> closed = positions.stream()
                .filter(Position::isClosed)
                .filter(p -> p.getPnl() != null)
                .toList();

        List<BigDecimal> wins = closed.stream()
                .map(Position::getPnl)
                .filter(pnl -> pnl.signum() > 0)
                .toList();
        List<BigDecimal> losses = closed.stream()
                .map(Position::getPnl)
                .filter(pnl -> pnl.signum() < 0)
                .map(BigDecimal::abs)
                .toList();

        BigDecimal averageWin = average(wins);
        BigDecimal averageLoss = average(losses);
        BigDecimal profitFactor = averageLoss.signum() > 0 ? averageWin.divide(averageLoss, MC) : BigDecimal.ZERO;
        BigDecimal winRate = closed.isEmpty()
                ? BigDecimal.ZERO
                : BigDecimal.valueOf(wins.size()).divide(BigDecimal.valueOf(closed.size()), MC).multiply(HUNDRED);

        BigDecimal sharpe = calculateSharpeRatio(closed);

        log.debug(
                "Performance: {} trades, {} wins, {} losses, PF={}, sharpe={}",
                closed.size(),
                wins.size(),
                losses.size(),
                profitFactor,
                sharpe);

        return PerformanceStats.builder()
                .totalTrades(closed.size())
                .winningTrades(wins.size())
                .losingTrades(losses.size())
                .winRate(winRate)
                .averageWin(averageWin)
                .averageLoss(averageLoss)
                .profitFactor(profitFactor)
                .sharpeRatio(sharpe)
                .build();
    }

    BigDecimal calculateSharpeRatio(List<Position> closed) {
        if (closed.size() < 2) {
            return BigDecimal.ZERO;
        }

        List<BigDecimal> returns = closed.stream()
                .map(Position::getPnlPercent)
                .filter(Objects::nonNull)
                .map(pct -> pct.divide(HUNDRED, MC))
                .toList();
        if (returns.isEmpty()) {
            return BigDecimal.ZERO;
        }

        BigDecimal mean = average(returns);
        BigDecimal sumOfSquares = BigDecimal.ZERO;
        for (BigDecimal r : returns) {
            BigDecimal diff = r.subtract(mean);
            sumOfSquares = sumOfSquares.add(diff.multiply(diff));
        }
        BigDecimal variance = sumOfSquares.divide(BigDecimal.valueOf(returns.size()), MC);
        if (variance.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return mean.divide(variance.sqrt(MC), MC);
    }

    private static BigDecimal average(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO;
        }
        return values.stream().reduce(BigDecimal.ZERO, BigDecimal::add).divide(BigDecimal.valueOf(values.size()), MC);
    }
}
