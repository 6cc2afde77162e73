package com.reversiontrader.reporting;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * One grid point of a parameter sweep. {@code totalReturn} and {@code winRate}
 * are percentages, {@code maxDrawdown} a fraction.
 *
 * <p>A combination that failed to run carries sentinel values (return and
 * Sharpe -999, drawdown 1) so it sorts last in every ranking.
 */
@Value
@Builder
public class OptimizationResult {

    static final BigDecimal FAILED_SCORE = BigDecimal.valueOf(-999);

    int maPeriod;
    BigDecimal stdDevMultiplier;
    BigDecimal totalReturn;
    BigDecimal winRate;
    BigDecimal sharpeRatio;
    BigDecimal maxDrawdown;
    int totalTrades;
    String error;

    public boolean isFailed() {
        return error != null;
    }

    public static OptimizationResult failed(int maPeriod, BigDecimal stdDevMultiplier, String error) {
        return OptimizationResult.builder()
                .maPeriod(maPeriod)
                .stdDevMultiplier(stdDevMultiplier)
                .totalReturn(FAILED_SCORE)
                .winRate(BigDecimal.ZERO)
                .sharpeRatio(FAILED_SCORE)
                .maxDrawdown(BigDecimal.ONE)
                .totalTrades(0)
                .error(error)
                .build();
    }
}
