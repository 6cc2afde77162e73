package com.reversiontrader.reporting;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * Output of a parameter sweep: every grid point plus three rankings.
 * {@code bestBalanced} only holds profitable combinations with drawdown under
 * 20%, ordered by return / (drawdown + 0.01).
 */
@Value
@Builder
public class OptimizationReport {

    LocalDateTime generatedAt;
    int barCount;
    int totalCombinations;
    List<OptimizationResult> results;
    List<OptimizationResult> topByReturn;
    List<OptimizationResult> topBySharpe;
    List<OptimizationResult> bestBalanced;

    /** The best balanced combination, if any qualified. */
    public Optional<OptimizationResult> getRecommended() {
        return bestBalanced.isEmpty() ? Optional.empty() : Optional.of(bestBalanced.get(0));
    }
}
