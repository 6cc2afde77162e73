package com.reversiontrader.reporting;

import com.reversiontrader.domain.model.PriceBar;
import com.reversiontrader.simulator.BacktestRequest;
import com.reversiontrader.simulator.BacktestResult;
import com.reversiontrader.simulator.BacktestSimulator;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Grid search over maPeriod x stdDevMultiplier on a fixed bar series.
 *
 * <p>Each combination runs an independent backtest with the remaining
 * parameters taken from the base request. A combination that throws is
 * recorded with sentinel scores and the sweep continues.
 */
public class ParameterOptimizer {

    private static final Logger log = LoggerFactory.getLogger(ParameterOptimizer.class);

    public static final List<Integer> DEFAULT_MA_PERIODS = List.of(10, 15, 20, 25, 30);
    public static final List<BigDecimal> DEFAULT_MULTIPLIERS =
            List.of(new BigDecimal("1.5"), new BigDecimal("2.0"), new BigDecimal("2.5"), new BigDecimal("3.0"));

    static final int TOP_N = 10;
    static final int BALANCED_N = 5;
    static final BigDecimal BALANCED_MAX_DRAWDOWN = new BigDecimal("0.2");
    private static final BigDecimal DRAWDOWN_EPSILON = new BigDecimal("0.01");

    private final BacktestSimulator backtestSimulator;
    private final Clock clock;

    public ParameterOptimizer(BacktestSimulator backtestSimulator, Clock clock) {
        this.backtestSimulator = backtestSimulator;
        this.clock = clock;
    }

    public OptimizationReport optimize(BacktestRequest baseRequest, List<PriceBar> bars) {
        return optimize(baseRequest, bars, DEFAULT_MA_PERIODS, DEFAULT_MULTIPLIERS);
    }

    public OptimizationReport optimize(
            BacktestRequest baseRequest, List<PriceBar> bars, List<Integer> maPeriods, List<BigDecimal> multipliers) {
        int total = maPeriods.size() * multipliers.size();
        log.info("Parameter optimization: {} combinations over {} bars", total, bars.size());

        List<OptimizationResult> results = new ArrayList<>(total);
        int current = 0;
        for (int maPeriod : maPeriods) {
            for (BigDecimal multiplier : multipliers) {
                current++;
                log.info("[{}/{}] Testing MA:{}, StdDev:{}x", current, total, maPeriod, multiplier);
                results.add(runCombination(baseRequest, bars, maPeriod, multiplier));
            }
        }

        List<OptimizationResult> byReturn = results.stream()
                .sorted(Comparator.comparing(OptimizationResult::getTotalReturn).reversed())
                .toList();
        List<OptimizationResult> bySharpe = results.stream()
                .sorted(Comparator.comparing(OptimizationResult::getSharpeRatio).reversed())
                .toList();
        List<OptimizationResult> balanced = results.stream()
                .filter(r -> !r.isFailed())
                .filter(r -> r.getTotalReturn().signum() > 0)
                .filter(r -> r.getMaxDrawdown().compareTo(BALANCED_MAX_DRAWDOWN) < 0)
                .sorted(Comparator.comparing(ParameterOptimizer::returnToRisk).reversed())
                .limit(BALANCED_N)
                .toList();

        OptimizationReport report = OptimizationReport.builder()
                .generatedAt(LocalDateTime.now(clock))
                .barCount(bars.size())
                .totalCombinations(total)
                .results(List.copyOf(results))
                .topByReturn(byReturn.subList(0, Math.min(TOP_N, byReturn.size())))
                .topBySharpe(bySharpe.subList(0, Math.min(TOP_N, bySharpe.size())))
                .bestBalanced(balanced)
                .build();

        report.getRecommended()
                .ifPresentOrElse(
                        best -> log.info(
                                "Recommended parameters: MA={}, StdDev={}x (return {}%)",
                                best.getMaPeriod(),
                                best.getStdDevMultiplier(),
                                best.getTotalReturn().round(new MathContext(4))),
                        () -> log.info("No profitable low-risk combination found"));
        return report;
    }

    private OptimizationResult runCombination(
            BacktestRequest baseRequest, List<PriceBar> bars, int maPeriod, BigDecimal multiplier) {
        try {
            BacktestRequest request = baseRequest.toBuilder()
                    .strategyParameters(baseRequest
                            .getStrategyParameters()
                            .toBuilder()
                            .maPeriod(maPeriod)
                            .stdDevMultiplier(multiplier)
                            .build())
                    .build();
            BacktestResult result = backtestSimulator.run(request, bars);
            return OptimizationResult.builder()
                    .maPeriod(maPeriod)
                    .stdDevMultiplier(multiplier)
                    .totalReturn(result.getTotalReturnPercent())
                    .winRate(result.getWinRate())
                    .sharpeRatio(result.getSharpeRatio())
                    .maxDrawdown(result.getMaxDrawdown())
                    .totalTrades(result.getTotalTrades())
                    .build();
        } catch (RuntimeException e) {
            log.warn("Combination MA:{}, StdDev:{}x failed: {}", maPeriod, multiplier, e.getMessage());
            return OptimizationResult.failed(maPeriod, multiplier, e.getMessage());
        }
    }

    private static BigDecimal returnToRisk(OptimizationResult result) {
        return result.getTotalReturn().divide(result.getMaxDrawdown().add(DRAWDOWN_EPSILON), MathContext.DECIMAL128);
    }
}
