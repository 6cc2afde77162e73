package com.reversiontrader.strategy;

import com.reversiontrader.exception.ConfigurationException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Immutable mean-reversion strategy parameters, passed to the SignalEngine
 * and IndicatorCalculator constructors.
 *
 * <p>Z-score thresholds: {@code entryThreshold} is the moderate entry band,
 * {@code stdDevMultiplier} the strong band (also the Bollinger width), and
 * {@code exitThreshold} the neutral zone around the mean.
 */
@Value
@Builder(toBuilder = true)
@With
public class StrategyParameters {

    @Builder.Default
    int maPeriod = 20;

    @Builder.Default
    BigDecimal stdDevMultiplier = new BigDecimal("2");

    @Builder.Default
    BigDecimal entryThreshold = new BigDecimal("0.5");

    @Builder.Default
    BigDecimal exitThreshold = new BigDecimal("0.1");

    @Builder.Default
    BigDecimal stopLossPercent = new BigDecimal("0.05");

    @Builder.Default
    BigDecimal takeProfitPercent = new BigDecimal("0.10");

    /** Minimum bar volume for a signal to be considered. */
    @Builder.Default
    BigDecimal minVolume = new BigDecimal("10000");

    @Builder.Default
    int rsiPeriod = 14;

    @Builder.Default
    int emaPeriod = 20;

    public static StrategyParameters defaults() {
        return StrategyParameters.builder().build();
    }

    /**
     * Checks parameter sanity and throws a {@link ConfigurationException}
     * listing every violation.
     *
     * @return this, for chaining at construction sites
     */
    public StrategyParameters validate() {
        List<String> errors = new ArrayList<>();
        if (maPeriod < 2) {
            errors.add("maPeriod must be at least 2 (was " + maPeriod + ")");
        }
        if (stdDevMultiplier == null || stdDevMultiplier.signum() <= 0) {
            errors.add("stdDevMultiplier must be positive (was " + stdDevMultiplier + ")");
        }
        if (entryThreshold == null || entryThreshold.signum() < 0) {
            errors.add("entryThreshold must be non-negative (was " + entryThreshold + ")");
        }
        if (exitThreshold == null || exitThreshold.signum() < 0) {
            errors.add("exitThreshold must be non-negative (was " + exitThreshold + ")");
        }
        if (entryThreshold != null && stdDevMultiplier != null && entryThreshold.compareTo(stdDevMultiplier) > 0) {
            errors.add("entryThreshold must not exceed stdDevMultiplier");
        }
        if (stopLossPercent == null || stopLossPercent.signum() <= 0 || stopLossPercent.compareTo(BigDecimal.ONE) >= 0) {
            errors.add("stopLossPercent must be in (0, 1) (was " + stopLossPercent + ")");
        }
        if (takeProfitPercent == null || takeProfitPercent.signum() <= 0) {
            errors.add("takeProfitPercent must be positive (was " + takeProfitPercent + ")");
        }
        if (minVolume == null || minVolume.signum() < 0) {
            errors.add("minVolume must be non-negative (was " + minVolume + ")");
        }
        if (rsiPeriod < 2 || emaPeriod < 2) {
            errors.add("rsiPeriod and emaPeriod must be at least 2");
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
        return this;
    }
}
