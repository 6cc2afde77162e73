package com.reversiontrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Indicator snapshot derived from a trailing window of closes. Recomputed on
 * every cycle, never persisted.
 *
 * <p>{@code zScore} is filled in by the SignalEngine once the current price is
 * known. {@code rsi} and {@code ema} are null when the window is too short for
 * their periods; their absence never blocks signal generation.
 */
@Value
@Builder
@With
public class Indicators {

    BigDecimal sma;
    BigDecimal stdDev;
    BigDecimal upperBand;
    BigDecimal lowerBand;
    BigDecimal zScore;
    BigDecimal rsi;
    BigDecimal ema;

    public boolean hasRsi() {
        return rsi != null;
    }

    public boolean hasEma() {
        return ema != null;
    }
}
