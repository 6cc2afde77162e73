package com.reversiontrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One OHLCV observation for the traded instrument. Immutable once produced.
 *
 * <p>Sequences of bars handed to the engine are ordered by timestamp
 * (non-decreasing). Only {@code close} and {@code volume} drive signal
 * generation; the remaining fields are carried for reporting.
 */
@Value
@Builder
public class PriceBar {

    @NonNull
    LocalDateTime timestamp;

    BigDecimal open;
    BigDecimal high;
    BigDecimal low;

    @NonNull
    BigDecimal close;

    @NonNull
    BigDecimal volume;

    /** Origin of the bar, e.g. "csv" or "paper-feed". */
    String source;

    /** Convenience factory for bars where only close and volume matter. */
    public static PriceBar ofClose(LocalDateTime timestamp, BigDecimal close, BigDecimal volume) {
        return PriceBar.builder()
                .timestamp(timestamp)
                .open(close)
                .high(close)
                .low(close)
                .close(close)
                .volume(volume)
                .source("synthetic")
                .build();
    }
}
