package com.reversiontrader.domain.model;

import com.reversiontrader.domain.enums.SignalType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Output of one analysis cycle: direction, confidence in [0, 1], the price it
 * was generated at and the indicator snapshot that justified it.
 *
 * <p>Consumed immediately by the RiskManager or discarded.
 */
@Value
@Builder
public class TradingSignal {

    SignalType type;

    /** Confidence score, always within [0, 1]. */
    double strength;

    BigDecimal price;
    LocalDateTime timestamp;
    Indicators indicators;
    String reason;

    public boolean isActionable() {
        return type != SignalType.HOLD;
    }

    /**
     * Builds a full-strength exit signal used when a position is closed by a
     * risk rule rather than by the strategy.
     */
    public static TradingSignal exit(BigDecimal price, LocalDateTime timestamp, String reason) {
        return TradingSignal.builder()
                .type(SignalType.SELL)
                .strength(1.0)
                .price(price)
                .timestamp(timestamp)
                .reason(reason)
                .build();
    }
}
