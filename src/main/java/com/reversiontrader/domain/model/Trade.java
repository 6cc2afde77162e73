package com.reversiontrader.domain.model;

import com.reversiontrader.domain.enums.OrderSide;
import com.reversiontrader.domain.enums.TradeStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Append-only trade log entry. Never mutated after creation.
 *
 * <p>FAILED trades are recorded too (with {@code error}) so the log keeps an
 * audit trail of every execution attempt.
 */
@Value
@Builder
public class Trade {

    String id;

    /** Position opened or closed by this trade. Null for failed attempts. */
    String positionId;

    LocalDateTime timestamp;
    OrderSide side;
    BigDecimal price;
    BigDecimal size;
    BigDecimal fee;
    TradeStatus status;
    String error;

    public boolean isSuccessful() {
        return status == TradeStatus.SUCCESS;
    }

    /** Gross notional value of the fill (price x size), fee excluded. */
    public BigDecimal getNotional() {
        return price.multiply(size);
    }

    public static Trade failed(String id, OrderSide side, BigDecimal size, LocalDateTime timestamp, String error) {
        return Trade.builder()
                .id(id)
                .timestamp(timestamp)
                .side(side)
                .price(BigDecimal.ZERO)
                .size(size)
                .fee(BigDecimal.ZERO)
                .status(TradeStatus.FAILED)
                .error(error)
                .build();
    }
}
