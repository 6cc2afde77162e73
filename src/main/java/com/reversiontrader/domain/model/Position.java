package com.reversiontrader.domain.model;

import com.reversiontrader.domain.enums.PositionSide;
import com.reversiontrader.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A position in the traded instrument.
 *
 * <p>Created on trade acceptance, marked to market every cycle while OPEN and
 * closed exactly once. After {@link #close} the position is immutable history:
 * its {@code pnl} and {@code pnlPercent} stay fixed at the closing price.
 *
 * <p>{@code pnl} and {@code pnlPercent} are only defined once {@code currentPrice}
 * has been set. P&L is exact decimal arithmetic:
 * LONG = (price - entry) x size, SHORT = (entry - price) x size.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Position {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final String id;
    private final BigDecimal entryPrice;
    private final LocalDateTime entryTime;
    private final BigDecimal size;
    private final PositionSide side;
    private final BigDecimal stopLoss;
    private final BigDecimal takeProfit;

    private BigDecimal currentPrice;
    private BigDecimal pnl;
    private BigDecimal pnlPercent;

    @Builder.Default
    private PositionStatus status = PositionStatus.PENDING;

    private LocalDateTime exitTime;
    private String closeReason;

    /** Creates a position that is already OPEN (the opening trade has filled). */
    public static Position open(
            String id,
            PositionSide side,
            BigDecimal entryPrice,
            BigDecimal size,
            LocalDateTime entryTime,
            BigDecimal stopLoss,
            BigDecimal takeProfit) {
        return Position.builder()
                .id(id)
                .side(side)
                .entryPrice(entryPrice)
                .size(size)
                .entryTime(entryTime)
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .status(PositionStatus.OPEN)
                .build();
    }

    /**
     * Refreshes current price and unrealized P&L. Only OPEN positions are marked;
     * calls on a CLOSED position are rejected so history is never recomputed.
     */
    public void markToMarket(BigDecimal price) {
        if (status != PositionStatus.OPEN) {
            throw new IllegalStateException("Position " + id + " is " + status + ", cannot mark to market");
        }
        applyPrice(price);
    }

    /**
     * Closes the position at the given exit price. Fixes pnl and pnlPercent at
     * that price. A position can only be closed once.
     */
    public void close(BigDecimal exitPrice, LocalDateTime closedAt, String reason) {
        if (status != PositionStatus.OPEN) {
            throw new IllegalStateException("Position " + id + " is " + status + ", cannot close");
        }
        applyPrice(exitPrice);
        this.exitTime = closedAt;
        this.closeReason = reason;
        this.status = PositionStatus.CLOSED;
    }

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    public boolean isClosed() {
        return status == PositionStatus.CLOSED;
    }

    public BigDecimal getEntryValue() {
        return entryPrice.multiply(size);
    }

    /** Value at the last known price, falling back to entry price before the first mark. */
    public BigDecimal getMarketValue() {
        BigDecimal price = currentPrice != null ? currentPrice : entryPrice;
        return price.multiply(size);
    }

    private void applyPrice(BigDecimal price) {
        this.currentPrice = price;
        BigDecimal difference =
                side == PositionSide.LONG ? price.subtract(entryPrice) : entryPrice.subtract(price);
        this.pnl = difference.multiply(size);

        BigDecimal entryValue = getEntryValue();
        this.pnlPercent = entryValue.signum() == 0
                ? BigDecimal.ZERO
                : pnl.divide(entryValue, MathContext.DECIMAL128).multiply(HUNDRED);
    }
}
