package com.reversiontrader.execution;

import com.reversiontrader.domain.enums.OrderSide;
import com.reversiontrader.domain.enums.PositionSide;
import com.reversiontrader.domain.enums.TradeStatus;
import com.reversiontrader.domain.model.Position;
import com.reversiontrader.domain.model.Trade;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cash balance, position book and append-only trade log for simulated fills.
 *
 * <p>Fills happen at the requested price. The fee is notional x feeRate on both
 * sides: a buy debits notional + fee, a sell credits notional - fee. All
 * arithmetic is exact decimal, so after any number of round trips
 * {@code cash == initialBalance + sum(pnl) - sum(fees)}.
 *
 * <p>Not thread-safe; owners serialize access.
 */
public class SimulatedLedger {

    private static final Logger log = LoggerFactory.getLogger(SimulatedLedger.class);

    private final BigDecimal initialBalance;
    private final BigDecimal feeRate;
    private final String idPrefix;
    private final AtomicLong tradeSequence = new AtomicLong();
    private final AtomicLong positionSequence = new AtomicLong();

    private final List<Position> positions = new ArrayList<>();
    private final List<Trade> trades = new ArrayList<>();
    private BigDecimal cash;

    public SimulatedLedger(BigDecimal initialBalance, BigDecimal feeRate, String idPrefix) {
        if (initialBalance.signum() < 0) {
            throw new IllegalArgumentException("Initial balance must not be negative");
        }
        if (feeRate.signum() < 0) {
            throw new IllegalArgumentException("Fee rate must not be negative");
        }
        this.initialBalance = initialBalance;
        this.feeRate = feeRate;
        this.idPrefix = idPrefix;
        this.cash = initialBalance;
    }

    /** Total cash needed to buy {@code size} at {@code price}, fee included. */
    public BigDecimal costOf(BigDecimal size, BigDecimal price) {
        BigDecimal notional = size.multiply(price);
        return notional.add(notional.multiply(feeRate));
    }

    public boolean canAfford(BigDecimal size, BigDecimal price) {
        return cash.compareTo(costOf(size, price)) >= 0;
    }

    /**
     * Opens a LONG position. Returns a FAILED trade (and leaves cash untouched)
     * when the balance does not cover notional plus fee.
     */
    public Trade buy(
            BigDecimal size, BigDecimal price, LocalDateTime timestamp, BigDecimal stopLoss, BigDecimal takeProfit) {
        BigDecimal notional = size.multiply(price);
        BigDecimal fee = notional.multiply(feeRate);
        BigDecimal totalCost = notional.add(fee);
        if (cash.compareTo(totalCost) < 0) {
            return recordFailure(
                    OrderSide.BUY,
                    size,
                    timestamp,
                    "Insufficient balance: need " + totalCost.toPlainString() + ", have " + cash.toPlainString());
        }

        cash = cash.subtract(totalCost);
        Position position =
                Position.open(nextPositionId(), PositionSide.LONG, price, size, timestamp, stopLoss, takeProfit);
        positions.add(position);

        Trade trade = Trade.builder()
                .id(nextTradeId())
                .positionId(position.getId())
                .timestamp(timestamp)
                .side(OrderSide.BUY)
                .price(price)
                .size(size)
                .fee(fee)
                .status(TradeStatus.SUCCESS)
                .build();
        trades.add(trade);
        log.debug("Opened position {}: size={}, price={}, fee={}", position.getId(), size, price, fee);
        return trade;
    }

    /**
     * Closes an OPEN position in full at {@code price}, crediting net proceeds.
     * Closing anything but an OPEN position records a FAILED trade.
     */
    public Trade sell(Position position, BigDecimal price, LocalDateTime timestamp, String reason) {
        if (!position.isOpen()) {
            return recordFailure(
                    OrderSide.SELL, position.getSize(), timestamp, "Position " + position.getId() + " is not open");
        }

        BigDecimal proceeds = position.getSize().multiply(price);
        BigDecimal fee = proceeds.multiply(feeRate);
        cash = cash.add(proceeds.subtract(fee));
        position.close(price, timestamp, reason);

        Trade trade = Trade.builder()
                .id(nextTradeId())
                .positionId(position.getId())
                .timestamp(timestamp)
                .side(OrderSide.SELL)
                .price(price)
                .size(position.getSize())
                .fee(fee)
                .status(TradeStatus.SUCCESS)
                .build();
        trades.add(trade);
        log.debug("Closed position {} ({}): pnl={}", position.getId(), reason, position.getPnl());
        return trade;
    }

    /** Refreshes current price and unrealized P&L on every OPEN position. */
    public void markToMarket(BigDecimal price) {
        for (Position position : positions) {
            if (position.isOpen()) {
                position.markToMarket(price);
            }
        }
    }

    /**
     * Appends a FAILED attempt to the trade log without touching cash or
     * positions. Every failed fill goes through here so the log keeps the
     * full audit trail.
     */
    public Trade recordFailure(OrderSide side, BigDecimal size, LocalDateTime timestamp, String error) {
        Trade failed = Trade.failed(nextTradeId(), side, size, timestamp, error);
        trades.add(failed);
        log.warn("Simulated {} failed: {}", side, error);
        return failed;
    }

    public List<Position> getOpenPositions() {
        return positions.stream().filter(Position::isOpen).toList();
    }

    public List<Position> getClosedPositions() {
        return positions.stream().filter(Position::isClosed).toList();
    }

    public List<Position> getPositions() {
        return Collections.unmodifiableList(positions);
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    /** Cash plus market value of OPEN positions. */
    public BigDecimal getEquity() {
        BigDecimal openValue = positions.stream()
                .filter(Position::isOpen)
                .map(Position::getMarketValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return cash.add(openValue);
    }

    public BigDecimal getCash() {
        return cash;
    }

    public BigDecimal getInitialBalance() {
        return initialBalance;
    }

    public BigDecimal getFeeRate() {
        return feeRate;
    }

    private String nextTradeId() {
        return idPrefix + "-trade-" + tradeSequence.incrementAndGet();
    }

    private String nextPositionId() {
        return idPrefix + "-pos-" + positionSequence.incrementAndGet();
    }
}
