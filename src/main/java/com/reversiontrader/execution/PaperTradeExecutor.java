package com.reversiontrader.execution;

import com.reversiontrader.domain.enums.SignalType;
import com.reversiontrader.domain.model.Position;
import com.reversiontrader.domain.model.Trade;
import com.reversiontrader.domain.model.TradingSignal;
import com.reversiontrader.exception.TradeExecutionException;
import com.reversiontrader.strategy.RiskLevels;
import com.reversiontrader.strategy.SignalEngine;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paper-trading execution sink. Fills at the signal price with a flat fee on
 * notional and keeps its own cash, position book and trade log.
 *
 * <p>BUY opens a LONG position whose stop-loss and take-profit come from the
 * strategy's risk levels. SELL closes the first OPEN position in full.
 */
public class PaperTradeExecutor implements TradeExecutor {

    private static final Logger log = LoggerFactory.getLogger(PaperTradeExecutor.class);

    public static final BigDecimal DEFAULT_FEE_RATE = new BigDecimal("0.0025");

    private final SignalEngine signalEngine;
    private final SimulatedLedger ledger;

    public PaperTradeExecutor(SignalEngine signalEngine, BigDecimal initialBalance, BigDecimal feeRate) {
        this.signalEngine = signalEngine;
        this.ledger = new SimulatedLedger(initialBalance, feeRate, "paper");
    }

    @Override
    public synchronized Trade executeTrade(TradingSignal signal, BigDecimal size) {
        if (signal.getType() == SignalType.BUY) {
            RiskLevels levels = signalEngine.calculateRiskLevels(signal.getPrice(), SignalType.BUY);
            Trade trade = ledger.buy(
                    size, signal.getPrice(), signal.getTimestamp(), levels.stopLoss(), levels.takeProfit());
            logTrade(trade);
            return trade;
        }
        if (signal.getType() == SignalType.SELL) {
            List<Position> open = ledger.getOpenPositions();
            if (open.isEmpty()) {
                return failed(signal, size, "No open position to close");
            }
            Trade trade = ledger.sell(open.get(0), signal.getPrice(), signal.getTimestamp(), signal.getReason());
            logTrade(trade);
            return trade;
        }
        throw new TradeExecutionException(
                "Cannot execute " + signal.getType() + " signal", Map.of("signalType", signal.getType().name()));
    }

    @Override
    public synchronized Trade closePosition(String positionId, TradingSignal exitSignal) {
        Position position = ledger.getOpenPositions().stream()
                .filter(p -> p.getId().equals(positionId))
                .findFirst()
                .orElse(null);
        if (position == null) {
            return failed(exitSignal, BigDecimal.ZERO, "No open position with id " + positionId);
        }
        Trade trade = ledger.sell(position, exitSignal.getPrice(), exitSignal.getTimestamp(), exitSignal.getReason());
        logTrade(trade);
        return trade;
    }

    @Override
    public synchronized Trade recordFailure(TradingSignal signal, BigDecimal size, String error) {
        return failed(signal, size, error);
    }

    private Trade failed(TradingSignal signal, BigDecimal size, String error) {
        log.warn("[PAPER] Trade failed: {}", error);
        return ledger.recordFailure(signal.getType().toOrderSide(), size, signal.getTimestamp(), error);
    }

    private void logTrade(Trade trade) {
        if (trade.isSuccessful()) {
            log.info(
                    "[PAPER] Trade simulated: side={}, size={}, price={}, fee={}",
                    trade.getSide(),
                    trade.getSize().toPlainString(),
                    trade.getPrice().toPlainString(),
                    trade.getFee().toPlainString());
        }
    }

    @Override
    public synchronized List<Position> getOpenPositions() {
        return ledger.getOpenPositions();
    }

    @Override
    public synchronized List<Position> getAllPositions() {
        return List.copyOf(ledger.getPositions());
    }

    @Override
    public synchronized List<Trade> getTradeHistory(int limit) {
        List<Trade> trades = ledger.getTrades();
        if (limit <= 0 || limit >= trades.size()) {
            return List.copyOf(trades);
        }
        return List.copyOf(trades.subList(trades.size() - limit, trades.size()));
    }

    @Override
    public synchronized BigDecimal getAccountBalance() {
        return ledger.getCash();
    }

    @Override
    public synchronized BigDecimal getAccountEquity() {
        return ledger.getEquity();
    }

    /** Win/loss statistics over closed positions. */
    public synchronized PortfolioStats getPortfolioStats() {
        List<Position> closed = ledger.getClosedPositions();
        int winners = (int) closed.stream().filter(p -> p.getPnl().signum() > 0).count();
        int losers = (int) closed.stream().filter(p -> p.getPnl().signum() < 0).count();
        BigDecimal totalPnl = closed.stream().map(Position::getPnl).reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal averagePnl = BigDecimal.ZERO;
        BigDecimal winRate = BigDecimal.ZERO;
        if (!closed.isEmpty()) {
            BigDecimal count = BigDecimal.valueOf(closed.size());
            averagePnl = totalPnl.divide(count, MathContext.DECIMAL128).setScale(2, RoundingMode.HALF_UP);
            winRate = BigDecimal.valueOf(winners)
                    .multiply(BigDecimal.valueOf(100))
                    .divide(count, 2, RoundingMode.HALF_UP);
        }

        return PortfolioStats.builder()
                .totalTrades(closed.size())
                .winningTrades(winners)
                .losingTrades(losers)
                .winRate(winRate)
                .totalPnl(totalPnl.setScale(2, RoundingMode.HALF_UP))
                .averagePnl(averagePnl)
                .build();
    }
}
