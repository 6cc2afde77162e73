package com.reversiontrader.engine;

import com.reversiontrader.domain.enums.SignalType;
import com.reversiontrader.domain.model.Position;
import com.reversiontrader.domain.model.PriceBar;
import com.reversiontrader.domain.model.Trade;
import com.reversiontrader.domain.model.TradingSignal;
import com.reversiontrader.event.RiskEvent;
import com.reversiontrader.event.RiskEventType;
import com.reversiontrader.event.RiskLevel;
import com.reversiontrader.event.SignalEvent;
import com.reversiontrader.event.TradeEvent;
import com.reversiontrader.exception.TradeExecutionException;
import com.reversiontrader.execution.TradeExecutor;
import com.reversiontrader.market.PriceDataProvider;
import com.reversiontrader.risk.ExitDecision;
import com.reversiontrader.risk.RiskManager;
import com.reversiontrader.risk.RiskMetrics;
import com.reversiontrader.risk.RiskValidationResult;
import com.reversiontrader.strategy.SignalDeduplicator;
import com.reversiontrader.strategy.SignalEngine;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Runs one live trading cycle: analyze the latest history, act on a fresh
 * signal, manage open positions and refresh risk tracking.
 *
 * <p>Cycles are synchronous and never overlap: a call arriving while another
 * cycle is still running returns immediately. A failing cycle is logged and
 * swallowed so the next scheduled cycle still runs.
 *
 * <p>Signal time comes from the last bar; position age is measured against the
 * injected clock.
 */
@Service
@ConditionalOnProperty(prefix = "trading", name = "mode", havingValue = "PAPER", matchIfMissing = true)
public class TradingCycleService {

    private static final Logger log = LoggerFactory.getLogger(TradingCycleService.class);

    private final PriceDataProvider priceDataProvider;
    private final SignalEngine signalEngine;
    private final RiskManager riskManager;
    private final TradeExecutor tradeExecutor;
    private final SignalDeduplicator signalDeduplicator;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public TradingCycleService(
            PriceDataProvider priceDataProvider,
            SignalEngine signalEngine,
            RiskManager riskManager,
            TradeExecutor tradeExecutor,
            SignalDeduplicator signalDeduplicator,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.priceDataProvider = priceDataProvider;
        this.signalEngine = signalEngine;
        this.riskManager = riskManager;
        this.tradeExecutor = tradeExecutor;
        this.signalDeduplicator = signalDeduplicator;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    /**
     * Runs a single cycle.
     *
     * @return false if skipped because a previous cycle is still running
     */
    public boolean runCycle() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Previous trading cycle still running, skipping");
            return false;
        }
        try {
            doRunCycle();
        } catch (RuntimeException e) {
            log.error("Trading cycle error", e);
        } finally {
            running.set(false);
        }
        return true;
    }

    private void doRunCycle() {
        List<PriceBar> history = priceDataProvider.getPriceHistory();
        int maPeriod = signalEngine.getStrategyParameters().getMaPeriod();
        if (history.size() < maPeriod) {
            log.debug("Insufficient price history for analysis: {} < {}", history.size(), maPeriod);
            return;
        }
        BigDecimal currentPrice = priceDataProvider.getCurrentPrice();

        Optional<TradingSignal> signal = signalEngine.analyze(history);
        if (signal.isPresent()) {
            handleSignal(signal.get());
        } else {
            log.debug("No trading signal generated");
        }

        managePositions(currentPrice, LocalDateTime.now(clock));

        riskManager.updateDrawdown(tradeExecutor.getAccountEquity());
        publishRiskSnapshot();
    }

    // ========================
    // SIGNAL HANDLING
    // ========================

    private void handleSignal(TradingSignal signal) {
        log.info(
                "New trading signal: type={}, strength={}, price={}, reason={}",
                signal.getType(),
                String.format(Locale.ROOT, "%.2f", signal.getStrength()),
                signal.getPrice().toPlainString(),
                signal.getReason());
        applicationEventPublisher.publishEvent(new SignalEvent(this, signal));

        if (!signal.isActionable() || !signalDeduplicator.accept(signal)) {
            return;
        }

        BigDecimal balance = tradeExecutor.getAccountBalance();
        BigDecimal proposed = signalEngine.calculatePositionSize(signal, balance, signal.getPrice());
        RiskValidationResult validation = riskManager.validateTrade(
                signal, proposed, tradeExecutor.getAccountEquity(), tradeExecutor.getOpenPositions());
        if (validation.isRejected()) {
            return;
        }

        BigDecimal size = validation.sizeOr(proposed);
        log.info("Executing {} trade for {}", signal.getType(), size.setScale(4, RoundingMode.HALF_UP));
        Trade trade = execute(signal, size, () -> tradeExecutor.executeTrade(signal, size));

        if (trade.isSuccessful() && signal.getType() == SignalType.SELL) {
            recordRealizedLoss(trade);
        }
    }

    // ========================
    // POSITION MANAGEMENT
    // ========================

    private void managePositions(BigDecimal currentPrice, LocalDateTime now) {
        for (Position position : tradeExecutor.getOpenPositions()) {
            position.markToMarket(currentPrice);

            ExitDecision decision = riskManager.shouldClosePosition(position, now);
            if (!decision.isShouldClose()) {
                log.debug(
                        "Position status: id={}, pnl={}, pnlPercent={}%",
                        position.getId(),
                        position.getPnl().setScale(2, RoundingMode.HALF_UP),
                        position.getPnlPercent().setScale(2, RoundingMode.HALF_UP));
                continue;
            }

            log.info(
                    "Closing position {}: {} (pnl={})",
                    position.getId(),
                    decision.getReason(),
                    position.getPnl().setScale(2, RoundingMode.HALF_UP));
            TradingSignal exitSignal = TradingSignal.exit(currentPrice, now, decision.getReason());
            Trade trade = execute(
                    exitSignal,
                    position.getSize(),
                    () -> tradeExecutor.closePosition(position.getId(), exitSignal));
            if (trade.isSuccessful()) {
                recordRealizedLoss(trade);
            }
        }
    }

    private Trade execute(TradingSignal signal, BigDecimal size, Supplier<Trade> action) {
        Trade trade;
        try {
            trade = action.get();
        } catch (TradeExecutionException e) {
            trade = tradeExecutor.recordFailure(signal, size, e.getMessage());
        }

        if (trade.isSuccessful()) {
            log.info("Trade executed successfully: {}", trade);
        } else {
            log.error("Trade execution failed: {}", trade.getError());
        }
        applicationEventPublisher.publishEvent(new TradeEvent(this, trade));
        return trade;
    }

    private void recordRealizedLoss(Trade trade) {
        tradeExecutor.getAllPositions().stream()
                .filter(p -> p.getId().equals(trade.getPositionId()))
                .filter(p -> p.getPnl() != null && p.getPnl().signum() < 0)
                .findFirst()
                .ifPresent(p -> riskManager.recordLoss(p.getPnl(), trade.getTimestamp()));
    }

    private void publishRiskSnapshot() {
        RiskMetrics metrics = riskManager.getRiskMetrics();
        applicationEventPublisher.publishEvent(new RiskEvent(
                this,
                RiskEventType.RISK_METRICS_SNAPSHOT,
                RiskLevel.INFO,
                "Risk metrics snapshot",
                Map.of(
                        "dailyLoss", metrics.getDailyLoss(),
                        "peakBalance", metrics.getPeakBalance(),
                        "maxDrawdown", metrics.getMaxDrawdown())));
    }

    public boolean isRunning() {
        return running.get();
    }
}
