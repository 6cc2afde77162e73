package com.reversiontrader.simulator;

import com.reversiontrader.domain.enums.PositionSide;
import com.reversiontrader.domain.enums.SignalType;
import com.reversiontrader.domain.model.Position;
import com.reversiontrader.domain.model.PriceBar;
import com.reversiontrader.domain.model.Trade;
import com.reversiontrader.domain.model.TradingSignal;
import com.reversiontrader.exception.DataUnavailableException;
import com.reversiontrader.execution.SimulatedLedger;
import com.reversiontrader.market.PriceDataProvider;
import com.reversiontrader.reporting.PerformanceCalculator;
import com.reversiontrader.reporting.PerformanceStats;
import com.reversiontrader.risk.ExitDecision;
import com.reversiontrader.risk.RiskManager;
import com.reversiontrader.risk.RiskValidationResult;
import com.reversiontrader.strategy.SignalEngine;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays historical bars through the same SignalEngine and RiskManager used
 * in live operation, against a simulated ledger.
 *
 * <p>Per bar, in order:
 * <ol>
 *   <li>append to the trailing window, trimmed to 2 x maPeriod bars</li>
 *   <li>skip until the window holds maPeriod bars</li>
 *   <li>mark OPEN positions to the bar's close</li>
 *   <li>close positions flagged by {@link RiskManager#shouldClosePosition}</li>
 *   <li>analyze; on BUY size, validate and open a LONG, on SELL close the
 *       first OPEN position</li>
 *   <li>feed total equity into drawdown tracking</li>
 * </ol>
 * Remaining positions are force-closed at the final close.
 *
 * <p>Every run gets a fresh RiskManager and ledger, and the RiskManager
 * publishes into a no-op sink so replays never reach live metrics. Only the
 * absence of any data is fatal; rejected trades and bars without a signal are
 * skipped.
 */
public class BacktestSimulator {

    private static final Logger log = LoggerFactory.getLogger(BacktestSimulator.class);

    private static final MathContext MC = MathContext.DECIMAL128;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    static final String END_OF_BACKTEST = "End of backtest";

    private final PriceDataProvider priceDataProvider;
    private final PerformanceCalculator performanceCalculator;

    public BacktestSimulator(PriceDataProvider priceDataProvider) {
        this(priceDataProvider, new PerformanceCalculator());
    }

    public BacktestSimulator(PriceDataProvider priceDataProvider, PerformanceCalculator performanceCalculator) {
        this.priceDataProvider = priceDataProvider;
        this.performanceCalculator = performanceCalculator;
    }

    /**
     * Fetches the requested window from the price provider and replays it.
     *
     * @throws DataUnavailableException if the provider returns no bars
     */
    public BacktestResult run(BacktestRequest request) {
        List<PriceBar> bars = priceDataProvider.getPriceHistory(request.getFrom(), request.getTo());
        return run(request, bars);
    }

    /**
     * Replays the given bars (ascending timestamps).
     *
     * @throws DataUnavailableException if {@code bars} is empty
     */
    public BacktestResult run(BacktestRequest request, List<PriceBar> bars) {
        if (bars == null || bars.isEmpty()) {
            throw new DataUnavailableException(
                    "No historical data available for the specified period",
                    Map.of("from", String.valueOf(request.getFrom()), "to", String.valueOf(request.getTo())));
        }

        log.info(
                "Starting backtest: {} bars from {} to {}, initialBalance={}",
                bars.size(),
                bars.get(0).getTimestamp(),
                bars.get(bars.size() - 1).getTimestamp(),
                request.getInitialBalance());

        Run run = new Run(request);
        for (int i = 0; i < bars.size(); i++) {
            run.onBar(bars.get(i));
            if (i > 0 && i % 100 == 0) {
                log.debug("Backtest progress: {}/{} bars, cash={}", i, bars.size(), run.ledger.getCash());
            }
        }
        run.closeAll(bars.get(bars.size() - 1));

        BacktestResult result = run.toResult(bars);
        log.info(
                "Backtest completed: finalBalance={}, return={}%, trades={}, winRate={}%",
                result.getFinalBalance().toPlainString(),
                result.getTotalReturnPercent().round(new MathContext(6)).toPlainString(),
                result.getTotalTrades(),
                result.getWinRate().round(new MathContext(4)).toPlainString());
        return result;
    }

    /** Mutable state of a single replay. */
    private final class Run {

        private final BacktestRequest request;
        private final int maPeriod;
        private final SignalEngine signalEngine;
        private final RiskManager riskManager;
        private final SimulatedLedger ledger;
        private final List<PriceBar> window = new ArrayList<>();
        private int barsProcessed;

        Run(BacktestRequest request) {
            this.request = request;
            this.maPeriod = request.getStrategyParameters().getMaPeriod();
            this.signalEngine = new SignalEngine(request.getStrategyParameters(), request.getRiskParameters());
            this.riskManager = new RiskManager(request.getRiskParameters(), event -> {});
            this.ledger = new SimulatedLedger(request.getInitialBalance(), request.getFeeRate(), "bt");
            riskManager.updateDrawdown(request.getInitialBalance());
        }

        void onBar(PriceBar bar) {
            barsProcessed++;
            window.add(bar);
            if (window.size() > maPeriod * 2) {
                window.subList(0, window.size() - maPeriod * 2).clear();
            }
            if (window.size() < maPeriod) {
                return;
            }

            ledger.markToMarket(bar.getClose());

            for (Position position : ledger.getOpenPositions()) {
                ExitDecision decision = riskManager.shouldClosePosition(position, bar.getTimestamp());
                if (decision.isShouldClose()) {
                    close(position, bar, decision.getReason());
                }
            }

            Optional<TradingSignal> signal = signalEngine.analyze(List.copyOf(window));
            if (signal.isPresent() && signal.get().isActionable()) {
                process(signal.get(), bar);
            }

            riskManager.updateDrawdown(ledger.getEquity());
        }

        private void process(TradingSignal signal, PriceBar bar) {
            BigDecimal price = signal.getPrice();
            BigDecimal proposed = signalEngine.calculatePositionSize(signal, ledger.getCash(), price);
            List<Position> open = ledger.getOpenPositions();

            RiskValidationResult validation = riskManager.validateTrade(signal, proposed, ledger.getEquity(), open);
            if (validation.isRejected()) {
                log.debug("Bar {}: {} rejected ({})", bar.getTimestamp(), signal.getType(), validation.getReason());
                return;
            }
            BigDecimal size = validation.sizeOr(proposed);

            if (signal.getType() == SignalType.BUY) {
                if (!ledger.canAfford(size, price)) {
                    log.debug("Bar {}: insufficient cash for BUY of {}", bar.getTimestamp(), size);
                    return;
                }
                ledger.buy(
                        size,
                        price,
                        bar.getTimestamp(),
                        riskManager.calculateStopLoss(price, PositionSide.LONG),
                        riskManager.calculateTakeProfit(price, PositionSide.LONG));
            } else if (!open.isEmpty()) {
                close(open.get(0), bar, signal.getReason());
            }
        }

        private void close(Position position, PriceBar bar, String reason) {
            Trade trade = ledger.sell(position, bar.getClose(), bar.getTimestamp(), reason);
            if (trade.isSuccessful() && position.getPnl().signum() < 0) {
                riskManager.recordLoss(position.getPnl(), bar.getTimestamp());
            }
        }

        void closeAll(PriceBar lastBar) {
            for (Position position : ledger.getOpenPositions()) {
                close(position, lastBar, END_OF_BACKTEST);
            }
            riskManager.updateDrawdown(ledger.getEquity());
        }

        BacktestResult toResult(List<PriceBar> bars) {
            PerformanceStats stats = performanceCalculator.calculate(ledger.getPositions());
            BigDecimal initial = ledger.getInitialBalance();
            BigDecimal finalBalance = ledger.getCash();
            BigDecimal totalReturn = finalBalance.subtract(initial);
            BigDecimal totalReturnPercent =
                    initial.signum() == 0 ? BigDecimal.ZERO : totalReturn.divide(initial, MC).multiply(HUNDRED);
            BigDecimal totalFees = ledger.getTrades().stream()
                    .filter(Trade::isSuccessful)
                    .map(Trade::getFee)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);

            return BacktestResult.builder()
                    .startDate(request.getFrom() != null ? request.getFrom() : bars.get(0).getTimestamp())
                    .endDate(request.getTo() != null ? request.getTo() : bars.get(bars.size() - 1).getTimestamp())
                    .barsProcessed(barsProcessed)
                    .strategyParameters(request.getStrategyParameters())
                    .initialBalance(initial)
                    .finalBalance(finalBalance)
                    .totalReturn(totalReturn)
                    .totalReturnPercent(totalReturnPercent)
                    .totalFees(totalFees)
                    .totalTrades(stats.getTotalTrades())
                    .winningTrades(stats.getWinningTrades())
                    .losingTrades(stats.getLosingTrades())
                    .winRate(stats.getWinRate())
                    .averageWin(stats.getAverageWin())
                    .averageLoss(stats.getAverageLoss())
                    .profitFactor(stats.getProfitFactor())
                    .sharpeRatio(stats.getSharpeRatio())
                    .maxDrawdown(riskManager.getRiskMetrics().getMaxDrawdown())
                    .trades(List.copyOf(ledger.getTrades()))
                    .positions(List.copyOf(ledger.getPositions()))
                    .build();
        }
    }
}
