package com.reversiontrader.observability;

import com.reversiontrader.event.RiskEvent;
import com.reversiontrader.event.RiskEventType;
import com.reversiontrader.event.SignalEvent;
import com.reversiontrader.event.TradeEvent;
import com.reversiontrader.risk.RiskManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the trading engine:
 * <ul>
 *   <li><b>signals.generated</b> (counter, tagged by type)</li>
 *   <li><b>trades.executed</b> / <b>trades.failed</b> (counters)</li>
 *   <li><b>risk.rejections</b> (counter): trades refused by pre-trade validation</li>
 *   <li><b>risk.daily.loss</b> / <b>risk.max.drawdown</b> (gauges read from the RiskManager)</li>
 * </ul>
 *
 * <p>Counters are driven by application events and gauges are polled lazily by
 * Micrometer. Listeners only count; they never feed back into trading decisions.
 */
@Service
public class TradingMetricsService {

    private static final Logger log = LoggerFactory.getLogger(TradingMetricsService.class);

    private final MeterRegistry meterRegistry;
    private final Counter tradesExecutedCounter;
    private final Counter tradesFailedCounter;
    private final Counter riskRejectionCounter;

    public TradingMetricsService(MeterRegistry meterRegistry, RiskManager riskManager) {
        this.meterRegistry = meterRegistry;

        this.tradesExecutedCounter = Counter.builder("trades.executed")
                .description("Trades filled by the execution sink")
                .register(meterRegistry);

        this.tradesFailedCounter = Counter.builder("trades.failed")
                .description("Trade attempts that ended FAILED")
                .register(meterRegistry);

        this.riskRejectionCounter = Counter.builder("risk.rejections")
                .description("Trades rejected by pre-trade risk validation")
                .register(meterRegistry);

        meterRegistry.gauge("risk.daily.loss", riskManager, rm -> rm.getRiskMetrics()
                .getDailyLoss()
                .doubleValue());
        meterRegistry.gauge("risk.max.drawdown", riskManager, rm -> rm.getRiskMetrics()
                .getMaxDrawdown()
                .doubleValue());
    }

    @EventListener
    @Order(20)
    public void onSignalEvent(SignalEvent event) {
        Counter.builder("signals.generated")
                .description("Signals emitted by the signal engine")
                .tag("type", event.getSignal().getType().name())
                .register(meterRegistry)
                .increment();
    }

    @EventListener
    @Order(20)
    public void onTradeEvent(TradeEvent event) {
        if (event.isSuccessful()) {
            tradesExecutedCounter.increment();
        } else {
            tradesFailedCounter.increment();
            log.debug("Failed trade recorded: {}", event.getTrade().getError());
        }
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() == RiskEventType.TRADE_REJECTED) {
            riskRejectionCounter.increment();
        }
    }
}
