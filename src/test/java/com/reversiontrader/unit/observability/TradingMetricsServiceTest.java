package com.reversiontrader.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.reversiontrader.domain.enums.OrderSide;
import com.reversiontrader.domain.enums.SignalType;
import com.reversiontrader.domain.enums.TradeStatus;
import com.reversiontrader.domain.model.Trade;
import com.reversiontrader.domain.model.TradingSignal;
import com.reversiontrader.event.RiskEvent;
import com.reversiontrader.event.RiskEventType;
import com.reversiontrader.event.RiskLevel;
import com.reversiontrader.event.SignalEvent;
import com.reversiontrader.event.TradeEvent;
import com.reversiontrader.observability.TradingMetricsService;
import com.reversiontrader.risk.RiskManager;
import com.reversiontrader.risk.RiskParameters;
import com.reversiontrader.unit.support.RecordingEventPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TradingMetricsServiceTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 3, 1, 10, 0);

    private SimpleMeterRegistry meterRegistry;
    private RiskManager riskManager;
    private TradingMetricsService metricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        riskManager = new RiskManager(RiskParameters.defaults(), new RecordingEventPublisher());
        metricsService = new TradingMetricsService(meterRegistry, riskManager);
    }

    private static Trade trade(TradeStatus status) {
        return Trade.builder()
                .id("t1")
                .timestamp(T0)
                .side(OrderSide.BUY)
                .price(BigDecimal.TEN)
                .size(BigDecimal.ONE)
                .fee(BigDecimal.ZERO)
                .status(status)
                .build();
    }

    @Test
    @DisplayName("Signals are counted per type")
    void countsSignalsByType() {
        TradingSignal buy = TradingSignal.builder().type(SignalType.BUY).strength(0.8).build();
        TradingSignal sell = TradingSignal.builder().type(SignalType.SELL).strength(0.8).build();

        metricsService.onSignalEvent(new SignalEvent(this, buy));
        metricsService.onSignalEvent(new SignalEvent(this, buy));
        metricsService.onSignalEvent(new SignalEvent(this, sell));

        assertThat(meterRegistry.counter("signals.generated", "type", "BUY").count()).isEqualTo(2.0);
        assertThat(meterRegistry.counter("signals.generated", "type", "SELL").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Executed and failed trades go to separate counters")
    void countsTrades() {
        metricsService.onTradeEvent(new TradeEvent(this, trade(TradeStatus.SUCCESS)));
        metricsService.onTradeEvent(new TradeEvent(this, trade(TradeStatus.FAILED)));
        metricsService.onTradeEvent(new TradeEvent(this, trade(TradeStatus.SUCCESS)));

        assertThat(meterRegistry.counter("trades.executed").count()).isEqualTo(2.0);
        assertThat(meterRegistry.counter("trades.failed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Only trade rejections count as risk rejections")
    void countsRejections() {
        metricsService.onRiskEvent(new RiskEvent(this, RiskEventType.TRADE_REJECTED, RiskLevel.WARNING, "no"));
        metricsService.onRiskEvent(new RiskEvent(this, RiskEventType.DRAWDOWN_WARNING, RiskLevel.WARNING, "dd"));

        assertThat(meterRegistry.counter("risk.rejections").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Risk gauges read live values from the risk manager")
    void riskGauges() {
        riskManager.recordLoss(new BigDecimal("42"), T0);
        riskManager.updateDrawdown(new BigDecimal("1000"));
        riskManager.updateDrawdown(new BigDecimal("900"));

        assertThat(meterRegistry.get("risk.daily.loss").gauge().value()).isEqualTo(42.0);
        assertThat(meterRegistry.get("risk.max.drawdown").gauge().value()).isEqualTo(0.1);
    }
}
