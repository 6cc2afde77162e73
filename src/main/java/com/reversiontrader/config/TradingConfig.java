package com.reversiontrader.config;

import com.reversiontrader.execution.PaperTradeExecutor;
import com.reversiontrader.execution.TradeExecutor;
import com.reversiontrader.market.CsvPriceDataProvider;
import com.reversiontrader.market.CsvReplayFeed;
import com.reversiontrader.market.InMemoryPriceDataProvider;
import com.reversiontrader.market.PriceDataProvider;
import com.reversiontrader.reporting.BacktestReportFormatter;
import com.reversiontrader.reporting.BacktestResultWriter;
import com.reversiontrader.reporting.ParameterOptimizer;
import com.reversiontrader.risk.RiskManager;
import com.reversiontrader.risk.RiskParameters;
import com.reversiontrader.simulator.BacktestSimulator;
import com.reversiontrader.strategy.SignalDeduplicator;
import com.reversiontrader.strategy.SignalEngine;
import com.reversiontrader.strategy.StrategyParameters;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the trading core from {@link TradingProperties}.
 *
 * <p>Bound properties are converted once into immutable
 * {@link StrategyParameters} and {@link RiskParameters}; their
 * {@code validate()} runs here, so invalid configuration fails startup with a
 * ConfigurationException listing every violation.
 *
 * <p>PAPER mode gets an in-memory price feed, fed by replaying the configured
 * CSV unless {@code trading.paper.replay-csv=false}, and the paper execution
 * sink; BACKTEST mode reads bars from the configured CSV file.
 */
@Configuration
public class TradingConfig {

    private static final Logger log = LoggerFactory.getLogger(TradingConfig.class);

    private static final BigDecimal DEFAULT_DAILY_LOSS_FRACTION = new BigDecimal("0.1");

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public StrategyParameters strategyParameters(TradingProperties properties) {
        TradingProperties.Strategy strategy = properties.getStrategy();
        StrategyParameters parameters = StrategyParameters.builder()
                .maPeriod(strategy.getMaPeriod())
                .stdDevMultiplier(strategy.getStdDevMultiplier())
                .entryThreshold(strategy.getEntryThreshold())
                .exitThreshold(strategy.getExitThreshold())
                .stopLossPercent(strategy.getStopLossPercent())
                .takeProfitPercent(strategy.getTakeProfitPercent())
                .minVolume(strategy.getMinVolume())
                .rsiPeriod(strategy.getRsiPeriod())
                .emaPeriod(strategy.getEmaPeriod())
                .build()
                .validate();
        log.info("Strategy parameters: {}", parameters);
        return parameters;
    }

    @Bean
    public RiskParameters riskParameters(TradingProperties properties) {
        TradingProperties.Risk risk = properties.getRisk();
        BigDecimal maxDailyLoss = risk.getMaxDailyLoss() != null
                ? risk.getMaxDailyLoss()
                : risk.getMaxPositionSize().multiply(DEFAULT_DAILY_LOSS_FRACTION);
        RiskParameters parameters = RiskParameters.builder()
                .maxPositionSize(risk.getMaxPositionSize())
                .maxOpenPositions(risk.getMaxOpenPositions())
                .riskPerTrade(risk.getRiskPerTrade())
                .maxDailyLoss(maxDailyLoss)
                .maxDrawdown(risk.getMaxDrawdown())
                .build()
                .validate();
        log.info("Risk parameters: {}", parameters);
        return parameters;
    }

    @Bean
    public SignalEngine signalEngine(StrategyParameters strategyParameters, RiskParameters riskParameters) {
        return new SignalEngine(strategyParameters, riskParameters);
    }

    @Bean
    public RiskManager riskManager(RiskParameters riskParameters, ApplicationEventPublisher applicationEventPublisher) {
        return new RiskManager(riskParameters, applicationEventPublisher);
    }

    @Bean
    public SignalDeduplicator signalDeduplicator(TradingProperties properties) {
        return new SignalDeduplicator(properties.getSignalDedupWindow());
    }

    // ========================
    // PAPER MODE
    // ========================

    @Bean
    @ConditionalOnProperty(prefix = "trading", name = "mode", havingValue = "PAPER", matchIfMissing = true)
    public InMemoryPriceDataProvider inMemoryPriceDataProvider(TradingProperties properties) {
        return new InMemoryPriceDataProvider(properties.getPaper().getMaxHistory());
    }

    @Bean
    @ConditionalOnProperty(prefix = "trading", name = "mode", havingValue = "PAPER", matchIfMissing = true)
    public TradeExecutor paperTradeExecutor(SignalEngine signalEngine, TradingProperties properties) {
        TradingProperties.Paper paper = properties.getPaper();
        return new PaperTradeExecutor(signalEngine, paper.getInitialBalance(), paper.getFeeRate());
    }

    @Bean
    @ConditionalOnExpression("'${trading.mode:PAPER}' == 'PAPER' and ${trading.paper.replay-csv:true}")
    public CsvReplayFeed csvReplayFeed(TradingProperties properties, InMemoryPriceDataProvider inMemoryPriceDataProvider) {
        Path csvPath = Path.of(properties.getData().getCsvPath());
        log.info("Paper price feed replays {}", csvPath);
        return new CsvReplayFeed(new CsvPriceDataProvider(csvPath), inMemoryPriceDataProvider);
    }

    // ========================
    // BACKTEST MODE
    // ========================

    @Bean
    @ConditionalOnProperty(prefix = "trading", name = "mode", havingValue = "BACKTEST")
    public PriceDataProvider csvPriceDataProvider(TradingProperties properties) {
        return new CsvPriceDataProvider(Path.of(properties.getData().getCsvPath()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "trading", name = "mode", havingValue = "BACKTEST")
    public BacktestSimulator backtestSimulator(PriceDataProvider priceDataProvider) {
        return new BacktestSimulator(priceDataProvider);
    }

    @Bean
    @ConditionalOnProperty(prefix = "trading", name = "mode", havingValue = "BACKTEST")
    public ParameterOptimizer parameterOptimizer(BacktestSimulator backtestSimulator, Clock clock) {
        return new ParameterOptimizer(backtestSimulator, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "trading", name = "mode", havingValue = "BACKTEST")
    public BacktestResultWriter backtestResultWriter(TradingProperties properties, Clock clock) {
        return new BacktestResultWriter(Path.of(properties.getBacktest().getOutputDirectory()), clock);
    }

    @Bean
    public BacktestReportFormatter backtestReportFormatter() {
        return new BacktestReportFormatter();
    }
}
