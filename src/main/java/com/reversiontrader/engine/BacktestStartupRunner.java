package com.reversiontrader.engine;

import com.reversiontrader.config.TradingProperties;
import com.reversiontrader.domain.model.PriceBar;
import com.reversiontrader.exception.BaseException;
import com.reversiontrader.exception.DataUnavailableException;
import com.reversiontrader.market.PriceDataProvider;
import com.reversiontrader.reporting.BacktestReportFormatter;
import com.reversiontrader.reporting.BacktestResultWriter;
import com.reversiontrader.reporting.OptimizationReport;
import com.reversiontrader.reporting.ParameterOptimizer;
import com.reversiontrader.risk.RiskParameters;
import com.reversiontrader.simulator.BacktestRequest;
import com.reversiontrader.simulator.BacktestResult;
import com.reversiontrader.simulator.BacktestSimulator;
import com.reversiontrader.strategy.StrategyParameters;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs a backtest at startup when {@code trading.mode=BACKTEST}: replays the
 * configured CSV through the simulator, logs the text report and writes the
 * JSON snapshot. With {@code trading.backtest.optimize=true} it also runs the
 * parameter sweep over the same bars.
 *
 * <p>Any failure propagates out of {@link #run}, which aborts startup with a
 * non-zero exit.
 */
@Component
@ConditionalOnProperty(prefix = "trading", name = "mode", havingValue = "BACKTEST")
public class BacktestStartupRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BacktestStartupRunner.class);

    private final TradingProperties tradingProperties;
    private final StrategyParameters strategyParameters;
    private final RiskParameters riskParameters;
    private final PriceDataProvider priceDataProvider;
    private final BacktestSimulator backtestSimulator;
    private final ParameterOptimizer parameterOptimizer;
    private final BacktestReportFormatter backtestReportFormatter;
    private final BacktestResultWriter backtestResultWriter;

    public BacktestStartupRunner(
            TradingProperties tradingProperties,
            StrategyParameters strategyParameters,
            RiskParameters riskParameters,
            PriceDataProvider priceDataProvider,
            BacktestSimulator backtestSimulator,
            ParameterOptimizer parameterOptimizer,
            BacktestReportFormatter backtestReportFormatter,
            BacktestResultWriter backtestResultWriter) {
        this.tradingProperties = tradingProperties;
        this.strategyParameters = strategyParameters;
        this.riskParameters = riskParameters;
        this.priceDataProvider = priceDataProvider;
        this.backtestSimulator = backtestSimulator;
        this.parameterOptimizer = parameterOptimizer;
        this.backtestReportFormatter = backtestReportFormatter;
        this.backtestResultWriter = backtestResultWriter;
    }

    @Override
    public void run(ApplicationArguments args) {
        TradingProperties.Backtest backtest = tradingProperties.getBacktest();
        BacktestRequest request = BacktestRequest.builder()
                .from(backtest.getFrom())
                .to(backtest.getTo())
                .initialBalance(backtest.getInitialBalance())
                .feeRate(backtest.getFeeRate())
                .strategyParameters(strategyParameters)
                .riskParameters(riskParameters)
                .build();

        try {
            List<PriceBar> bars = priceDataProvider.getPriceHistory(request.getFrom(), request.getTo());
            if (bars.isEmpty()) {
                throw new DataUnavailableException("No historical data available for the specified period");
            }

            BacktestResult result = backtestSimulator.run(request, bars);
            log.info(backtestReportFormatter.format(result));
            backtestResultWriter.write(result);

            if (backtest.isOptimize()) {
                OptimizationReport report = parameterOptimizer.optimize(request, bars);
                log.info(backtestReportFormatter.format(report));
                backtestResultWriter.write(report);
            }
        } catch (BaseException e) {
            log.error("Backtest failed [{}]: {}", e.getErrorCode().getCode(), e.getMessage());
            throw e;
        }
    }
}
