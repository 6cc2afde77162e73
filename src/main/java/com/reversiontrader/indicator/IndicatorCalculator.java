package com.reversiontrader.indicator;

import com.reversiontrader.domain.model.Indicators;
import com.reversiontrader.strategy.StrategyParameters;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.num.DecimalNum;
import org.ta4j.core.num.Num;

/**
 * Computes the mean-reversion indicator set from a trailing window of closes.
 *
 * <p>SMA and standard deviation are computed directly in BigDecimal over the
 * last {@code maPeriod} closes. The standard deviation is the population form
 * (divide by N, not N-1), which gives tighter bands than the sample form.
 * Bollinger bands are SMA +/- stdDev x stdDevMultiplier.
 *
 * <p>RSI and EMA are optional confirmations computed with ta4j over a
 * DecimalNum bar series built from the same closes. RSI needs at least
 * {@code rsiPeriod} closes and EMA at least {@code emaPeriod}; otherwise they
 * are left null.
 *
 * <p>Pure function of its input: no state is kept between calls.
 */
public class IndicatorCalculator {

    private static final Logger log = LoggerFactory.getLogger(IndicatorCalculator.class);

    private static final MathContext MC = MathContext.DECIMAL128;

    /** Synthetic bar end times; ta4j requires strictly increasing end times. */
    private static final ZonedDateTime SERIES_ORIGIN = ZonedDateTime.of(2000, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    private final StrategyParameters strategyParameters;

    public IndicatorCalculator(StrategyParameters strategyParameters) {
        this.strategyParameters = strategyParameters.validate();
    }

    /**
     * Calculates indicators for the given closes (oldest first).
     *
     * @param closes ordered closing prices
     * @return the indicator snapshot, or empty when fewer than maPeriod closes are given
     */
    public Optional<Indicators> calculate(List<BigDecimal> closes) {
        int period = strategyParameters.getMaPeriod();
        if (closes == null || closes.size() < period) {
            log.debug(
                    "Insufficient data for indicators. Need {} closes, have {}",
                    period,
                    closes == null ? 0 : closes.size());
            return Optional.empty();
        }

        List<BigDecimal> window = closes.subList(closes.size() - period, closes.size());
        BigDecimal sma = simpleMovingAverage(window);
        BigDecimal stdDev = populationStdDev(window, sma);
        BigDecimal bandWidth = stdDev.multiply(strategyParameters.getStdDevMultiplier());

        BarSeries series = null;
        BigDecimal rsi = null;
        BigDecimal ema = null;
        if (closes.size() >= strategyParameters.getRsiPeriod()) {
            series = toBarSeries(closes);
            rsi = lastValue(series, new RSIIndicator(new ClosePriceIndicator(series), strategyParameters.getRsiPeriod()));
        }
        if (closes.size() >= strategyParameters.getEmaPeriod()) {
            if (series == null) {
                series = toBarSeries(closes);
            }
            ema = lastValue(series, new EMAIndicator(new ClosePriceIndicator(series), strategyParameters.getEmaPeriod()));
        }

        return Optional.of(Indicators.builder()
                .sma(sma)
                .stdDev(stdDev)
                .upperBand(sma.add(bandWidth))
                .lowerBand(sma.subtract(bandWidth))
                .rsi(rsi)
                .ema(ema)
                .build());
    }

    BigDecimal simpleMovingAverage(List<BigDecimal> window) {
        BigDecimal sum = window.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(window.size()), MC);
    }

    BigDecimal populationStdDev(List<BigDecimal> window, BigDecimal mean) {
        BigDecimal sumOfSquares = BigDecimal.ZERO;
        for (BigDecimal value : window) {
            BigDecimal deviation = value.subtract(mean);
            sumOfSquares = sumOfSquares.add(deviation.multiply(deviation));
        }
        BigDecimal variance = sumOfSquares.divide(BigDecimal.valueOf(window.size()), MC);
        if (variance.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return variance.sqrt(MC);
    }

    private BarSeries toBarSeries(List<BigDecimal> closes) {
        BarSeries series = new BaseBarSeriesBuilder()
                .withName("closes")
                .withNumTypeOf(DecimalNum.class)
                .build();
        ZonedDateTime endTime = SERIES_ORIGIN;
        for (BigDecimal close : closes) {
            endTime = endTime.plusMinutes(1);
            series.addBar(endTime, close, close, close, close, BigDecimal.ZERO);
        }
        return series;
    }

    private BigDecimal lastValue(BarSeries series, Indicator<Num> indicator) {
        Num value = indicator.getValue(series.getEndIndex());
        if (value == null || value.isNaN()) {
            return null;
        }
        return new BigDecimal(value.toString());
    }
}
