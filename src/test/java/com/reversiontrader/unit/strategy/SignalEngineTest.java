package com.reversiontrader.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.reversiontrader.domain.enums.SignalType;
import com.reversiontrader.domain.model.Indicators;
import com.reversiontrader.domain.model.PriceBar;
import com.reversiontrader.domain.model.TradingSignal;
import com.reversiontrader.exception.ConfigurationException;
import com.reversiontrader.risk.RiskParameters;
import com.reversiontrader.strategy.RiskLevels;
import com.reversiontrader.strategy.SignalEngine;
import com.reversiontrader.strategy.StrategyParameters;
import com.reversiontrader.unit.support.TestBars;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SignalEngine covering z-score classification, confirmation
 * boosts, filters, position sizing and risk levels.
 */
class SignalEngineTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 12, 0);
    private static final BigDecimal HIGH_VOLUME = new BigDecimal("50000");

    private final SignalEngine signalEngine = new SignalEngine(StrategyParameters.defaults(), RiskParameters.defaults());

    /** SMA 100, stdDev 10, bands at 80 and 120, no RSI or EMA. */
    private static Indicators meanAt100() {
        return Indicators.builder()
                .sma(new BigDecimal("100"))
                .stdDev(new BigDecimal("10"))
                .upperBand(new BigDecimal("120"))
                .lowerBand(new BigDecimal("80"))
                .build();
    }

    private Optional<TradingSignal> evaluate(String price, Indicators indicators) {
        return signalEngine.evaluate(new BigDecimal(price), indicators, HIGH_VOLUME, NOW);
    }

    // ==============================
    // ANALYZE
    // ==============================

    @Nested
    @DisplayName("Analyze price window")
    class Analyze {

        @Test
        @DisplayName("Sharp drop after a flat stretch gives a strong BUY")
        void sharpDrop_strongBuy() {
            List<PriceBar> bars = TestBars.flatThen(25, "100", "80");

            TradingSignal signal = signalEngine.analyze(bars).orElseThrow();

            assertThat(signal.getType()).isEqualTo(SignalType.BUY);
            assertThat(signal.getStrength()).isGreaterThan(0.3).isLessThanOrEqualTo(1.0);
            assertThat(signal.getPrice()).isEqualByComparingTo("80");
            assertThat(signal.getReason()).startsWith("Price 4.36 std devs below mean - strong oversold");
            assertThat(signal.getReason()).contains("RSI oversold", "price below lower Bollinger Band");
            assertThat(signal.getIndicators().getZScore()).isNegative();
        }

        @Test
        @DisplayName("Sharp spike after a flat stretch gives a strong SELL")
        void sharpSpike_strongSell() {
            TradingSignal signal =
                    signalEngine.analyze(TestBars.flatThen(25, "100", "120")).orElseThrow();

            assertThat(signal.getType()).isEqualTo(SignalType.SELL);
            assertThat(signal.getReason()).contains("strong overbought", "RSI overbought");
            assertThat(signal.getIndicators().getZScore()).isPositive();
        }

        @Test
        @DisplayName("Signal carries the last bar's timestamp")
        void timestampFromLastBar() {
            List<PriceBar> bars = TestBars.flatThen(25, "100", "80");

            TradingSignal signal = signalEngine.analyze(bars).orElseThrow();

            assertThat(signal.getTimestamp()).isEqualTo(bars.get(bars.size() - 1).getTimestamp());
        }

        @Test
        @DisplayName("Fewer bars than maPeriod yields no signal")
        void insufficientBars() {
            assertThat(signalEngine.analyze(TestBars.flat(19, "100"))).isEmpty();
            assertThat(signalEngine.analyze(null)).isEmpty();
        }

        @Test
        @DisplayName("Flat series has zero variance and yields no signal")
        void flatSeries() {
            assertThat(signalEngine.analyze(TestBars.flat(30, "100"))).isEmpty();
        }

        @Test
        @DisplayName("Last bar volume below minVolume suppresses the signal")
        void lowVolume() {
            List<PriceBar> bars = TestBars.flat(25, "100");
            bars.add(PriceBar.ofClose(TestBars.START.plusMinutes(25), new BigDecimal("80"), new BigDecimal("5000")));

            assertThat(signalEngine.analyze(bars)).isEmpty();
        }
    }

    // ==============================
    // CLASSIFICATION
    // ==============================

    @Nested
    @DisplayName("Z-score classification")
    class Classification {

        @Test
        @DisplayName("z exactly at -stdDevMultiplier is a strong BUY")
        void strongBoundaryInclusive() {
            TradingSignal signal = evaluate("80", meanAt100()).orElseThrow();

            assertThat(signal.getType()).isEqualTo(SignalType.BUY);
            assertThat(signal.getStrength()).isCloseTo(2.0 / 3, within(1e-9));
            assertThat(signal.getReason()).isEqualTo("Price 2.00 std devs below mean - strong oversold");
            assertThat(signal.getIndicators().getZScore()).isEqualByComparingTo("-2");
        }

        @Test
        @DisplayName("Moderate deviation gives strength |z|/2")
        void moderateBuy() {
            TradingSignal signal = evaluate("90", meanAt100()).orElseThrow();

            assertThat(signal.getType()).isEqualTo(SignalType.BUY);
            assertThat(signal.getStrength()).isEqualTo(0.5);
            assertThat(signal.getReason()).isEqualTo("Price 1.00 std devs below mean - moderate oversold");
        }

        @Test
        @DisplayName("Moderate SELL is capped at 0.7 before boosts")
        void moderateSellCapped() {
            TradingSignal signal = evaluate("119", meanAt100()).orElseThrow();

            assertThat(signal.getType()).isEqualTo(SignalType.SELL);
            assertThat(signal.getStrength()).isEqualTo(0.7);
            assertThat(signal.getReason()).contains("moderate overbought");
        }

        @Test
        @DisplayName("Moderate signal weaker than 0.3 is discarded")
        void weakModerateDiscarded() {
            assertThat(evaluate("95", meanAt100())).isEmpty();
        }

        @Test
        @DisplayName("Confirmation boost can lift a weak moderate signal over the floor")
        void boostLiftsWeakSignal() {
            Indicators withRsi = meanAt100().withRsi(new BigDecimal("25"));

            TradingSignal signal = evaluate("95", withRsi).orElseThrow();

            assertThat(signal.getStrength()).isCloseTo(0.45, within(1e-9));
            assertThat(signal.getReason()).endsWith(", RSI oversold");
        }

        @Test
        @DisplayName("Neutral zone HOLD is never emitted")
        void neutralZone() {
            assertThat(evaluate("100.5", meanAt100())).isEmpty();
        }

        @Test
        @DisplayName("Between exit and entry thresholds there is no signal")
        void deadBand() {
            assertThat(evaluate("103", meanAt100())).isEmpty();
            assertThat(evaluate("97", meanAt100())).isEmpty();
        }

        @Test
        @DisplayName("Strength is clamped to 1 after all boosts")
        void strengthClamped() {
            Indicators extreme = meanAt100().withRsi(new BigDecimal("5")).withEma(new BigDecimal("120"));

            TradingSignal signal = evaluate("50", extreme).orElseThrow();

            assertThat(signal.getStrength()).isEqualTo(1.0);
            assertThat(signal.getReason())
                    .contains("RSI oversold", "price below lower Bollinger Band", "counter-trend below EMA");
        }

        @Test
        @DisplayName("Zero standard deviation yields no signal")
        void zeroStdDev() {
            Indicators flat = meanAt100().withStdDev(BigDecimal.ZERO);

            assertThat(evaluate("80", flat)).isEmpty();
        }
    }

    // ==============================
    // SIZING
    // ==============================

    @Nested
    @DisplayName("Position sizing")
    class PositionSizing {

        private TradingSignal signalWithStrength(double strength) {
            return TradingSignal.builder()
                    .type(SignalType.BUY)
                    .strength(strength)
                    .price(new BigDecimal("100"))
                    .timestamp(NOW)
                    .build();
        }

        @Test
        @DisplayName("Risk-based ceiling wins on a small balance")
        void riskBasedCeiling() {
            BigDecimal size = signalEngine.calculatePositionSize(
                    signalWithStrength(0.5), new BigDecimal("1000"), new BigDecimal("100"));

            // 1000 x 0.02 / (100 x 0.05) = 4
            assertThat(size).isEqualByComparingTo("4");
        }

        @Test
        @DisplayName("Strength-scaled max position wins on a large balance")
        void strengthCeiling() {
            BigDecimal size = signalEngine.calculatePositionSize(
                    signalWithStrength(0.5), new BigDecimal("100000"), new BigDecimal("10"));

            assertThat(size).isEqualByComparingTo("500");
        }

        @Test
        @DisplayName("Affordability ceiling keeps a 5% buffer")
        void affordabilityCeiling() {
            SignalEngine generous = new SignalEngine(
                    StrategyParameters.defaults(),
                    RiskParameters.builder().riskPerTrade(new BigDecimal("0.1")).build());

            BigDecimal size = generous.calculatePositionSize(
                    signalWithStrength(1.0), new BigDecimal("1000"), new BigDecimal("200"));

            // risk-based 100 / 10 = 10, affordable 5 x 0.95 = 4.75
            assertThat(size).isEqualByComparingTo("4.75");
        }

        @Test
        @DisplayName("Zero balance or zero price sizes to zero")
        void zeroInputs() {
            assertThat(signalEngine.calculatePositionSize(signalWithStrength(1.0), BigDecimal.ZERO, BigDecimal.TEN))
                    .isEqualByComparingTo("0");
            assertThat(signalEngine.calculatePositionSize(signalWithStrength(1.0), BigDecimal.TEN, BigDecimal.ZERO))
                    .isEqualByComparingTo("0");
        }
    }

    // ==============================
    // RISK LEVELS
    // ==============================

    @Nested
    @DisplayName("Risk levels")
    class RiskLevelsTests {

        @Test
        @DisplayName("BUY stops below entry and takes profit above")
        void buyLevels() {
            RiskLevels levels = signalEngine.calculateRiskLevels(new BigDecimal("100"), SignalType.BUY);

            assertThat(levels.stopLoss()).isEqualByComparingTo("95");
            assertThat(levels.takeProfit()).isEqualByComparingTo("110");
        }

        @Test
        @DisplayName("SELL levels are mirrored")
        void sellLevels() {
            RiskLevels levels = signalEngine.calculateRiskLevels(new BigDecimal("100"), SignalType.SELL);

            assertThat(levels.stopLoss()).isEqualByComparingTo("105");
            assertThat(levels.takeProfit()).isEqualByComparingTo("90");
        }

        @Test
        @DisplayName("HOLD has no risk levels")
        void holdRejected() {
            assertThatThrownBy(() -> signalEngine.calculateRiskLevels(BigDecimal.TEN, SignalType.HOLD))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("Invalid parameters are rejected at construction")
    void invalidParameters() {
        StrategyParameters invalid = StrategyParameters.builder().maPeriod(1).build();

        assertThatThrownBy(() -> new SignalEngine(invalid, RiskParameters.defaults()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("maPeriod");
    }
}
