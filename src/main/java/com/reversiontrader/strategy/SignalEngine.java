package com.reversiontrader.strategy;

import com.reversiontrader.domain.enums.SignalType;
import com.reversiontrader.domain.model.Indicators;
import com.reversiontrader.domain.model.PriceBar;
import com.reversiontrader.domain.model.TradingSignal;
import com.reversiontrader.indicator.IndicatorCalculator;
import com.reversiontrader.risk.RiskParameters;
import com.reversiontrader.strategy.scoring.BollingerBandConfirmation;
import com.reversiontrader.strategy.scoring.EmaTrendConfirmation;
import com.reversiontrader.strategy.scoring.RsiConfirmation;
import com.reversiontrader.strategy.scoring.SignalAdjustment;
import com.reversiontrader.strategy.scoring.SignalDraft;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mean-reversion decision policy: maps current price, volume and indicators to
 * a {@link TradingSignal}.
 *
 * <p>Classification by z-score = (price - SMA) / stdDev:
 * <ul>
 *   <li>z &lt;= -stdDevMultiplier: BUY, strength min(|z|/3, 1), strong oversold</li>
 *   <li>z &gt;= +stdDevMultiplier: SELL, strength min(|z|/3, 1), strong overbought</li>
 *   <li>-stdDevMultiplier &lt; z &lt;= -entryThreshold: BUY, strength min(|z|/2, 0.7)</li>
 *   <li>entryThreshold &lt;= z &lt; stdDevMultiplier: SELL, strength min(|z|/2, 0.7)</li>
 *   <li>|z| &lt; exitThreshold: HOLD, strength 0.1 (neutral zone)</li>
 * </ul>
 * Confirmation adjustments then run in order on BUY/SELL drafts. Anything whose
 * final strength is below {@value #MIN_SIGNAL_STRENGTH} is discarded.
 *
 * <p>Stateless apart from its configuration; identical inputs give identical output.
 */
public class SignalEngine {

    private static final Logger log = LoggerFactory.getLogger(SignalEngine.class);

    static final double MIN_SIGNAL_STRENGTH = 0.3;

    private static final MathContext MC = MathContext.DECIMAL128;
    private static final BigDecimal AFFORDABILITY_BUFFER = new BigDecimal("0.95");
    private static final double HOLD_STRENGTH = 0.1;
    private static final double MODERATE_STRENGTH_CAP = 0.7;

    private final StrategyParameters strategyParameters;
    private final RiskParameters riskParameters;
    private final IndicatorCalculator indicatorCalculator;
    private final List<SignalAdjustment> adjustments;

    public SignalEngine(StrategyParameters strategyParameters, RiskParameters riskParameters) {
        this(
                strategyParameters,
                riskParameters,
                new IndicatorCalculator(strategyParameters),
                defaultAdjustments());
    }

    public SignalEngine(
            StrategyParameters strategyParameters,
            RiskParameters riskParameters,
            IndicatorCalculator indicatorCalculator,
            List<SignalAdjustment> adjustments) {
        this.strategyParameters = strategyParameters.validate();
        this.riskParameters = riskParameters.validate();
        this.indicatorCalculator = indicatorCalculator;
        this.adjustments = List.copyOf(adjustments);
    }

    /** RSI, then Bollinger band, then EMA trend. */
    public static List<SignalAdjustment> defaultAdjustments() {
        return List.of(new RsiConfirmation(), new BollingerBandConfirmation(), new EmaTrendConfirmation());
    }

    /**
     * Analyzes a price window (oldest first). The last bar supplies the current
     * price, volume and the signal timestamp.
     *
     * @return the signal, or empty for insufficient data, low volume, zero
     *     variance, an unclassified z-score or a strength below the floor
     */
    public Optional<TradingSignal> analyze(List<PriceBar> window) {
        if (window == null || window.size() < strategyParameters.getMaPeriod()) {
            log.debug(
                    "Insufficient data for analysis. Need {} bars, have {}",
                    strategyParameters.getMaPeriod(),
                    window == null ? 0 : window.size());
            return Optional.empty();
        }

        List<BigDecimal> closes = window.stream().map(PriceBar::getClose).collect(Collectors.toList());
        Optional<Indicators> indicators = indicatorCalculator.calculate(closes);
        if (indicators.isEmpty()) {
            return Optional.empty();
        }

        PriceBar last = window.get(window.size() - 1);
        Optional<TradingSignal> signal = evaluate(last.getClose(), indicators.get(), last.getVolume(), last.getTimestamp());
        signal.ifPresent(s -> log.info(
                "Trading signal generated: type={}, price={}, zScore={}, sma={}, strength={}",
                s.getType(),
                s.getPrice().toPlainString(),
                s.getIndicators().getZScore(),
                s.getIndicators().getSma(),
                s.getStrength()));
        return signal;
    }

    /**
     * Applies the decision policy to a precomputed indicator snapshot.
     */
    public Optional<TradingSignal> evaluate(
            BigDecimal price, Indicators indicators, BigDecimal volume, LocalDateTime timestamp) {
        if (volume.compareTo(strategyParameters.getMinVolume()) < 0) {
            log.debug("Volume too low for trading signal: {} < {}", volume, strategyParameters.getMinVolume());
            return Optional.empty();
        }
        if (indicators.getStdDev().signum() == 0) {
            log.debug("Zero variance in window, no z-score signal");
            return Optional.empty();
        }

        BigDecimal zScore = price.subtract(indicators.getSma()).divide(indicators.getStdDev(), MC);
        Indicators snapshot = indicators.withZScore(zScore);

        SignalDraft draft = classify(price, zScore, snapshot);
        if (draft == null) {
            return Optional.empty();
        }

        if (draft.getType() != SignalType.HOLD) {
            for (SignalAdjustment adjustment : adjustments) {
                if (adjustment.isApplicable(draft)) {
                    adjustment.apply(draft);
                }
            }
        }

        if (draft.getStrength() < MIN_SIGNAL_STRENGTH) {
            log.debug("Discarding {} signal with strength {}", draft.getType(), draft.getStrength());
            return Optional.empty();
        }

        return Optional.of(TradingSignal.builder()
                .type(draft.getType())
                .strength(draft.getStrength())
                .price(price)
                .timestamp(timestamp)
                .indicators(snapshot)
                .reason(draft.getReason())
                .build());
    }

    private SignalDraft classify(BigDecimal price, BigDecimal zScore, Indicators snapshot) {
        BigDecimal strong = strategyParameters.getStdDevMultiplier();
        BigDecimal entry = strategyParameters.getEntryThreshold();
        BigDecimal absZ = zScore.abs();
        double absZValue = absZ.doubleValue();
        String deviation = absZ.setScale(2, RoundingMode.HALF_UP).toPlainString();

        if (zScore.compareTo(strong.negate()) <= 0) {
            return new SignalDraft(
                    SignalType.BUY,
                    Math.min(absZValue / 3, 1.0),
                    "Price " + deviation + " std devs below mean - strong oversold",
                    price,
                    snapshot);
        }
        if (zScore.compareTo(strong) >= 0) {
            return new SignalDraft(
                    SignalType.SELL,
                    Math.min(absZValue / 3, 1.0),
                    "Price " + deviation + " std devs above mean - strong overbought",
                    price,
                    snapshot);
        }
        if (zScore.compareTo(entry.negate()) <= 0) {
            return new SignalDraft(
                    SignalType.BUY,
                    Math.min(absZValue / 2, MODERATE_STRENGTH_CAP),
                    "Price " + deviation + " std devs below mean - moderate oversold",
                    price,
                    snapshot);
        }
        if (zScore.compareTo(entry) >= 0) {
            return new SignalDraft(
                    SignalType.SELL,
                    Math.min(absZValue / 2, MODERATE_STRENGTH_CAP),
                    "Price " + deviation + " std devs above mean - moderate overbought",
                    price,
                    snapshot);
        }
        if (absZ.compareTo(strategyParameters.getExitThreshold()) < 0) {
            return new SignalDraft(SignalType.HOLD, HOLD_STRENGTH, "Price near mean - neutral zone", price, snapshot);
        }
        return null;
    }

    // ========================
    // SIZING AND RISK LEVELS
    // ========================

    /**
     * Position size as the minimum of three ceilings: strength-scaled max
     * position, the size whose stop-loss distance risks {@code riskPerTrade} of
     * balance, and what the balance affords with a 5% buffer.
     */
    public BigDecimal calculatePositionSize(TradingSignal signal, BigDecimal availableBalance, BigDecimal price) {
        if (price.signum() <= 0 || availableBalance.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal strengthBased = riskParameters.getMaxPositionSize().multiply(BigDecimal.valueOf(signal.getStrength()));

        BigDecimal riskAmount = availableBalance.multiply(riskParameters.getRiskPerTrade());
        BigDecimal stopLossDistance = price.multiply(strategyParameters.getStopLossPercent());
        BigDecimal riskBased = riskAmount.divide(stopLossDistance, MC);

        BigDecimal affordable = availableBalance.divide(price, MC).multiply(AFFORDABILITY_BUFFER);

        return strengthBased.min(riskBased).min(affordable);
    }

    /**
     * Percent offsets from entry: BUY stops below and takes profit above;
     * SELL is mirrored.
     */
    public RiskLevels calculateRiskLevels(BigDecimal entryPrice, SignalType signalType) {
        BigDecimal stopLoss = strategyParameters.getStopLossPercent();
        BigDecimal takeProfit = strategyParameters.getTakeProfitPercent();
        if (signalType == SignalType.BUY) {
            return new RiskLevels(
                    entryPrice.multiply(BigDecimal.ONE.subtract(stopLoss)),
                    entryPrice.multiply(BigDecimal.ONE.add(takeProfit)));
        }
        if (signalType == SignalType.SELL) {
            return new RiskLevels(
                    entryPrice.multiply(BigDecimal.ONE.add(stopLoss)),
                    entryPrice.multiply(BigDecimal.ONE.subtract(takeProfit)));
        }
        throw new IllegalArgumentException("Risk levels are only defined for BUY or SELL, got " + signalType);
    }

    public StrategyParameters getStrategyParameters() {
        return strategyParameters;
    }

    public RiskParameters getRiskParameters() {
        return riskParameters;
    }
}
