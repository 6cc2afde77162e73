package com.reversiontrader.risk;

import com.reversiontrader.domain.enums.PositionSide;
import com.reversiontrader.domain.model.Position;
import com.reversiontrader.domain.model.TradingSignal;
import com.reversiontrader.event.RiskEvent;
import com.reversiontrader.event.RiskEventType;
import com.reversiontrader.event.RiskLevel;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Risk gate for one account context.
 *
 * <p>Holds no positions itself; callers pass the current open set. Tracks two
 * running counters in {@link RiskState}: realized daily loss (reset on the first
 * check of a new calendar day) and peak balance / maximum drawdown observed.
 *
 * <p>Time-dependent checks take their reference time from the caller (signal
 * time, bar time) rather than the wall clock, so a backtest evaluates day
 * boundaries and position age against market time.
 *
 * <p>Public methods are synchronized: counters are mutated by the trading cycle
 * and read by metrics gauges from other threads.
 */
public class RiskManager {

    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    private static final MathContext MC = MathContext.DECIMAL128;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    static final BigDecimal MAX_EXPOSURE_FRACTION = new BigDecimal("0.5");
    static final BigDecimal RISK_STOP_DISTANCE = new BigDecimal("0.05");
    static final BigDecimal MIN_POSITION_VALUE = BigDecimal.TEN;
    static final double MIN_SIGNAL_STRENGTH = 0.4;
    static final BigDecimal DRAWDOWN_WARNING_THRESHOLD = new BigDecimal("0.05");
    static final Duration MAX_POSITION_AGE = Duration.ofHours(24);
    static final BigDecimal EMERGENCY_STOP_PERCENT = new BigDecimal("-10");
    static final BigDecimal DEFAULT_RISK_REWARD = BigDecimal.valueOf(2);

    private final RiskParameters riskParameters;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final RiskState state = new RiskState();

    public RiskManager(RiskParameters riskParameters, ApplicationEventPublisher applicationEventPublisher) {
        this.riskParameters = riskParameters.validate();
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ========================
    // PRE-TRADE VALIDATION
    // ========================

    /**
     * Validates a proposed trade. Checks run in order and the first failing
     * one wins:
     * <ol>
     *   <li>open position count below maxOpenPositions</li>
     *   <li>daily loss not above maxDailyLoss (counter rolls on a new day first)</li>
     *   <li>drawdown from peak not above maxDrawdown</li>
     *   <li>exposure within 50% of balance, shrinking the size to fit when possible</li>
     *   <li>size capped by risk-based size (5% stop) and maxPositionSize</li>
     *   <li>notional at least the $10 dust floor</li>
     *   <li>signal strength at least 0.4</li>
     * </ol>
     *
     * @param signal the BUY or SELL signal to act on
     * @param proposedSize size computed by the strategy
     * @param balance account balance the limits are measured against
     * @param openPositions positions currently held in this account context
     * @return approved, approved with a smaller size, or rejected with a reason
     */
    public synchronized RiskValidationResult validateTrade(
            TradingSignal signal, BigDecimal proposedSize, BigDecimal balance, List<Position> openPositions) {
        BigDecimal price = signal.getPrice();
        if (price == null || price.signum() <= 0) {
            return reject("Invalid signal price: " + price, Map.of());
        }

        // 1. Position count
        long openCount = openPositions.stream().filter(p -> !p.isClosed()).count();
        if (openCount >= riskParameters.getMaxOpenPositions()) {
            return reject(
                    "Maximum open positions (" + riskParameters.getMaxOpenPositions() + ") reached",
                    Map.of("openPositions", openCount));
        }

        // 2. Daily loss
        rollDailyLoss(signal.getTimestamp());
        if (isDailyLossLimitExceeded()) {
            return reject(
                    "Daily loss limit (" + money(riskParameters.getMaxDailyLoss()) + ") exceeded",
                    Map.of("dailyLoss", state.getDailyLoss()));
        }

        // 3. Drawdown, re-derived against the current balance
        if (isDrawdownLimitExceeded(balance)) {
            return reject(
                    "Maximum drawdown (" + percent(riskParameters.getMaxDrawdown(), 1) + ") exceeded",
                    Map.of("peakBalance", state.getPeakBalance(), "balance", balance));
        }

        // 4. Exposure
        BigDecimal size = proposedSize;
        boolean exposureLimited = false;
        BigDecimal currentExposure = calculateTotalExposure(openPositions);
        BigDecimal maxExposure = balance.multiply(MAX_EXPOSURE_FRACTION);
        if (currentExposure.add(size.multiply(price)).compareTo(maxExposure) > 0) {
            BigDecimal availableExposure = maxExposure.subtract(currentExposure);
            if (availableExposure.signum() <= 0) {
                return reject("Maximum exposure limit reached", Map.of("exposure", currentExposure));
            }
            size = availableExposure.divide(price, MC);
            exposureLimited = true;
        }

        // 5. Risk-based cap
        BigDecimal riskAmount = balance.multiply(riskParameters.getRiskPerTrade());
        BigDecimal riskBasedSize = riskAmount.divide(price.multiply(RISK_STOP_DISTANCE), MC);
        BigDecimal finalSize = size.min(riskBasedSize).min(riskParameters.getMaxPositionSize());

        // 6. Dust floor
        BigDecimal positionValue = finalSize.multiply(price);
        if (positionValue.compareTo(MIN_POSITION_VALUE) < 0) {
            return reject(
                    "Position value (" + money(positionValue) + ") below minimum ($" + MIN_POSITION_VALUE + ")",
                    Map.of("positionValue", positionValue));
        }

        // 7. Strength floor
        if (signal.getStrength() < MIN_SIGNAL_STRENGTH) {
            return reject(
                    String.format(Locale.ROOT, "Signal strength (%.2f) too weak (minimum: %.1f)", signal.getStrength(), MIN_SIGNAL_STRENGTH),
                    Map.of("strength", signal.getStrength()));
        }

        if (finalSize.compareTo(proposedSize) != 0) {
            String reason = exposureLimited
                    ? "Position size adjusted from " + proposedSize.setScale(4, RoundingMode.HALF_UP)
                            + " to " + finalSize.setScale(4, RoundingMode.HALF_UP) + " due to exposure limits"
                    : "Position size adjusted for risk management";
            log.info("Trade approved with adjusted size: {}", reason);
            return RiskValidationResult.adjusted(finalSize, reason);
        }
        return RiskValidationResult.approved();
    }

    private BigDecimal calculateTotalExposure(List<Position> positions) {
        return positions.stream()
                .filter(Position::isOpen)
                .map(Position::getMarketValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private boolean isDailyLossLimitExceeded() {
        return state.getDailyLoss().compareTo(riskParameters.getMaxDailyLoss()) > 0;
    }

    private boolean isDrawdownLimitExceeded(BigDecimal balance) {
        if (state.getPeakBalance().signum() == 0) {
            state.setPeakBalance(balance);
            return false;
        }
        return drawdownFrom(state.getPeakBalance(), balance).compareTo(riskParameters.getMaxDrawdown()) > 0;
    }

    private RiskValidationResult reject(String reason, Map<String, Object> details) {
        log.warn("Trade rejected by risk manager: {}", reason);
        publishRiskEvent(RiskEventType.TRADE_REJECTED, RiskLevel.WARNING, reason, details);
        return RiskValidationResult.rejected(reason);
    }

    // ========================
    // DAILY LOSS AND DRAWDOWN
    // ========================

    /**
     * Adds a realized loss (its magnitude) to the daily counter. The counter is
     * first zeroed if {@code asOf} falls on a later day than its last reset.
     */
    public synchronized void recordLoss(BigDecimal loss, LocalDateTime asOf) {
        rollDailyLoss(asOf);
        state.addDailyLoss(loss.abs());
        log.info(
                "Daily loss updated: {} (limit {})",
                money(state.getDailyLoss()),
                money(riskParameters.getMaxDailyLoss()));

        if (isDailyLossLimitExceeded()) {
            publishRiskEvent(
                    RiskEventType.DAILY_LOSS_LIMIT_BREACH,
                    RiskLevel.CRITICAL,
                    "Daily loss limit breached: " + money(state.getDailyLoss()),
                    Map.of("dailyLoss", state.getDailyLoss(), "limit", riskParameters.getMaxDailyLoss()));
        }
    }

    /**
     * Feeds current equity into peak/drawdown tracking. The peak only rises;
     * the maximum observed drawdown is kept separately from the per-check
     * drawdown used by {@link #validateTrade}.
     */
    public synchronized void updateDrawdown(BigDecimal equity) {
        if (equity.compareTo(state.getPeakBalance()) > 0) {
            state.setPeakBalance(equity);
        }
        if (state.getPeakBalance().signum() <= 0) {
            return;
        }

        BigDecimal drawdown = drawdownFrom(state.getPeakBalance(), equity);
        state.observeDrawdown(drawdown);

        if (drawdown.compareTo(DRAWDOWN_WARNING_THRESHOLD) > 0) {
            log.warn(
                    "Significant drawdown detected: current={}, max={}, peakBalance={}, currentBalance={}",
                    percent(drawdown, 2),
                    percent(state.getMaxDrawdownObserved(), 2),
                    money(state.getPeakBalance()),
                    money(equity));
            publishRiskEvent(
                    RiskEventType.DRAWDOWN_WARNING,
                    RiskLevel.WARNING,
                    "Drawdown at " + percent(drawdown, 2),
                    Map.of("drawdown", drawdown, "peakBalance", state.getPeakBalance()));
        }
    }

    private void rollDailyLoss(LocalDateTime asOf) {
        if (asOf != null && state.rollDailyLoss(asOf.toLocalDate())) {
            log.info("Daily loss counter reset for {}", asOf.toLocalDate());
        }
    }

    private static BigDecimal drawdownFrom(BigDecimal peak, BigDecimal value) {
        return peak.subtract(value).divide(peak, MC);
    }

    // ========================
    // EXIT RULES
    // ========================

    /**
     * Evaluates exit rules for an OPEN position with a known current price, in
     * priority order: stop-loss, take-profit, age over 24 hours, loss worse
     * than 10% (emergency stop). The first rule that fires wins.
     *
     * @param position the position to check
     * @param asOf reference time for the age rule
     */
    public ExitDecision shouldClosePosition(Position position, LocalDateTime asOf) {
        BigDecimal current = position.getCurrentPrice();
        if (!position.isOpen() || current == null) {
            return ExitDecision.hold();
        }
        boolean isLong = position.getSide() == PositionSide.LONG;

        BigDecimal stopLoss = position.getStopLoss();
        if (stopLoss != null) {
            int cmp = current.compareTo(stopLoss);
            if (isLong ? cmp <= 0 : cmp >= 0) {
                return exit(position, "Stop loss triggered");
            }
        }

        BigDecimal takeProfit = position.getTakeProfit();
        if (takeProfit != null) {
            int cmp = current.compareTo(takeProfit);
            if (isLong ? cmp >= 0 : cmp <= 0) {
                return exit(position, "Take profit reached");
            }
        }

        if (asOf != null
                && position.getEntryTime() != null
                && Duration.between(position.getEntryTime(), asOf).compareTo(MAX_POSITION_AGE) > 0) {
            return exit(position, "Position age exceeded 24 hours");
        }

        if (position.getPnlPercent() != null && position.getPnlPercent().compareTo(EMERGENCY_STOP_PERCENT) < 0) {
            return exit(position, "Emergency stop - loss exceeded 10%");
        }

        return ExitDecision.hold();
    }

    private ExitDecision exit(Position position, String reason) {
        log.info("Exit triggered for position {}: {}", position.getId(), reason);
        publishRiskEvent(
                RiskEventType.POSITION_EXIT_TRIGGERED,
                RiskLevel.INFO,
                reason,
                Map.of("positionId", position.getId()));
        return ExitDecision.close(reason);
    }

    // ========================
    // PROTECTIVE LEVELS
    // ========================

    /** Stop-loss price: 2 x ATR away from entry when ATR is given, otherwise 5%. */
    public BigDecimal calculateStopLoss(BigDecimal entryPrice, PositionSide side, BigDecimal atr) {
        BigDecimal distance = atr != null ? atr.multiply(BigDecimal.valueOf(2)) : entryPrice.multiply(RISK_STOP_DISTANCE);
        return side == PositionSide.LONG ? entryPrice.subtract(distance) : entryPrice.add(distance);
    }

    public BigDecimal calculateStopLoss(BigDecimal entryPrice, PositionSide side) {
        return calculateStopLoss(entryPrice, side, null);
    }

    /** Take-profit price: entry +/- entry x 5% x riskReward. */
    public BigDecimal calculateTakeProfit(BigDecimal entryPrice, PositionSide side, BigDecimal riskReward) {
        BigDecimal target = entryPrice.multiply(RISK_STOP_DISTANCE).multiply(riskReward);
        return side == PositionSide.LONG ? entryPrice.add(target) : entryPrice.subtract(target);
    }

    public BigDecimal calculateTakeProfit(BigDecimal entryPrice, PositionSide side) {
        return calculateTakeProfit(entryPrice, side, DEFAULT_RISK_REWARD);
    }

    // ========================
    // METRICS
    // ========================

    public synchronized RiskMetrics getRiskMetrics() {
        return RiskMetrics.builder()
                .dailyLoss(state.getDailyLoss())
                .dailyLossResetAt(state.getDailyLossResetAt())
                .peakBalance(state.getPeakBalance())
                .maxDrawdown(state.getMaxDrawdownObserved())
                .maxPositionSize(riskParameters.getMaxPositionSize())
                .maxOpenPositions(riskParameters.getMaxOpenPositions())
                .riskPerTrade(riskParameters.getRiskPerTrade())
                .maxDailyLoss(riskParameters.getMaxDailyLoss())
                .maxDrawdownLimit(riskParameters.getMaxDrawdown())
                .build();
    }

    /** Manual reset of every counter, e.g. at the start of a new trading period. */
    public synchronized void resetMetrics(LocalDateTime asOf) {
        state.reset(asOf != null ? asOf.toLocalDate() : null);
        log.info("Risk metrics reset");
    }

    public RiskParameters getRiskParameters() {
        return riskParameters;
    }

    private void publishRiskEvent(RiskEventType type, RiskLevel level, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(this, type, level, message, details));
    }

    private static String money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String percent(BigDecimal fraction, int scale) {
        return fraction.multiply(HUNDRED).setScale(scale, RoundingMode.HALF_UP).toPlainString() + "%";
    }
}
