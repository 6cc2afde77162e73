package com.reversiontrader.risk;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Getter;

/**
 * Running counters of one account context: realized loss for the current
 * day, the day that counter belongs to, peak balance and the largest drawdown
 * observed so far.
 *
 * <p>Lives as long as its RiskManager. Only two things reset it: the first
 * check on a later calendar day (daily loss only) and an explicit
 * {@link RiskManager#resetMetrics}.
 */
@Getter
public class RiskState {

    private BigDecimal dailyLoss = BigDecimal.ZERO;
    private LocalDate dailyLossResetAt;
    private BigDecimal peakBalance = BigDecimal.ZERO;
    private BigDecimal maxDrawdownObserved = BigDecimal.ZERO;

    /**
     * Zeroes the daily loss if {@code day} is after the day the counter was
     * last reset. The first day ever seen only anchors the counter.
     *
     * @return true if the counter was reset
     */
    boolean rollDailyLoss(LocalDate day) {
        if (day == null) {
            return false;
        }
        if (dailyLossResetAt == null) {
            dailyLossResetAt = day;
            return false;
        }
        if (day.isAfter(dailyLossResetAt)) {
            dailyLoss = BigDecimal.ZERO;
            dailyLossResetAt = day;
            return true;
        }
        return false;
    }

    void addDailyLoss(BigDecimal loss) {
        dailyLoss = dailyLoss.add(loss);
    }

    void setPeakBalance(BigDecimal peakBalance) {
        this.peakBalance = peakBalance;
    }

    void observeDrawdown(BigDecimal drawdown) {
        if (drawdown.compareTo(maxDrawdownObserved) > 0) {
            maxDrawdownObserved = drawdown;
        }
    }

    void reset(LocalDate day) {
        dailyLoss = BigDecimal.ZERO;
        dailyLossResetAt = day;
        peakBalance = BigDecimal.ZERO;
        maxDrawdownObserved = BigDecimal.ZERO;
    }
}
