package com.reversiontrader.risk;

import com.reversiontrader.exception.ConfigurationException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable risk limits for one account context.
 *
 * <p>{@code maxDailyLoss} is an absolute amount in account currency;
 * {@code maxDrawdown} and {@code riskPerTrade} are fractions (0.2 = 20%).
 * {@code maxPositionSize} is in instrument units.
 */
@Value
@Builder(toBuilder = true)
public class RiskParameters {

    /** Upper bound accepted for riskPerTrade. */
    public static final BigDecimal MAX_RISK_PER_TRADE = new BigDecimal("0.1");

    @Builder.Default
    BigDecimal maxPositionSize = new BigDecimal("1000");

    @Builder.Default
    int maxOpenPositions = 3;

    @Builder.Default
    BigDecimal riskPerTrade = new BigDecimal("0.02");

    @Builder.Default
    BigDecimal maxDailyLoss = new BigDecimal("100");

    @Builder.Default
    BigDecimal maxDrawdown = new BigDecimal("0.2");

    public static RiskParameters defaults() {
        return RiskParameters.builder().build();
    }

    /**
     * Checks limit sanity and throws a {@link ConfigurationException} listing
     * every violation.
     *
     * @return this, for chaining at construction sites
     */
    public RiskParameters validate() {
        List<String> errors = new ArrayList<>();
        if (maxPositionSize == null || maxPositionSize.signum() <= 0) {
            errors.add("maxPositionSize must be positive (was " + maxPositionSize + ")");
        }
        if (maxOpenPositions < 1) {
            errors.add("maxOpenPositions must be at least 1 (was " + maxOpenPositions + ")");
        }
        if (riskPerTrade == null || riskPerTrade.signum() <= 0) {
            errors.add("riskPerTrade must be positive (was " + riskPerTrade + ")");
        } else if (riskPerTrade.compareTo(MAX_RISK_PER_TRADE) > 0) {
            errors.add("riskPerTrade should not exceed 10% (0.1) (was " + riskPerTrade + ")");
        }
        if (maxDailyLoss == null || maxDailyLoss.signum() <= 0) {
            errors.add("maxDailyLoss must be positive (was " + maxDailyLoss + ")");
        }
        if (maxDrawdown == null || maxDrawdown.signum() <= 0 || maxDrawdown.compareTo(BigDecimal.ONE) > 0) {
            errors.add("maxDrawdown must be in (0, 1] (was " + maxDrawdown + ")");
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
        return this;
    }
}
