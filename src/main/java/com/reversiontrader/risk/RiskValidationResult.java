package com.reversiontrader.risk;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of {@link RiskManager#validateTrade}.
 *
 * <p>Three shapes: approved as proposed, approved with a smaller
 * {@code adjustedSize}, or rejected. Rejections and adjustments carry a
 * human-readable reason. An adjusted size is never larger than the proposed one.
 */
@Getter
@ToString
public class RiskValidationResult {

    private final boolean allowed;
    private final String reason;
    private final BigDecimal adjustedSize;

    private RiskValidationResult(boolean allowed, String reason, BigDecimal adjustedSize) {
        this.allowed = allowed;
        this.reason = reason;
        this.adjustedSize = adjustedSize;
    }

    public static RiskValidationResult approved() {
        return new RiskValidationResult(true, null, null);
    }

    public static RiskValidationResult adjusted(BigDecimal adjustedSize, String reason) {
        return new RiskValidationResult(true, reason, adjustedSize);
    }

    public static RiskValidationResult rejected(String reason) {
        return new RiskValidationResult(false, reason, null);
    }

    public boolean isRejected() {
        return !allowed;
    }

    public boolean isAdjusted() {
        return adjustedSize != null;
    }

    /** Size to execute: the adjusted size if any, otherwise the proposed one. */
    public BigDecimal sizeOr(BigDecimal proposedSize) {
        return adjustedSize != null ? adjustedSize : proposedSize;
    }
}
