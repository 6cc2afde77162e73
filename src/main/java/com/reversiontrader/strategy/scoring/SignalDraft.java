package com.reversiontrader.strategy.scoring;

import com.reversiontrader.domain.enums.SignalType;
import com.reversiontrader.domain.model.Indicators;
import java.math.BigDecimal;
import lombok.Getter;

/**
 * Working copy of a signal while its strength is being scored. Base
 * classification fills type/strength/reason; each {@link SignalAdjustment}
 * may then boost strength and append to the reason.
 */
@Getter
public class SignalDraft {

    private final SignalType type;
    private final BigDecimal price;
    private final Indicators indicators;
    private double strength;
    private final StringBuilder reason;

    public SignalDraft(SignalType type, double strength, String reason, BigDecimal price, Indicators indicators) {
        this.type = type;
        this.strength = clamp(strength);
        this.reason = new StringBuilder(reason);
        this.price = price;
        this.indicators = indicators;
    }

    /** Adds to strength, capped at 1.0, and appends a note to the reason. */
    public void boost(double amount, String note) {
        strength = clamp(strength + amount);
        if (note != null && !note.isEmpty()) {
            reason.append(", ").append(note);
        }
    }

    public String getReason() {
        return reason.toString();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(value, 1.0));
    }
}
