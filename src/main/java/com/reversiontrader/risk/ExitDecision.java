package com.reversiontrader.risk;

import lombok.Value;

/** Result of {@link RiskManager#shouldClosePosition}: whether to exit and why. */
@Value
public class ExitDecision {

    private static final ExitDecision HOLD = new ExitDecision(false, null);

    boolean shouldClose;
    String reason;

    public static ExitDecision hold() {
        return HOLD;
    }

    public static ExitDecision close(String reason) {
        return new ExitDecision(true, reason);
    }
}
