package com.reversiontrader.domain.enums;

/**
 * Direction of a trading signal emitted by the SignalEngine.
 * HOLD is informative only; exits are decided by the RiskManager.
 */
public enum SignalType {
    BUY,
    SELL,
    HOLD;

    /** Maps an actionable signal to the order side that executes it. */
    public OrderSide toOrderSide() {
        if (this == HOLD) {
            throw new IllegalStateException("HOLD signals are not executable");
        }
        return this == BUY ? OrderSide.BUY : OrderSide.SELL;
    }
}
