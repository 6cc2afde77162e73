package com.reversiontrader.strategy.scoring;

/**
 * One optional confirmation step in signal scoring.
 *
 * <p>Adjustments run in a fixed order after base classification and only when
 * {@link #isApplicable(SignalDraft)} holds, i.e. the indicator they rely on is
 * present. They never change the signal direction.
 */
public interface SignalAdjustment {

    /** True when the indicator this adjustment reads is available for the draft. */
    boolean isApplicable(SignalDraft draft);

    /** Applies the boost (if its condition holds) to an applicable draft. */
    void apply(SignalDraft draft);
}
