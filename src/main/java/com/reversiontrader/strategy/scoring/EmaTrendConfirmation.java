package com.reversiontrader.strategy.scoring;

import com.reversiontrader.domain.enums.SignalType;

/**
 * +0.05 when the EMA trend opposes the reversion direction: a BUY while price is
 * not above the EMA (bearish bias), or a SELL while price is above it (bullish
 * bias). Counter-trend reversion is scored as the stronger setup.
 */
public class EmaTrendConfirmation implements SignalAdjustment {

    static final double BOOST = 0.05;

    @Override
    public boolean isApplicable(SignalDraft draft) {
        return draft.getIndicators() != null && draft.getIndicators().hasEma();
    }

    @Override
    public void apply(SignalDraft draft) {
        boolean bullish = draft.getPrice().compareTo(draft.getIndicators().getEma()) > 0;
        if (draft.getType() == SignalType.BUY && !bullish) {
            draft.boost(BOOST, "counter-trend below EMA");
        } else if (draft.getType() == SignalType.SELL && bullish) {
            draft.boost(BOOST, "counter-trend above EMA");
        }
    }
}
