package com.reversiontrader.strategy.scoring;

import com.reversiontrader.domain.enums.SignalType;

/** +0.1 when price sits beyond the band on the signal's side. */
public class BollingerBandConfirmation implements SignalAdjustment {

    static final double BOOST = 0.1;

    @Override
    public boolean isApplicable(SignalDraft draft) {
        return draft.getIndicators() != null
                && draft.getIndicators().getLowerBand() != null
                && draft.getIndicators().getUpperBand() != null;
    }

    @Override
    public void apply(SignalDraft draft) {
        if (draft.getType() == SignalType.BUY
                && draft.getPrice().compareTo(draft.getIndicators().getLowerBand()) < 0) {
            draft.boost(BOOST, "price below lower Bollinger Band");
        } else if (draft.getType() == SignalType.SELL
                && draft.getPrice().compareTo(draft.getIndicators().getUpperBand()) > 0) {
            draft.boost(BOOST, "price above upper Bollinger Band");
        }
    }
}
