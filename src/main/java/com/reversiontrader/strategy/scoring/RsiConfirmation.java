package com.reversiontrader.strategy.scoring;

import com.reversiontrader.domain.enums.SignalType;
import java.math.BigDecimal;

/** +0.2 when RSI confirms: below 30 for a BUY, above 70 for a SELL. */
public class RsiConfirmation implements SignalAdjustment {

    static final BigDecimal OVERSOLD = BigDecimal.valueOf(30);
    static final BigDecimal OVERBOUGHT = BigDecimal.valueOf(70);
    static final double BOOST = 0.2;

    @Override
    public boolean isApplicable(SignalDraft draft) {
        return draft.getIndicators() != null && draft.getIndicators().hasRsi();
    }

    @Override
    public void apply(SignalDraft draft) {
        BigDecimal rsi = draft.getIndicators().getRsi();
        if (draft.getType() == SignalType.BUY && rsi.compareTo(OVERSOLD) < 0) {
            draft.boost(BOOST, "RSI oversold");
        } else if (draft.getType() == SignalType.SELL && rsi.compareTo(OVERBOUGHT) > 0) {
            draft.boost(BOOST, "RSI overbought");
        }
    }
}
