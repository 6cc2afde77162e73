package com.reversiontrader.event;

import com.reversiontrader.domain.model.Trade;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every execution attempt, successful or FAILED.
 */
public class TradeEvent extends ApplicationEvent {

    private final Trade trade;

    public TradeEvent(Object source, Trade trade) {
        super(source);
        this.trade = trade;
    }

    public Trade getTrade() {
        return trade;
    }

    public boolean isSuccessful() {
        return trade.isSuccessful();
    }
}
