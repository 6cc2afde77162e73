package com.reversiontrader.event;

import com.reversiontrader.domain.model.TradingSignal;
import org.springframework.context.ApplicationEvent;

/** Published by the live trading cycle for every signal the engine emits. */
public class SignalEvent extends ApplicationEvent {

    private final TradingSignal signal;

    public SignalEvent(Object source, TradingSignal signal) {
        super(source);
        this.signal = signal;
    }

    public TradingSignal getSignal() {
        return signal;
    }
}
