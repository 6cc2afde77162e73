package com.reversiontrader.strategy;

import com.reversiontrader.domain.enums.SignalType;
import com.reversiontrader.domain.model.TradingSignal;
import java.time.Duration;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cycle-to-cycle memory of the last accepted signal. A signal of the same type
 * arriving within the window of the last accepted one is ignored, so a
 * persistent deviation does not re-enter on every cycle.
 *
 * <p>Owned by the orchestrating caller (one instance per trading loop); the
 * SignalEngine itself stays stateless.
 */
public class SignalDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(SignalDeduplicator.class);

    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(5);

    private final Duration window;
    private SignalType lastType;
    private LocalDateTime lastTimestamp;

    public SignalDeduplicator() {
        this(DEFAULT_WINDOW);
    }

    public SignalDeduplicator(Duration window) {
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("Deduplication window must be non-negative");
        }
        this.window = window;
    }

    /**
     * Returns true and remembers the signal when it should be acted upon;
     * false when it repeats the last accepted type inside the window.
     */
    public synchronized boolean accept(TradingSignal signal) {
        if (lastType == signal.getType()
                && lastTimestamp != null
                && Duration.between(lastTimestamp, signal.getTimestamp()).compareTo(window) < 0) {
            log.debug("Ignoring duplicate {} signal within {}", signal.getType(), window);
            return false;
        }
        lastType = signal.getType();
        lastTimestamp = signal.getTimestamp();
        return true;
    }

    public synchronized void reset() {
        lastType = null;
        lastTimestamp = null;
    }

    public Duration getWindow() {
        return window;
    }
}
