package com.reversiontrader.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the RiskManager and the trading cycle when a risk condition is
 * detected or a periodic snapshot is taken.
 *
 * <p>Listeners are fire-and-forget consumers (metrics, logging); they never
 * influence the decision that produced the event.
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(Object source, RiskEventType eventType, RiskLevel level, String message) {
        this(source, eventType, level, message, null);
    }

    public RiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Condition-specific values, e.g. {"dailyLoss": 120.50, "limit": 100} for
     * DAILY_LOSS_LIMIT_BREACH or {"drawdown": 0.07} for DRAWDOWN_WARNING.
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
