package com.riskledger.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published for risk conditions worth alerting on: mode transitions, rejected fills and
 * undecodable bus messages. Listeners include the metrics service and the bus publisher
 * (which forwards mode changes to {@code risk.mode-change}).
 */
public class RiskEvent extends ApplicationEvent {

    private final String sessionId;
    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(Object source, String sessionId, RiskEventType eventType, RiskLevel level, String message) {
        this(source, sessionId, eventType, level, message, null);
    }

    public RiskEvent(
            Object source,
            String sessionId,
            RiskEventType eventType,
            RiskLevel level,
            String message,
            Map<String, Object> details) {
        super(source);
        this.sessionId = sessionId;
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public String getSessionId() {
        return sessionId;
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
     * For MODE_CHANGED: {"previousMode", "mode", "reason"}. For LEDGER_INCONSISTENCY:
     * the exception details (fillId, symbol).
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
