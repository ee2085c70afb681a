package com.riskledger.risk;

import com.riskledger.domain.enums.TradingMode;
import com.riskledger.event.RiskEvent;
import com.riskledger.event.RiskEventType;
import com.riskledger.event.RiskLevel;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Remembers the last mode reported per session, only to notice transitions. The mode
 * itself is always recomputed by {@link ModeController}; nothing here feeds back into a
 * risk decision.
 */
@Component
public class ModeTransitionTracker {

    private static final Logger log = LoggerFactory.getLogger(ModeTransitionTracker.class);

    private final Map<String, TradingMode> lastReported = new ConcurrentHashMap<>();
    private final ApplicationEventPublisher applicationEventPublisher;

    public ModeTransitionTracker(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /** Publishes a MODE_CHANGED event when the session's mode differs from the last one seen. */
    public void observe(String sessionId, ModeAssessment assessment) {
        TradingMode current = assessment.getMode();
        TradingMode previous = lastReported.put(sessionId, current);
        TradingMode baseline = previous != null ? previous : TradingMode.NORMAL;
        if (baseline == current) {
            return;
        }

        RiskLevel level = current == TradingMode.LOCKDOWN
                ? RiskLevel.CRITICAL
                : current == TradingMode.DEFENSIVE ? RiskLevel.WARNING : RiskLevel.INFO;
        log.warn("[{}] Trading mode {} -> {}: {}", sessionId, baseline, current, assessment.getReason());
        applicationEventPublisher.publishEvent(new RiskEvent(
                this,
                sessionId,
                RiskEventType.MODE_CHANGED,
                level,
                "Trading mode changed from " + baseline + " to " + current,
                Map.of("previousMode", baseline.name(), "mode", current.name(), "reason", assessment.getReason())));
    }

    public void forget(String sessionId) {
        lastReported.remove(sessionId);
    }
}
