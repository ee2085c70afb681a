package com.riskledger.bus;

import com.riskledger.domain.model.AdmissionDecision;
import com.riskledger.domain.model.DailyStats;
import com.riskledger.event.RiskEvent;
import com.riskledger.event.RiskEventType;
import com.riskledger.risk.RiskDecision;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Publishes admission outcomes and mode transitions to the bus.
 *
 * <p>A decision is final once made; a failed publish is logged and counted but never
 * turns an approval into an error for the caller.
 */
@Component
public class DecisionPublisher {

    private static final Logger log = LoggerFactory.getLogger(DecisionPublisher.class);

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final BusTopics busTopics;
    private final Clock clock;
    private final AtomicLong publishFailures = new AtomicLong();

    public DecisionPublisher(
            StringRedisTemplate stringRedisTemplate, ObjectMapper objectMapper, BusTopics busTopics, Clock clock) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.objectMapper = objectMapper;
        this.busTopics = busTopics;
        this.clock = clock;
    }

    public void publishDecision(AdmissionDecision admission) {
        RiskDecision decision = admission.getDecision();
        String symbol = admission.getSignal().getSymbol();

        DecisionMessage.DecisionMessageBuilder message = DecisionMessage.builder()
                .signal(admission.getSignal())
                .sessionId(admission.getSessionId())
                .mode(admission.getMode())
                .riskScore(decision.getScore());

        if (admission.isApproved()) {
            send(busTopics.approved(symbol), message.approvedAt(admission.getEvaluatedAt()).build());
        } else {
            send(busTopics.rejected(symbol), message
                    .rejectionReason(decision.getReason())
                    .rejectedBy(decision.getRuleName())
                    .rejectionDetails(decision.getDetails())
                    .rejectedAt(admission.getEvaluatedAt())
                    .build());
        }
    }

    /** Day aggregates after each decision, for dashboards. */
    public void publishStats(AdmissionDecision admission, DailyStats stats) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", admission.getSessionId());
        payload.put("timestamp", clock.instant());
        payload.put("dailyStats", stats);
        payload.put("mode", admission.getMode());
        payload.put("portfolioValue", admission.getPortfolioValue());
        send(busTopics.getStats(), payload);
    }

    @EventListener
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() != RiskEventType.MODE_CHANGED) {
            return;
        }
        Map<String, Object> details = event.getDetails();
        send(busTopics.getModeChange(), ModeChangeMessage.builder()
                .sessionId(event.getSessionId())
                .previousMode(String.valueOf(details.get("previousMode")))
                .mode(String.valueOf(details.get("mode")))
                .reason(String.valueOf(details.get("reason")))
                .changedAt(clock.instant())
                .build());
    }

    public long getPublishFailures() {
        return publishFailures.get();
    }

    private void send(String channel, Object payload) {
        try {
            stringRedisTemplate.convertAndSend(channel, objectMapper.writeValueAsString(payload));
        } catch (RuntimeException e) {
            long failures = publishFailures.incrementAndGet();
            log.error("Failed to publish to {} ({} failures total): {}", channel, failures, e.getMessage());
        }
    }
}
