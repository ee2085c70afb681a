package com.riskledger.bus;

import com.riskledger.domain.model.Fill;
import com.riskledger.event.RiskEvent;
import com.riskledger.event.RiskEventType;
import com.riskledger.event.RiskLevel;
import com.riskledger.exception.FillValidationException;
import com.riskledger.exception.LedgerConsistencyException;
import com.riskledger.pipeline.AdmissionPipeline;
import com.riskledger.pipeline.FillSequencer;
import com.riskledger.session.TradingSessionRegistry;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Consumes {@code execution.fills.*}. Decoding happens on the bus thread; booking is
 * handed to {@link FillSequencer} so fills of one session stay in arrival order while
 * other sessions proceed in parallel.
 */
@Component
public class FillMessageListener implements MessageListener {

    private static final Logger log = LoggerFactory.getLogger(FillMessageListener.class);

    private final AdmissionPipeline admissionPipeline;
    private final FillSequencer fillSequencer;
    private final TradingSessionRegistry sessionRegistry;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher applicationEventPublisher;

    public FillMessageListener(
            AdmissionPipeline admissionPipeline,
            FillSequencer fillSequencer,
            TradingSessionRegistry sessionRegistry,
            ObjectMapper objectMapper,
            ApplicationEventPublisher applicationEventPublisher) {
        this.admissionPipeline = admissionPipeline;
        this.fillSequencer = fillSequencer;
        this.sessionRegistry = sessionRegistry;
        this.objectMapper = objectMapper;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String channel = new String(message.getChannel(), StandardCharsets.UTF_8);
        Fill fill;
        try {
            fill = objectMapper.readValue(message.getBody(), Fill.class);
        } catch (JacksonException e) {
            invalid(channel, null, "Undecodable fill: " + e.getOriginalMessage());
            return;
        }

        String sessionId = sessionRegistry.resolveSessionId(fill.getBacktestId());
        fillSequencer.submit(sessionId, () -> apply(channel, sessionId, fill));
    }

    void apply(String channel, String sessionId, Fill fill) {
        try {
            admissionPipeline.onFill(fill);
        } catch (FillValidationException e) {
            invalid(channel, sessionId, e.getMessage());
        } catch (LedgerConsistencyException e) {
            // already logged and announced by the pipeline
            log.debug("[{}] Fill {} not applied: {}", sessionId, fill.getFillId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Fill processing failed: {} | fill={}", sessionId, e.getMessage(), fill, e);
        }
    }

    private void invalid(String channel, String sessionId, String reason) {
        log.warn("Dropped message on {}: {}", channel, reason);
        applicationEventPublisher.publishEvent(new RiskEvent(
                this, sessionId, RiskEventType.INVALID_MESSAGE, RiskLevel.WARNING, reason,
                Map.of("channel", channel, "kind", "fill")));
    }
}
