package com.riskledger.bus;

import com.riskledger.domain.model.TradeSignal;
import com.riskledger.event.RiskEvent;
import com.riskledger.event.RiskEventType;
import com.riskledger.event.RiskLevel;
import com.riskledger.exception.BaseException;
import com.riskledger.pipeline.AdmissionPipeline;
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
 * Consumes {@code strategy.signals.*} and runs each signal through admission. The outcome
 * leaves on the decision channels; nothing is returned to the sender here.
 */
@Component
public class SignalMessageListener implements MessageListener {

    private static final Logger log = LoggerFactory.getLogger(SignalMessageListener.class);

    private final AdmissionPipeline admissionPipeline;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher applicationEventPublisher;

    public SignalMessageListener(
            AdmissionPipeline admissionPipeline,
            ObjectMapper objectMapper,
            ApplicationEventPublisher applicationEventPublisher) {
        this.admissionPipeline = admissionPipeline;
        this.objectMapper = objectMapper;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String channel = new String(message.getChannel(), StandardCharsets.UTF_8);
        TradeSignal signal;
        try {
            signal = objectMapper.readValue(message.getBody(), TradeSignal.class);
        } catch (JacksonException e) {
            invalid(channel, null, "Undecodable signal: " + e.getOriginalMessage());
            return;
        }

        try {
            admissionPipeline.evaluate(signal);
        } catch (BaseException e) {
            invalid(channel, signal.getBacktestId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Signal processing failed on {}: {} | signal={}", channel, e.getMessage(), signal, e);
        }
    }

    private void invalid(String channel, String sessionId, String reason) {
        log.warn("Dropped message on {}: {}", channel, reason);
        applicationEventPublisher.publishEvent(new RiskEvent(
                this, sessionId, RiskEventType.INVALID_MESSAGE, RiskLevel.WARNING, reason,
                Map.of("channel", channel, "kind", "signal")));
    }
}
