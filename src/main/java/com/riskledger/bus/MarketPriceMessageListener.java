package com.riskledger.bus;

import com.riskledger.domain.model.MarketPriceUpdate;
import com.riskledger.pipeline.AdmissionPipeline;
import com.riskledger.pipeline.FillSequencer;
import com.riskledger.session.TradingSessionRegistry;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Consumes {@code market.prices.*}. Price batches share the per-session sequence with
 * fills, so a mark never lands between a fill and its bookkeeping.
 */
@Component
public class MarketPriceMessageListener implements MessageListener {

    private static final Logger log = LoggerFactory.getLogger(MarketPriceMessageListener.class);

    private final AdmissionPipeline admissionPipeline;
    private final FillSequencer fillSequencer;
    private final TradingSessionRegistry sessionRegistry;
    private final ObjectMapper objectMapper;

    public MarketPriceMessageListener(
            AdmissionPipeline admissionPipeline,
            FillSequencer fillSequencer,
            TradingSessionRegistry sessionRegistry,
            ObjectMapper objectMapper) {
        this.admissionPipeline = admissionPipeline;
        this.fillSequencer = fillSequencer;
        this.sessionRegistry = sessionRegistry;
        this.objectMapper = objectMapper;
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        MarketPriceUpdate update;
        try {
            update = objectMapper.readValue(message.getBody(), MarketPriceUpdate.class);
        } catch (JacksonException e) {
            log.warn("Undecodable price update on {}: {}",
                    new String(message.getChannel(), StandardCharsets.UTF_8), e.getOriginalMessage());
            return;
        }

        String sessionId = sessionRegistry.resolveSessionId(update.getSessionId());
        fillSequencer.submit(sessionId, () -> {
            try {
                admissionPipeline.onMarketPrices(update);
            } catch (RuntimeException e) {
                log.error("[{}] Price update failed: {}", sessionId, e.getMessage(), e);
            }
        });
    }
}
