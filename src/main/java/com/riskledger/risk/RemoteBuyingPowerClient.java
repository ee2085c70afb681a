package com.riskledger.risk;

import com.riskledger.api.dto.response.BuyingPowerResponse;
import com.riskledger.exception.BuyingPowerUnavailableException;
import java.math.BigDecimal;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * HTTP client for the ledger's {@code GET /api/portfolio/buying-power/{sessionId}} endpoint.
 * Timeouts are set on the {@link RestClient} by {@code BuyingPowerConfig}.
 */
public class RemoteBuyingPowerClient {

    static final String BUYING_POWER_PATH = "/api/portfolio/buying-power/{sessionId}";

    private final RestClient restClient;

    public RemoteBuyingPowerClient(RestClient restClient) {
        this.restClient = restClient;
    }

    public BigDecimal fetchBuyingPower(String sessionId) {
        Envelope envelope;
        try {
            envelope = restClient.get().uri(BUYING_POWER_PATH, sessionId).retrieve().body(Envelope.class);
        } catch (RestClientException e) {
            throw new BuyingPowerUnavailableException(
                    "Buying power query failed for session " + sessionId + ": " + e.getMessage(), e);
        }
        if (envelope == null || envelope.getData() == null || envelope.getData().getBuyingPower() == null) {
            throw new BuyingPowerUnavailableException("Empty buying power response for session " + sessionId);
        }
        return envelope.getData().getBuyingPower();
    }

    @Data
    @NoArgsConstructor
    static class Envelope {
        private boolean success;
        private BuyingPowerResponse data;
    }
}
