package com.riskledger.bus;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.riskledger.domain.enums.TradingMode;
import com.riskledger.domain.model.TradeSignal;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outbound payload on {@code risk.approved.<symbol>} and {@code risk.rejected.<symbol>}:
 * the original signal's fields at top level, followed by the decision annotations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DecisionMessage {

    @JsonUnwrapped
    private TradeSignal signal;

    private String sessionId;
    private TradingMode mode;
    private Double riskScore;

    // Rejections only
    private String rejectionReason;
    private String rejectedBy;
    private Map<String, Object> rejectionDetails;
    private Instant rejectedAt;

    // Approvals only
    private Instant approvedAt;
}
