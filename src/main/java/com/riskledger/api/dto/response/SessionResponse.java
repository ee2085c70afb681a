package com.riskledger.api.dto.response;

import com.riskledger.domain.model.PortfolioState;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionResponse {

    private String sessionId;
    private Instant createdAt;
    private PortfolioState state;
}
