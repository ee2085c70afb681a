package com.riskledger.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** Opens a ledger session; capital defaults to the configured initial capital when omitted. */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionRequest {

    @NotBlank(message = "Session id is required")
    private String sessionId;

    @Positive(message = "Initial capital must be positive")
    private BigDecimal initialCapital;
}
