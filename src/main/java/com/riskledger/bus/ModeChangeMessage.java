package com.riskledger.bus;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Payload on {@code risk.mode-change}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModeChangeMessage {

    private String sessionId;
    private String previousMode;
    private String mode;
    private String reason;
    private Instant changedAt;
}
