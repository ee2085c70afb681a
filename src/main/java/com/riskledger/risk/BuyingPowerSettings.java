package com.riskledger.risk;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** Settings under {@code risk-ledger.risk.buying-power}. */
@Value
@Builder
public class BuyingPowerSettings {

    public enum Mode {
        /** Read buying power from this process's own ledger snapshot. */
        LOCAL,
        /** Query a ledger service over HTTP, falling back to a local estimate on failure. */
        REMOTE
    }

    @Builder.Default
    Mode mode = Mode.LOCAL;

    String remoteUrl;

    @Builder.Default
    Duration timeout = Duration.ofSeconds(2);

    /** When false, a fallback quote can only ever reject. */
    @Builder.Default
    boolean allowFallbackApproval = true;
}
