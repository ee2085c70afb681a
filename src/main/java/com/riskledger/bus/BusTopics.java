package com.riskledger.bus;

import lombok.Builder;
import lombok.Value;

/**
 * Channel names on the Redis pub/sub bus. Inbound names are subscription patterns;
 * outbound decision channels are prefixes completed with the signal's symbol.
 */
@Value
@Builder
public class BusTopics {

    String signalsPattern;
    String fillsPattern;
    String pricesPattern;
    String approvedPrefix;
    String rejectedPrefix;
    String modeChange;
    String stats;

    public String approved(String symbol) {
        return approvedPrefix + symbol;
    }

    public String rejected(String symbol) {
        return rejectedPrefix + symbol;
    }
}
