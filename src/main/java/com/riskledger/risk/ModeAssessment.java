package com.riskledger.risk;

import com.riskledger.domain.enums.TradingMode;
import lombok.Value;

/** Derived trading mode together with the condition that produced it. */
@Value
public class ModeAssessment {

    TradingMode mode;
    String reason;
    LossMeasures measures;
}
