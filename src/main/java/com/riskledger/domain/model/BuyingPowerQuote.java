package com.riskledger.domain.model;

import com.riskledger.domain.enums.BuyingPowerSource;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Buying power figure plus where it came from; {@code error} explains a fallback. */
@Value
@Builder
public class BuyingPowerQuote {

    BigDecimal buyingPower;
    BuyingPowerSource source;
    BigDecimal portfolioValue;
    BigDecimal exposure;
    String error;

    public boolean isFallback() {
        return source == BuyingPowerSource.FALLBACK;
    }
}
