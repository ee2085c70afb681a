package com.riskledger.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import java.math.BigDecimal;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Batch of latest prices for one session, as received from the market data feed. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketPriceUpdate {

    @JsonAlias({"session_id", "backtestId", "backtest_id"})
    private String sessionId;

    private Map<String, BigDecimal> prices;
}
