package com.riskledger.risk;

import com.riskledger.domain.enums.TradingMode;
import com.riskledger.domain.model.BuyingPowerQuote;
import com.riskledger.domain.model.DailyStats;
import com.riskledger.domain.model.PortfolioState;
import com.riskledger.domain.model.TradeSignal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable inputs for one evaluation of the rule chain. All snapshots are taken once,
 * before the first rule runs, so every rule sees the same account picture.
 */
@Value
@Builder
public class RiskContext {

    TradeSignal signal;
    PortfolioState portfolio;
    DailyStats dailyStats;
    RiskLimits limits;
    BuyingPowerQuote buyingPower;
    TradingMode mode;
    Instant now;
}
