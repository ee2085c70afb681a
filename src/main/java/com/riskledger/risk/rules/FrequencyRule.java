package com.riskledger.risk.rules;

import com.riskledger.domain.model.DailyStats;
import com.riskledger.domain.model.TradeSignal;
import com.riskledger.risk.RiskContext;
import com.riskledger.risk.RiskDecision;
import com.riskledger.risk.RiskLimits.FrequencyLimits;
import com.riskledger.risk.RiskMath;
import com.riskledger.risk.RiskRule;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Caps trading frequency: trades per day, spacing between trades, trades per symbol per
 * day and trades per rolling minute, checked in that order.
 */
@Component
public class FrequencyRule implements RiskRule {

    public static final String NAME = "FREQUENCY";

    static final Duration RATE_WINDOW = Duration.ofSeconds(60);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RiskDecision evaluate(RiskContext context) {
        FrequencyLimits limits = context.getLimits().getFrequency();
        DailyStats stats = context.getDailyStats();
        TradeSignal signal = context.getSignal();
        Instant now = context.getNow();

        Integer maxPerDay = limits.getMaxTradesPerDay();
        if (maxPerDay != null && stats.getTotalTrades() >= maxPerDay) {
            return RiskDecision.fail(
                    NAME,
                    "Daily trade limit reached (" + maxPerDay + ")",
                    RiskMath.ratio(stats.getTotalTrades(), maxPerDay),
                    Map.of("totalTrades", stats.getTotalTrades(), "limit", maxPerDay));
        }

        Integer minGap = limits.getMinTimeBetweenTrades();
        if (minGap != null && stats.getLastTradeTime() != null) {
            double elapsedSeconds =
                    Math.max(Duration.between(stats.getLastTradeTime(), now).toMillis(), 1) / 1000.0;
            if (elapsedSeconds < minGap) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("timeSinceLastTrade", elapsedSeconds);
                details.put("limit", minGap);
                details.put("lastTradeTime", stats.getLastTradeTime().toString());
                return RiskDecision.fail(
                        NAME,
                        String.format("Too soon since last trade (%.0fs < %ds)", elapsedSeconds, minGap),
                        minGap / elapsedSeconds,
                        details);
            }
        }

        int symbolTrades = stats.tradesFor(signal.getSymbol());
        Integer maxPerSymbol = limits.getMaxTradesPerSymbol();
        if (maxPerSymbol != null && symbolTrades >= maxPerSymbol) {
            return RiskDecision.fail(
                    NAME,
                    "Max trades for " + signal.getSymbol() + " reached (" + maxPerSymbol + ")",
                    RiskMath.ratio(symbolTrades, maxPerSymbol),
                    Map.of("symbol", signal.getSymbol(), "symbolTrades", symbolTrades, "limit", maxPerSymbol));
        }

        Integer maxPerMinute = limits.getMaxTradesPerMinute();
        if (maxPerMinute != null) {
            Instant windowStart = now.minus(RATE_WINDOW);
            long recent = stats.getRecentTimestamps().stream()
                    .filter(ts -> ts.isAfter(windowStart))
                    .count();
            if (recent >= maxPerMinute) {
                return RiskDecision.fail(
                        NAME,
                        "Too many trades in last minute (" + recent + "/" + maxPerMinute + ")",
                        RiskMath.ratio(recent, maxPerMinute),
                        Map.of("tradesInLastMinute", recent, "limit", maxPerMinute));
            }
        }

        return RiskDecision.pass(
                NAME,
                maxPerDay != null ? RiskMath.ratio(stats.getTotalTrades(), maxPerDay) : 0.0,
                Map.of("totalTrades", stats.getTotalTrades(), "symbolTrades", symbolTrades));
    }
}
