package com.riskledger.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable copy of one session's same-day trading aggregates, as read by the rules.
 * {@code recentTimestamps} only holds entries inside the rate window at snapshot time.
 */
@Value
@Builder(toBuilder = true)
public class DailyStats {

    LocalDate tradingDay;
    int totalTrades;
    int approvedTrades;
    int rejectedTrades;
    BigDecimal realizedPnl;
    int consecutiveLosses;
    int consecutiveWins;
    Instant lastTradeTime;
    Map<String, Integer> symbolCounts;
    List<Instant> recentTimestamps;

    public int tradesFor(String symbol) {
        return symbolCounts.getOrDefault(symbol, 0);
    }

    public static DailyStats empty(LocalDate tradingDay) {
        return DailyStats.builder()
                .tradingDay(tradingDay)
                .realizedPnl(BigDecimal.ZERO)
                .symbolCounts(Map.of())
                .recentTimestamps(List.of())
                .build();
    }
}
