package com.riskledger.stats;

import com.riskledger.domain.model.DailyStats;
import com.riskledger.entity.DailyStatsEntity;
import com.riskledger.repository.jpa.DailyStatsJpaRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Saves and reloads {@code risk_daily_stats} rows, one per (session, trading day).
 * Writes are best-effort like the ledger's: failures are logged and counted.
 */
@Service
public class DailyStatsPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(DailyStatsPersistenceService.class);

    private static final TypeReference<Map<String, Integer>> SYMBOL_COUNTS = new TypeReference<>() {};

    private final DailyStatsJpaRepository dailyStatsJpaRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AtomicLong failureCount = new AtomicLong();

    public DailyStatsPersistenceService(
            DailyStatsJpaRepository dailyStatsJpaRepository, ObjectMapper objectMapper, Clock clock) {
        this.dailyStatsJpaRepository = dailyStatsJpaRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void save(String sessionId, DailyStats stats) {
        try {
            DailyStatsEntity entity = dailyStatsJpaRepository
                    .findBySessionIdAndTradingDay(sessionId, stats.getTradingDay())
                    .orElseGet(() -> DailyStatsEntity.builder()
                            .sessionId(sessionId)
                            .tradingDay(stats.getTradingDay())
                            .build());
            entity.setTotalTrades(stats.getTotalTrades());
            entity.setApprovedTrades(stats.getApprovedTrades());
            entity.setRejectedTrades(stats.getRejectedTrades());
            entity.setRealizedPnl(stats.getRealizedPnl());
            entity.setConsecutiveLosses(stats.getConsecutiveLosses());
            entity.setConsecutiveWins(stats.getConsecutiveWins());
            entity.setLastTradeTime(stats.getLastTradeTime());
            entity.setSymbolCountsJson(objectMapper.writeValueAsString(stats.getSymbolCounts()));
            entity.setUpdatedAt(clock.instant());
            dailyStatsJpaRepository.save(entity);
        } catch (RuntimeException e) {
            long failures = failureCount.incrementAndGet();
            log.error("[{}] Failed to save daily stats for {} ({} failures total): {}",
                    sessionId, stats.getTradingDay(), failures, e.getMessage());
        }
    }

    public Optional<DailyStats> load(String sessionId, LocalDate tradingDay) {
        try {
            return dailyStatsJpaRepository
                    .findBySessionIdAndTradingDay(sessionId, tradingDay)
                    .map(this::toDomain);
        } catch (RuntimeException e) {
            failureCount.incrementAndGet();
            log.error("[{}] Failed to load daily stats for {}: {}", sessionId, tradingDay, e.getMessage());
            return Optional.empty();
        }
    }

    public long getFailureCount() {
        return failureCount.get();
    }

    private DailyStats toDomain(DailyStatsEntity entity) {
        Map<String, Integer> symbolCounts = entity.getSymbolCountsJson() != null
                ? objectMapper.readValue(entity.getSymbolCountsJson(), SYMBOL_COUNTS)
                : Map.of();
        return DailyStats.builder()
                .tradingDay(entity.getTradingDay())
                .totalTrades(entity.getTotalTrades())
                .approvedTrades(entity.getApprovedTrades())
                .rejectedTrades(entity.getRejectedTrades())
                .realizedPnl(entity.getRealizedPnl())
                .consecutiveLosses(entity.getConsecutiveLosses())
                .consecutiveWins(entity.getConsecutiveWins())
                .lastTradeTime(entity.getLastTradeTime())
                .symbolCounts(symbolCounts)
                .recentTimestamps(List.of())
                .build();
    }
}
