package com.riskledger.stats;

import com.riskledger.domain.model.DailyStats;
import com.riskledger.domain.model.Fill;
import com.riskledger.domain.model.TradeSignal;
import com.riskledger.risk.RiskDecision;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Same-day trading aggregates for one session.
 *
 * <p>The counters for a trading day live in one private holder object. At a day boundary
 * (judged by the injected {@link Clock}) the holder is replaced by a fresh one rather than
 * cleared field by field, and every read returns an immutable {@link DailyStats} copy, so
 * nobody observes a half-reset day.
 *
 * <p>Recent trade timestamps are appended on write and trimmed to the rate window only
 * when read.
 */
public class DailyStatsTracker {

    private static final Logger log = LoggerFactory.getLogger(DailyStatsTracker.class);

    static final Duration RATE_WINDOW = Duration.ofSeconds(60);

    private final String sessionId;
    private final Clock clock;
    private DayCounters current;

    public DailyStatsTracker(String sessionId, Clock clock) {
        this.sessionId = sessionId;
        this.clock = clock;
        this.current = new DayCounters(LocalDate.now(clock));
    }

    /**
     * Counts an admission decision. Approvals also stamp the trade time, the per-symbol
     * count and the rate window, so frequency limits throttle admissions rather than
     * only completed fills.
     */
    public synchronized void recordDecision(RiskDecision decision, TradeSignal signal) {
        rolloverIfNeeded();
        current.totalTrades++;
        if (decision.isPassed()) {
            current.approvedTrades++;
            stampTrade(signal.getSymbol(), clock.instant());
        } else {
            current.rejectedTrades++;
        }
    }

    /**
     * Folds a fill into the day. {@code realizedPnl} is null for fills that open or add to
     * a position; only closing fills move the P&L and the win/loss streaks.
     *
     * @param countedAtAdmission true when the fill's signal was approved through
     *     {@link #recordDecision} today, so its trade stamp is already in place
     */
    public synchronized void recordFill(Fill fill, BigDecimal realizedPnl, boolean countedAtAdmission) {
        rolloverIfNeeded();
        if (realizedPnl != null) {
            current.realizedPnl = current.realizedPnl.add(realizedPnl);
            if (realizedPnl.signum() < 0) {
                current.consecutiveLosses++;
                current.consecutiveWins = 0;
            } else {
                current.consecutiveLosses = 0;
                current.consecutiveWins++;
            }
        }
        if (!countedAtAdmission) {
            stampTrade(fill.getSymbol(), clock.instant());
        }
    }

    public synchronized DailyStats snapshot() {
        rolloverIfNeeded();
        Instant windowStart = clock.instant().minus(RATE_WINDOW);
        while (!current.recentTimestamps.isEmpty()
                && !current.recentTimestamps.peekFirst().isAfter(windowStart)) {
            current.recentTimestamps.pollFirst();
        }
        return current.toStats();
    }

    /** Swaps in a fresh day when the clock has crossed into a new trading day. */
    public synchronized boolean rolloverIfNeeded() {
        LocalDate today = LocalDate.now(clock);
        if (today.equals(current.tradingDay)) {
            return false;
        }
        log.info(
                "[{}] Trading day rollover {} -> {} (trades {}, realized P&L {})",
                sessionId,
                current.tradingDay,
                today,
                current.totalTrades,
                current.realizedPnl);
        current = new DayCounters(today);
        return true;
    }

    /** Operator reset: starts today over with empty counters. */
    public synchronized void reset() {
        current = new DayCounters(LocalDate.now(clock));
        log.info("[{}] Daily stats reset", sessionId);
    }

    /**
     * Reloads persisted stats after a restart. Stats from an earlier day are ignored.
     * Rate-window timestamps are not persisted and start empty.
     */
    public synchronized void restore(DailyStats stats) {
        LocalDate today = LocalDate.now(clock);
        if (!today.equals(stats.getTradingDay())) {
            log.debug("[{}] Ignoring daily stats from {}", sessionId, stats.getTradingDay());
            return;
        }
        DayCounters restored = new DayCounters(today);
        restored.totalTrades = stats.getTotalTrades();
        restored.approvedTrades = stats.getApprovedTrades();
        restored.rejectedTrades = stats.getRejectedTrades();
        restored.realizedPnl = stats.getRealizedPnl() != null ? stats.getRealizedPnl() : BigDecimal.ZERO;
        restored.consecutiveLosses = stats.getConsecutiveLosses();
        restored.consecutiveWins = stats.getConsecutiveWins();
        restored.lastTradeTime = stats.getLastTradeTime();
        if (stats.getSymbolCounts() != null) {
            restored.symbolCounts.putAll(stats.getSymbolCounts());
        }
        if (stats.getRecentTimestamps() != null) {
            restored.recentTimestamps.addAll(stats.getRecentTimestamps());
        }
        current = restored;
        log.info("[{}] Daily stats restored for {}: {} trades, realized P&L {}",
                sessionId, today, restored.totalTrades, restored.realizedPnl);
    }

    public String getSessionId() {
        return sessionId;
    }

    private void stampTrade(String symbol, Instant at) {
        current.lastTradeTime = at;
        current.symbolCounts.merge(symbol, 1, Integer::sum);
        current.recentTimestamps.addLast(at);
    }

    private static final class DayCounters {
        private final LocalDate tradingDay;
        private int totalTrades;
        private int approvedTrades;
        private int rejectedTrades;
        private BigDecimal realizedPnl = BigDecimal.ZERO;
        private int consecutiveLosses;
        private int consecutiveWins;
        private Instant lastTradeTime;
        private final Map<String, Integer> symbolCounts = new HashMap<>();
        private final Deque<Instant> recentTimestamps = new ArrayDeque<>();

        private DayCounters(LocalDate tradingDay) {
            this.tradingDay = tradingDay;
        }

        private DailyStats toStats() {
            return DailyStats.builder()
                    .tradingDay(tradingDay)
                    .totalTrades(totalTrades)
                    .approvedTrades(approvedTrades)
                    .rejectedTrades(rejectedTrades)
                    .realizedPnl(realizedPnl)
                    .consecutiveLosses(consecutiveLosses)
                    .consecutiveWins(consecutiveWins)
                    .lastTradeTime(lastTradeTime)
                    .symbolCounts(Collections.unmodifiableMap(new HashMap<>(symbolCounts)))
                    .recentTimestamps(Collections.unmodifiableList(new ArrayList<>(recentTimestamps)))
                    .build();
        }
    }
}
