package com.riskledger.session;

import com.riskledger.domain.model.DailyStats;
import com.riskledger.domain.model.PortfolioState;
import com.riskledger.ledger.PortfolioLedger;
import com.riskledger.stats.DailyStatsTracker;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * Per-session state bundle: the ledger and the daily stats tracker of one backtest, paper
 * or live session. Created, looked up and discarded only through {@link TradingSessionRegistry}.
 *
 * <p>The session lock spans both components. A fill holds it while it updates the ledger and
 * the stats, and {@link #view()} holds it while reading them, so a reader never sees a fill
 * in one and not the other.
 */
@Getter
public class TradingSession {

    private final String sessionId;
    private final PortfolioLedger ledger;
    private final DailyStatsTracker dailyStats;
    private final Instant createdAt;

    @Getter(AccessLevel.NONE)
    private final ReentrantLock lock = new ReentrantLock();

    public TradingSession(String sessionId, PortfolioLedger ledger, DailyStatsTracker dailyStats, Instant createdAt) {
        this.sessionId = sessionId;
        this.ledger = ledger;
        this.dailyStats = dailyStats;
        this.createdAt = createdAt;
    }

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    /** Ledger state and daily stats taken together under the session lock. */
    public View view() {
        lock.lock();
        try {
            return new View(ledger.getState(), dailyStats.snapshot());
        } finally {
            lock.unlock();
        }
    }

    public record View(PortfolioState portfolio, DailyStats stats) {}
}
