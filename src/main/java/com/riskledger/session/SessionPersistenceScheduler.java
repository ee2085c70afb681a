package com.riskledger.session;

import com.riskledger.ledger.LedgerPersistenceService;
import com.riskledger.stats.DailyStatsPersistenceService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic persistence of every open session: portfolio snapshots for the history and
 * performance queries, daily stats so a restart within the day keeps its counters, and a
 * final write of both on shutdown.
 */
@Component
public class SessionPersistenceScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionPersistenceScheduler.class);

    private final TradingSessionRegistry sessionRegistry;
    private final LedgerPersistenceService ledgerPersistenceService;
    private final DailyStatsPersistenceService dailyStatsPersistenceService;

    public SessionPersistenceScheduler(
            TradingSessionRegistry sessionRegistry,
            LedgerPersistenceService ledgerPersistenceService,
            DailyStatsPersistenceService dailyStatsPersistenceService) {
        this.sessionRegistry = sessionRegistry;
        this.ledgerPersistenceService = ledgerPersistenceService;
        this.dailyStatsPersistenceService = dailyStatsPersistenceService;
    }

    @Scheduled(
            fixedRateString = "${risk-ledger.ledger.snapshot-interval-ms:60000}",
            initialDelayString = "${risk-ledger.ledger.snapshot-interval-ms:60000}")
    public void snapshotAll() {
        for (TradingSession session : sessionRegistry.all()) {
            ledgerPersistenceService.saveSnapshot(session.getLedger().getState());
        }
    }

    @Scheduled(fixedRateString = "${risk-ledger.stats.save-interval-ms:60000}")
    public void saveDailyStats() {
        for (TradingSession session : sessionRegistry.all()) {
            if (session.getDailyStats().rolloverIfNeeded()) {
                log.info("[{}] New trading day started", session.getSessionId());
            }
            dailyStatsPersistenceService.save(session.getSessionId(), session.getDailyStats().snapshot());
        }
    }

    @PreDestroy
    public void persistAll() {
        int count = 0;
        for (TradingSession session : sessionRegistry.all()) {
            TradingSession.View view = session.view();
            ledgerPersistenceService.saveState(view.portfolio());
            ledgerPersistenceService.saveSnapshot(view.portfolio());
            dailyStatsPersistenceService.save(session.getSessionId(), view.stats());
            count++;
        }
        log.info("Persisted {} sessions on shutdown", count);
    }
}
