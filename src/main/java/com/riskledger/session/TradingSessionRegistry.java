package com.riskledger.session;

import com.riskledger.domain.model.PortfolioState;
import com.riskledger.exception.ResourceNotFoundException;
import com.riskledger.ledger.LedgerPersistenceService;
import com.riskledger.ledger.PortfolioLedger;
import com.riskledger.risk.RiskLimits;
import com.riskledger.stats.DailyStatsPersistenceService;
import com.riskledger.stats.DailyStatsTracker;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Owns every live {@link TradingSession}, keyed by session id.
 *
 * <p>A session is opened on first use (a signal, fill or price update naming it) or
 * explicitly via {@link #create}. Opening restores the ledger and today's stats from
 * persistence when a stored copy exists, otherwise starts from the configured capital.
 * Signals and fills without a session id belong to the default session ({@code paper}).
 */
@Component
public class TradingSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(TradingSessionRegistry.class);

    private final ConcurrentMap<String, TradingSession> sessions = new ConcurrentHashMap<>();

    private final LedgerPersistenceService ledgerPersistenceService;
    private final DailyStatsPersistenceService dailyStatsPersistenceService;
    private final RiskLimits riskLimits;
    private final Clock clock;
    private final String defaultSessionId;
    private final int fillIdWindow;

    public TradingSessionRegistry(
            LedgerPersistenceService ledgerPersistenceService,
            DailyStatsPersistenceService dailyStatsPersistenceService,
            RiskLimits riskLimits,
            Clock clock,
            @Value("${risk-ledger.ledger.default-session:paper}") String defaultSessionId,
            @Value("${risk-ledger.ledger.fill-id-window:50000}") int fillIdWindow) {
        this.ledgerPersistenceService = ledgerPersistenceService;
        this.dailyStatsPersistenceService = dailyStatsPersistenceService;
        this.riskLimits = riskLimits;
        this.clock = clock;
        this.defaultSessionId = defaultSessionId;
        this.fillIdWindow = fillIdWindow;
    }

    public String resolveSessionId(String sessionId) {
        return sessionId == null || sessionId.isBlank() ? defaultSessionId : sessionId;
    }

    public TradingSession getOrCreate(String sessionId) {
        String id = resolveSessionId(sessionId);
        return sessions.computeIfAbsent(id, key -> open(key, riskLimits.getCapital().getInitialCapital()));
    }

    /** Opens a session with the given starting capital; an already open session is returned as is. */
    public TradingSession create(String sessionId, BigDecimal initialCapital) {
        String id = resolveSessionId(sessionId);
        BigDecimal capital = initialCapital != null ? initialCapital : riskLimits.getCapital().getInitialCapital();
        TradingSession existing = sessions.get(id);
        if (existing != null) {
            log.warn("[{}] Session already open, ignoring create", id);
            return existing;
        }
        return sessions.computeIfAbsent(id, key -> open(key, capital));
    }

    public Optional<TradingSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(resolveSessionId(sessionId)));
    }

    public TradingSession require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new ResourceNotFoundException("Session", resolveSessionId(sessionId)));
    }

    public Collection<TradingSession> all() {
        return new ArrayList<>(sessions.values());
    }

    /** Persists the final state and a closing snapshot, then forgets the session. */
    public PortfolioState close(String sessionId) {
        TradingSession session = require(sessionId);
        TradingSession.View view = session.view();
        PortfolioState finalState = view.portfolio();
        ledgerPersistenceService.saveState(finalState);
        ledgerPersistenceService.saveSnapshot(finalState);
        dailyStatsPersistenceService.save(session.getSessionId(), view.stats());
        sessions.remove(session.getSessionId(), session);
        log.info("[{}] Session closed: value {}, total P&L {}",
                session.getSessionId(), finalState.getPortfolioValue(), finalState.getTotalPnl());
        return finalState;
    }

    /** Wipes the session's stored history and starts it over with its original capital. */
    public TradingSession reset(String sessionId) {
        TradingSession session = require(sessionId);
        BigDecimal capital = session.getLedger().getState().getInitialCapital();
        ledgerPersistenceService.deleteSession(session.getSessionId());
        TradingSession fresh = newSession(session.getSessionId(), capital);
        sessions.put(session.getSessionId(), fresh);
        log.info("[{}] Session reset to initial capital {}", session.getSessionId(), capital);
        return fresh;
    }

    private TradingSession open(String sessionId, BigDecimal initialCapital) {
        TradingSession session = newSession(sessionId, initialCapital);
        ledgerPersistenceService.loadSnapshot(sessionId).ifPresent(session.getLedger()::restore);
        dailyStatsPersistenceService
                .load(sessionId, LocalDate.now(clock))
                .ifPresent(session.getDailyStats()::restore);
        log.info("[{}] Session opened with initial capital {}", sessionId, session.getLedger().getState().getInitialCapital());
        return session;
    }

    private TradingSession newSession(String sessionId, BigDecimal initialCapital) {
        return new TradingSession(
                sessionId,
                new PortfolioLedger(sessionId, initialCapital, clock, fillIdWindow),
                new DailyStatsTracker(sessionId, clock),
                clock.instant());
    }
}
