package com.riskledger.api.controller;

import com.riskledger.api.dto.request.CreateSessionRequest;
import com.riskledger.api.dto.response.BuyingPowerResponse;
import com.riskledger.api.dto.response.SessionResponse;
import com.riskledger.domain.model.LedgerTransaction;
import com.riskledger.domain.model.PerformanceMetrics;
import com.riskledger.domain.model.PortfolioSnapshotRecord;
import com.riskledger.domain.model.PortfolioState;
import com.riskledger.domain.model.Position;
import com.riskledger.exception.ResourceNotFoundException;
import com.riskledger.ledger.LedgerPersistenceService;
import com.riskledger.ledger.PerformanceMetricsService;
import com.riskledger.risk.ModeTransitionTracker;
import com.riskledger.session.TradingSession;
import com.riskledger.session.TradingSessionRegistry;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ledger queries and session lifecycle.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/portfolio/buying-power/{sessionId} -- buying power (queried by remote risk instances)</li>
 *   <li>GET /api/portfolio/state/{sessionId} -- full portfolio state</li>
 *   <li>GET /api/portfolio/state -- state of every open session</li>
 *   <li>GET /api/portfolio/position/{sessionId}/{symbol} -- one open position</li>
 *   <li>POST /api/portfolio/session -- open a session</li>
 *   <li>POST /api/portfolio/session/{sessionId}/close -- persist and close a session</li>
 *   <li>POST /api/portfolio/session/{sessionId}/reset -- wipe history and restart from initial capital</li>
 *   <li>GET /api/portfolio/transactions/{sessionId} -- fill journal, newest first</li>
 *   <li>GET /api/portfolio/snapshots/{sessionId} -- snapshot history, newest first</li>
 *   <li>GET /api/portfolio/performance/{sessionId} -- return, Sharpe, drawdown, win rate</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/portfolio")
public class PortfolioController {

    private static final Logger log = LoggerFactory.getLogger(PortfolioController.class);

    private final TradingSessionRegistry sessionRegistry;
    private final LedgerPersistenceService ledgerPersistenceService;
    private final PerformanceMetricsService performanceMetricsService;
    private final ModeTransitionTracker modeTransitionTracker;

    public PortfolioController(
            TradingSessionRegistry sessionRegistry,
            LedgerPersistenceService ledgerPersistenceService,
            PerformanceMetricsService performanceMetricsService,
            ModeTransitionTracker modeTransitionTracker) {
        this.sessionRegistry = sessionRegistry;
        this.ledgerPersistenceService = ledgerPersistenceService;
        this.performanceMetricsService = performanceMetricsService;
        this.modeTransitionTracker = modeTransitionTracker;
    }

    @GetMapping("/buying-power/{sessionId}")
    public ResponseEntity<BuyingPowerResponse> getBuyingPower(@PathVariable String sessionId) {
        PortfolioState state = sessionRegistry.require(sessionId).getLedger().getState();
        return ResponseEntity.ok(new BuyingPowerResponse(state.getSessionId(), state.getBuyingPower()));
    }

    @GetMapping("/state/{sessionId}")
    public ResponseEntity<PortfolioState> getState(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionRegistry.require(sessionId).getLedger().getState());
    }

    @GetMapping("/state")
    public ResponseEntity<List<PortfolioState>> getAllStates() {
        List<PortfolioState> states = sessionRegistry.all().stream()
                .map(session -> session.getLedger().getState())
                .toList();
        return ResponseEntity.ok(states);
    }

    @GetMapping("/position/{sessionId}/{symbol}")
    public ResponseEntity<Position> getPosition(@PathVariable String sessionId, @PathVariable String symbol) {
        TradingSession session = sessionRegistry.require(sessionId);
        Position position = session.getLedger().getPosition(symbol);
        if (position == null) {
            throw new ResourceNotFoundException("Position", session.getSessionId() + "/" + symbol);
        }
        return ResponseEntity.ok(position);
    }

    @PostMapping("/session")
    public ResponseEntity<SessionResponse> createSession(@Valid @RequestBody CreateSessionRequest request) {
        log.info("Session create requested: {} (capital {})", request.getSessionId(), request.getInitialCapital());
        TradingSession session = sessionRegistry.create(request.getSessionId(), request.getInitialCapital());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(session));
    }

    @PostMapping("/session/{sessionId}/close")
    public ResponseEntity<PortfolioState> closeSession(@PathVariable String sessionId) {
        log.info("Session close requested: {}", sessionId);
        PortfolioState finalState = sessionRegistry.close(sessionId);
        modeTransitionTracker.forget(finalState.getSessionId());
        return ResponseEntity.ok(finalState);
    }

    @PostMapping("/session/{sessionId}/reset")
    public ResponseEntity<SessionResponse> resetSession(@PathVariable String sessionId) {
        log.warn("Session reset requested: {}", sessionId);
        TradingSession session = sessionRegistry.reset(sessionId);
        modeTransitionTracker.forget(session.getSessionId());
        return ResponseEntity.ok(toResponse(session));
    }

    @GetMapping("/transactions/{sessionId}")
    public ResponseEntity<List<LedgerTransaction>> getTransactions(
            @PathVariable String sessionId,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        String id = sessionRegistry.require(sessionId).getSessionId();
        return ResponseEntity.ok(ledgerPersistenceService.getTransactions(id, clamp(limit), Math.max(offset, 0)));
    }

    @GetMapping("/snapshots/{sessionId}")
    public ResponseEntity<List<PortfolioSnapshotRecord>> getSnapshots(
            @PathVariable String sessionId, @RequestParam(defaultValue = "100") int limit) {
        String id = sessionRegistry.require(sessionId).getSessionId();
        return ResponseEntity.ok(ledgerPersistenceService.getSnapshots(id, clamp(limit)));
    }

    @GetMapping("/performance/{sessionId}")
    public ResponseEntity<PerformanceMetrics> getPerformance(@PathVariable String sessionId) {
        return ResponseEntity.ok(performanceMetricsService.calculate(sessionId));
    }

    private static SessionResponse toResponse(TradingSession session) {
        return SessionResponse.builder()
                .sessionId(session.getSessionId())
                .createdAt(session.getCreatedAt())
                .state(session.getLedger().getState())
                .build();
    }

    private static int clamp(int limit) {
        return Math.max(1, Math.min(limit, 1000));
    }
}
