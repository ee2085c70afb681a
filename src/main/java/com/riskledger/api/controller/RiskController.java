package com.riskledger.api.controller;

import com.riskledger.api.dto.response.RiskStatusResponse;
import com.riskledger.domain.enums.SignalState;
import com.riskledger.domain.model.PortfolioState;
import com.riskledger.domain.model.RiskEventRecord;
import com.riskledger.ledger.LedgerPersistenceService;
import com.riskledger.observability.RiskAuditService;
import com.riskledger.pipeline.AdmissionPipeline;
import com.riskledger.pipeline.PendingSignalRegistry;
import com.riskledger.risk.BuyingPowerProvider;
import com.riskledger.risk.ModeAssessment;
import com.riskledger.risk.RiskLimits;
import com.riskledger.session.TradingSession;
import com.riskledger.session.TradingSessionRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for risk state: mode, limits, audit log.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/risk/status/{sessionId} -- mode, daily stats, drawdown, exposure, degradation counters</li>
 *   <li>GET /api/risk/limits -- configured limits</li>
 *   <li>GET /api/risk/events -- recent admission decisions, optionally filtered by outcome</li>
 *   <li>GET /api/risk/rejections -- recent rejections</li>
 *   <li>POST /api/risk/reset-daily/{sessionId} -- operator reset of the day's counters</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    private final TradingSessionRegistry sessionRegistry;
    private final AdmissionPipeline admissionPipeline;
    private final RiskLimits riskLimits;
    private final RiskAuditService riskAuditService;
    private final LedgerPersistenceService ledgerPersistenceService;
    private final BuyingPowerProvider buyingPowerProvider;
    private final PendingSignalRegistry pendingSignalRegistry;

    public RiskController(
            TradingSessionRegistry sessionRegistry,
            AdmissionPipeline admissionPipeline,
            RiskLimits riskLimits,
            RiskAuditService riskAuditService,
            LedgerPersistenceService ledgerPersistenceService,
            BuyingPowerProvider buyingPowerProvider,
            PendingSignalRegistry pendingSignalRegistry) {
        this.sessionRegistry = sessionRegistry;
        this.admissionPipeline = admissionPipeline;
        this.riskLimits = riskLimits;
        this.riskAuditService = riskAuditService;
        this.ledgerPersistenceService = ledgerPersistenceService;
        this.buyingPowerProvider = buyingPowerProvider;
        this.pendingSignalRegistry = pendingSignalRegistry;
    }

    @GetMapping("/status/{sessionId}")
    public ResponseEntity<RiskStatusResponse> getRiskStatus(@PathVariable String sessionId) {
        TradingSession session = sessionRegistry.require(sessionId);
        ModeAssessment assessment = admissionPipeline.currentMode(session.getSessionId());
        TradingSession.View view = session.view();
        PortfolioState state = view.portfolio();

        return ResponseEntity.ok(RiskStatusResponse.builder()
                .sessionId(session.getSessionId())
                .mode(assessment.getMode())
                .modeReason(assessment.getReason())
                .dailyStats(view.stats())
                .portfolioValue(state.getPortfolioValue())
                .peakValue(state.getPeakValue())
                .drawdown(state.getDrawdown())
                .drawdownDollars(assessment.getMeasures().getDrawdownDollars())
                .exposure(state.getExposure())
                .cash(state.getCash())
                .persistenceFailures(ledgerPersistenceService.getFailureCount())
                .lastPersistenceFailureAt(ledgerPersistenceService.getLastFailureAt())
                .lastPersistenceFailure(ledgerPersistenceService.getLastFailure())
                .buyingPowerFallbacks(buyingPowerProvider.getFallbackCount())
                .buyingPowerCircuit(buyingPowerProvider.getCircuitState().name())
                .pendingSignals(pendingSignalRegistry.size())
                .build());
    }

    @GetMapping("/limits")
    public ResponseEntity<RiskLimits> getRiskLimits() {
        return ResponseEntity.ok(riskLimits);
    }

    @GetMapping("/events")
    public ResponseEntity<List<RiskEventRecord>> getEvents(
            @RequestParam(defaultValue = "100") int limit, @RequestParam(required = false) SignalState decision) {
        return ResponseEntity.ok(riskAuditService.recentEvents(limit, decision));
    }

    @GetMapping("/rejections")
    public ResponseEntity<List<RiskEventRecord>> getRejections(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(riskAuditService.recentRejections(limit));
    }

    @PostMapping("/reset-daily/{sessionId}")
    public ResponseEntity<Map<String, Object>> resetDaily(@PathVariable String sessionId) {
        TradingSession session = sessionRegistry.require(sessionId);
        log.warn("[{}] Daily stats reset requested via API", session.getSessionId());
        session.getDailyStats().reset();

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("sessionId", session.getSessionId());
        result.put("dailyStats", session.getDailyStats().snapshot());
        return ResponseEntity.ok(result);
    }
}
