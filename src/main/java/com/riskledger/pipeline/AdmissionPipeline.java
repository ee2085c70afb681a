package com.riskledger.pipeline;

import com.riskledger.bus.DecisionPublisher;
import com.riskledger.domain.enums.SignalState;
import com.riskledger.domain.enums.TradeAction;
import com.riskledger.domain.enums.TradingMode;
import com.riskledger.domain.model.AdmissionDecision;
import com.riskledger.domain.model.BuyingPowerQuote;
import com.riskledger.domain.model.DailyStats;
import com.riskledger.domain.model.Fill;
import com.riskledger.domain.model.FillResult;
import com.riskledger.domain.model.MarketPriceUpdate;
import com.riskledger.domain.model.PortfolioState;
import com.riskledger.domain.model.TradeSignal;
import com.riskledger.event.AdmissionEvent;
import com.riskledger.event.FillAppliedEvent;
import com.riskledger.event.RiskEvent;
import com.riskledger.event.RiskEventType;
import com.riskledger.event.RiskLevel;
import com.riskledger.exception.LedgerConsistencyException;
import com.riskledger.ledger.LedgerPersistenceService;
import com.riskledger.risk.BuyingPowerProvider;
import com.riskledger.risk.ModeAssessment;
import com.riskledger.risk.ModeController;
import com.riskledger.risk.ModeTransitionTracker;
import com.riskledger.risk.RiskContext;
import com.riskledger.risk.RiskDecision;
import com.riskledger.risk.RiskEvaluation;
import com.riskledger.risk.RiskLimits;
import com.riskledger.risk.RiskRuleEngine;
import com.riskledger.session.TradingSession;
import com.riskledger.session.TradingSessionRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Entry point for everything that reaches a session from the outside: signals to admit,
 * fills to book and market prices to mark.
 *
 * <p><b>Signals</b> are validated, then evaluated against one ledger snapshot and one
 * daily-stats snapshot taken together under the session lock. The mode is derived first: in LOCKDOWN (with
 * {@code lockdown-halts-trading}) every BUY is rejected without running the chain; in
 * DEFENSIVE the per-trade size limits are scaled down. The decision is counted in the
 * session's daily stats, published to the bus and announced as an {@link AdmissionEvent}
 * (picked up by the audit log and metrics). Admission never mutates the ledger.
 *
 * <p><b>Fills</b> go ledger first, then daily stats, then persistence. The ledger and stats
 * updates run under the session lock, so no admission sees one without the other. Callers
 * serialize fills per session through {@link FillSequencer}.
 */
@Service
public class AdmissionPipeline {

    private static final Logger log = LoggerFactory.getLogger(AdmissionPipeline.class);

    /** Rule name reported when the mode policy rejects a signal before the chain runs. */
    public static final String MODE_GATE = "MODE";

    private final TradingSessionRegistry sessionRegistry;
    private final MessageValidator messageValidator;
    private final RiskRuleEngine riskRuleEngine;
    private final ModeController modeController;
    private final ModeTransitionTracker modeTransitionTracker;
    private final BuyingPowerProvider buyingPowerProvider;
    private final PendingSignalRegistry pendingSignalRegistry;
    private final LedgerPersistenceService ledgerPersistenceService;
    private final DecisionPublisher decisionPublisher;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final RiskLimits riskLimits;
    private final Clock clock;

    public AdmissionPipeline(
            TradingSessionRegistry sessionRegistry,
            MessageValidator messageValidator,
            RiskRuleEngine riskRuleEngine,
            ModeController modeController,
            ModeTransitionTracker modeTransitionTracker,
            BuyingPowerProvider buyingPowerProvider,
            PendingSignalRegistry pendingSignalRegistry,
            LedgerPersistenceService ledgerPersistenceService,
            DecisionPublisher decisionPublisher,
            ApplicationEventPublisher applicationEventPublisher,
            RiskLimits riskLimits,
            Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.messageValidator = messageValidator;
        this.riskRuleEngine = riskRuleEngine;
        this.modeController = modeController;
        this.modeTransitionTracker = modeTransitionTracker;
        this.buyingPowerProvider = buyingPowerProvider;
        this.pendingSignalRegistry = pendingSignalRegistry;
        this.ledgerPersistenceService = ledgerPersistenceService;
        this.decisionPublisher = decisionPublisher;
        this.applicationEventPublisher = applicationEventPublisher;
        this.riskLimits = riskLimits;
        this.clock = clock;
    }

    // ==============================
    // SIGNAL ADMISSION
    // ==============================

    public AdmissionDecision evaluate(TradeSignal incoming) {
        long startNanos = System.nanoTime();
        TradeSignal signal = messageValidator.validateSignal(incoming);
        TradingSession session = sessionRegistry.getOrCreate(signal.getBacktestId());
        String sessionId = session.getSessionId();
        log.debug("[{}] Signal {} {}: {} {} x{} @ {}", sessionId, signal.getSignalId(), SignalState.RECEIVED,
                signal.getAction(), signal.getSymbol(), signal.getQuantity(), signal.getPrice());

        TradingSession.View view = session.view();
        PortfolioState portfolio = view.portfolio();
        DailyStats stats = view.stats();
        ModeAssessment assessment = modeController.assess(portfolio, stats, riskLimits);
        modeTransitionTracker.observe(sessionId, assessment);
        TradingMode mode = assessment.getMode();

        log.debug("[{}] Signal {} {} in {} mode", sessionId, signal.getSignalId(), SignalState.EVALUATING, mode);

        RiskDecision decision;
        Map<String, Double> ruleScores;
        if (mode == TradingMode.LOCKDOWN && riskLimits.getModes().isLockdownHaltsTrading() && signal.isBuy()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("mode", mode.name());
            details.put("modeReason", assessment.getReason());
            decision = RiskDecision.fail(MODE_GATE, "Trading halted: account in LOCKDOWN mode", 1.0, details);
            ruleScores = Map.of();
        } else {
            RiskLimits effectiveLimits = mode == TradingMode.DEFENSIVE
                    ? riskLimits.scaledPerTradeLimits(riskLimits.getModes().getDefensiveSizeFactor())
                    : riskLimits;
            BuyingPowerQuote quote = signal.isBuy()
                    ? buyingPowerProvider.quote(portfolio)
                    : buyingPowerProvider.localQuote(portfolio);

            RiskEvaluation evaluation = riskRuleEngine.evaluate(RiskContext.builder()
                    .signal(signal)
                    .portfolio(portfolio)
                    .dailyStats(stats)
                    .limits(effectiveLimits)
                    .buyingPower(quote)
                    .mode(mode)
                    .now(clock.instant())
                    .build());
            decision = evaluation.getDecision();
            ruleScores = evaluation.getScores();
        }

        session.getDailyStats().recordDecision(decision, signal);

        AdmissionDecision admission = AdmissionDecision.builder()
                .sessionId(sessionId)
                .signal(signal)
                .state(decision.isPassed() ? SignalState.APPROVED : SignalState.REJECTED)
                .decision(decision)
                .mode(mode)
                .ruleScores(ruleScores)
                .portfolioValue(portfolio.getPortfolioValue())
                .processingTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos))
                .evaluatedAt(clock.instant())
                .build();

        if (admission.isApproved()) {
            pendingSignalRegistry.register(sessionId, signal);
            log.info("[{}] APPROVED {} {} x{} @ {} (score {}, mode {})", sessionId, signal.getAction(),
                    signal.getSymbol(), signal.getQuantity(), signal.getPrice(),
                    String.format("%.2f", decision.getScore()), mode);
        } else {
            log.warn("[{}] REJECTED {} {} x{} @ {} by {}: {}", sessionId, signal.getAction(), signal.getSymbol(),
                    signal.getQuantity(), signal.getPrice(), decision.getRuleName(), decision.getReason());
        }

        decisionPublisher.publishDecision(admission);
        decisionPublisher.publishStats(admission, session.getDailyStats().snapshot());
        applicationEventPublisher.publishEvent(new AdmissionEvent(this, admission));
        return admission;
    }

    // ==============================
    // FILLS
    // ==============================

    public FillResult onFill(Fill incoming) {
        Fill fill = messageValidator.validateFill(incoming);
        TradingSession session = sessionRegistry.getOrCreate(fill.getBacktestId());
        String sessionId = session.getSessionId();

        FillResult result;
        PortfolioState after;
        DailyStats statsAfter;
        session.lock();
        try {
            try {
                result = session.getLedger().processFill(fill);
            } catch (LedgerConsistencyException e) {
                log.error("[{}] Fill rejected by ledger: {} | fill={} details={}", sessionId, e.getMessage(), fill,
                        e.getDetails());
                applicationEventPublisher.publishEvent(new RiskEvent(
                        this, sessionId, RiskEventType.LEDGER_INCONSISTENCY, RiskLevel.CRITICAL, e.getMessage(),
                        e.getDetails()));
                throw e;
            }

            BigDecimal closingPnl = fill.getAction() == TradeAction.SELL ? result.getRealizedPnl() : null;
            session.getDailyStats().recordFill(fill, closingPnl, fill.getSignalId() != null);
            after = session.getLedger().getState();
            statsAfter = session.getDailyStats().snapshot();
        } finally {
            session.unlock();
        }

        ledgerPersistenceService.persistFill(result.getTransaction(), after);
        pendingSignalRegistry.complete(fill.getSignalId());

        applicationEventPublisher.publishEvent(new FillAppliedEvent(this, fill, result));
        modeTransitionTracker.observe(sessionId, modeController.assess(after, statsAfter, riskLimits));
        return result;
    }

    // ==============================
    // MARKET PRICES
    // ==============================

    public PortfolioState onMarketPrices(MarketPriceUpdate update) {
        TradingSession session = sessionRegistry.getOrCreate(update.getSessionId());
        if (update.getPrices() == null || update.getPrices().isEmpty()) {
            return session.getLedger().getState();
        }
        session.getLedger().updateMarketPrices(update.getPrices());
        TradingSession.View view = session.view();
        modeTransitionTracker.observe(
                session.getSessionId(), modeController.assess(view.portfolio(), view.stats(), riskLimits));
        return view.portfolio();
    }

    /** Current derived mode of a session, for status queries. */
    public ModeAssessment currentMode(String sessionId) {
        TradingSession.View view = sessionRegistry.require(sessionId).view();
        return modeController.assess(view.portfolio(), view.stats(), riskLimits);
    }
}
