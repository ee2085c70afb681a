package com.riskledger.unit.pipeline;

import static com.riskledger.unit.support.TestData.SESSION;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.riskledger.bus.DecisionPublisher;
import com.riskledger.domain.enums.SignalState;
import com.riskledger.domain.enums.TradeAction;
import com.riskledger.domain.enums.TradingMode;
import com.riskledger.domain.model.AdmissionDecision;
import com.riskledger.domain.model.DailyStats;
import com.riskledger.domain.model.Fill;
import com.riskledger.domain.model.FillResult;
import com.riskledger.domain.model.MarketPriceUpdate;
import com.riskledger.domain.model.PortfolioState;
import com.riskledger.event.AdmissionEvent;
import com.riskledger.event.FillAppliedEvent;
import com.riskledger.event.RiskEvent;
import com.riskledger.event.RiskEventType;
import com.riskledger.exception.DuplicateFillException;
import com.riskledger.exception.FillValidationException;
import com.riskledger.exception.InsufficientPositionException;
import com.riskledger.exception.SignalValidationException;
import com.riskledger.ledger.LedgerPersistenceService;
import com.riskledger.pipeline.AdmissionPipeline;
import com.riskledger.pipeline.MessageValidator;
import com.riskledger.pipeline.PendingSignalRegistry;
import com.riskledger.risk.BuyingPowerProvider;
import com.riskledger.risk.BuyingPowerSettings;
import com.riskledger.risk.ModeController;
import com.riskledger.risk.ModeTransitionTracker;
import com.riskledger.risk.RemoteBuyingPowerClient;
import com.riskledger.risk.RiskLimits;
import com.riskledger.risk.RiskRuleEngine;
import com.riskledger.risk.rules.BuyingPowerRule;
import com.riskledger.risk.rules.FrequencyRule;
import com.riskledger.risk.rules.LossLimitRule;
import com.riskledger.risk.rules.PortfolioExposureRule;
import com.riskledger.risk.rules.PositionLimitRule;
import com.riskledger.session.TradingSession;
import com.riskledger.session.TradingSessionRegistry;
import com.riskledger.stats.DailyStatsPersistenceService;
import com.riskledger.unit.support.MutableClock;
import com.riskledger.unit.support.TestData;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for AdmissionPipeline wired with the real rule chain, ledger and stats tracker.
 * Persistence, the bus publisher and the Spring event publisher are mocked.
 */
@ExtendWith(MockitoExtension.class)
class AdmissionPipelineTest {

    @Mock
    private LedgerPersistenceService ledgerPersistenceService;

    @Mock
    private DailyStatsPersistenceService dailyStatsPersistenceService;

    @Mock
    private DecisionPublisher decisionPublisher;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    @Mock
    private RemoteBuyingPowerClient remoteBuyingPowerClient;

    private TradingSessionRegistry sessionRegistry;
    private PendingSignalRegistry pendingSignalRegistry;
    private AdmissionPipeline pipeline;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(TestData.NOW);
        RiskLimits limits = RiskLimits.builder()
                .position(RiskLimits.PositionLimits.builder().maxSharesPerTrade(1000).build())
                .loss(RiskLimits.LossLimits.builder()
                        .maxDailyLoss(new BigDecimal("5000"))
                        .maxConsecutiveLosses(5)
                        .maxDrawdown(new BigDecimal("0.15"))
                        .build())
                .build();
        BuyingPowerSettings buyingPowerSettings = BuyingPowerSettings.builder().build();
        RiskRuleEngine engine = new RiskRuleEngine(
                new FrequencyRule(),
                new PositionLimitRule(),
                new BuyingPowerRule(buyingPowerSettings),
                new LossLimitRule(),
                new PortfolioExposureRule());

        sessionRegistry = new TradingSessionRegistry(
                ledgerPersistenceService, dailyStatsPersistenceService, limits, clock, "paper", 1000);
        pendingSignalRegistry = new PendingSignalRegistry(10, 100, clock);
        pipeline = new AdmissionPipeline(
                sessionRegistry,
                new MessageValidator(clock),
                engine,
                new ModeController(),
                new ModeTransitionTracker(applicationEventPublisher),
                new BuyingPowerProvider(buyingPowerSettings, remoteBuyingPowerClient, CircuitBreaker.ofDefaults("bp")),
                pendingSignalRegistry,
                ledgerPersistenceService,
                decisionPublisher,
                applicationEventPublisher,
                limits,
                clock);
    }

    private List<ApplicationEvent> publishedEvents() {
        ArgumentCaptor<ApplicationEvent> captor = ArgumentCaptor.forClass(ApplicationEvent.class);
        verify(applicationEventPublisher, atLeastOnce()).publishEvent(captor.capture());
        return captor.getAllValues();
    }

    private static Fill fillFor(AdmissionDecision admission, String fillId) {
        return TestData.fill(fillId, admission.getSignal().getAction(), admission.getSignal().getSymbol(),
                        admission.getSignal().getQuantity(), admission.getSignal().getPrice().toPlainString(), "1")
                .toBuilder()
                .signalId(admission.getSignal().getSignalId())
                .build();
    }

    // ==============================
    // SIGNAL ADMISSION
    // ==============================

    @Nested
    @DisplayName("Signal Admission")
    class SignalAdmission {

        @Test
        @DisplayName("Approved signal is tracked as pending and leaves the ledger untouched")
        void approved_noLedgerMutation() {
            AdmissionDecision admission = pipeline.evaluate(TestData.buy("AAPL", 10, "150"));

            assertThat(admission.getState()).isEqualTo(SignalState.APPROVED);
            assertThat(admission.getMode()).isEqualTo(TradingMode.NORMAL);
            assertThat(admission.getRuleScores()).hasSize(5);
            assertThat(pendingSignalRegistry.find(admission.getSignal().getSignalId())).isPresent();

            TradingSession session = sessionRegistry.require(SESSION);
            assertThat(session.getLedger().getState().getCash()).isEqualByComparingTo("100000");
            assertThat(session.getDailyStats().snapshot().getApprovedTrades()).isEqualTo(1);

            verify(decisionPublisher).publishDecision(admission);
            verify(decisionPublisher).publishStats(eq(admission), any(DailyStats.class));
            assertThat(publishedEvents()).hasAtLeastOneElementOfType(AdmissionEvent.class);
        }

        @Test
        @DisplayName("Rejected signal carries the failing rule and is not tracked")
        void rejected_carriesRule() {
            AdmissionDecision admission = pipeline.evaluate(TestData.buy("SPY", 5000, "10"));

            assertThat(admission.getState()).isEqualTo(SignalState.REJECTED);
            assertThat(admission.getDecision().getRuleName()).isEqualTo("POSITION_LIMITS");
            assertThat(admission.getDecision().getScore()).isEqualTo(5.0);
            assertThat(pendingSignalRegistry.size()).isZero();
            assertThat(sessionRegistry.require(SESSION).getDailyStats().snapshot().getRejectedTrades()).isEqualTo(1);
            verify(decisionPublisher).publishDecision(admission);
        }

        @Test
        @DisplayName("Signal without an id gets one generated")
        void missingId_generated() {
            AdmissionDecision admission = pipeline.evaluate(
                    TestData.buy("AAPL", 10, "150").toBuilder().signalId(null).timestamp(null).build());

            assertThat(admission.getSignal().getSignalId()).isNotBlank();
            assertThat(admission.getSignal().getTimestamp()).isEqualTo(TestData.NOW);
        }

        @Test
        @DisplayName("Malformed signal is refused before any session is touched")
        void malformed_refused() {
            assertThatThrownBy(() -> pipeline.evaluate(
                            TestData.buy("AAPL", 10, "150").toBuilder().quantity(0).build()))
                    .isInstanceOf(SignalValidationException.class);

            assertThat(sessionRegistry.find(SESSION)).isEmpty();
            verifyNoInteractions(decisionPublisher);
        }
    }

    // ==============================
    // MODE POLICY
    // ==============================

    @Nested
    @DisplayName("Mode Policy")
    class ModePolicy {

        @Test
        @DisplayName("LOCKDOWN rejects a BUY before the chain runs")
        void lockdown_haltsBuys() {
            TradingSession session = sessionRegistry.getOrCreate(SESSION);
            session.getDailyStats().recordFill(
                    TestData.fill("loss", TradeAction.SELL, "SPY", 100, "390", null), new BigDecimal("-6000"), true);

            AdmissionDecision admission = pipeline.evaluate(TestData.buy("AAPL", 10, "150"));

            assertThat(admission.getState()).isEqualTo(SignalState.REJECTED);
            assertThat(admission.getMode()).isEqualTo(TradingMode.LOCKDOWN);
            assertThat(admission.getDecision().getRuleName()).isEqualTo(AdmissionPipeline.MODE_GATE);
            assertThat(admission.getDecision().getReason()).isEqualTo("Trading halted: account in LOCKDOWN mode");
            assertThat(admission.getRuleScores()).isEmpty();

            assertThat(publishedEvents())
                    .filteredOn(RiskEvent.class::isInstance)
                    .extracting(event -> ((RiskEvent) event).getEventType())
                    .contains(RiskEventType.MODE_CHANGED);
        }

        @Test
        @DisplayName("LOCKDOWN still runs a SELL through the chain")
        void lockdown_sellReachesChain() {
            TradingSession session = sessionRegistry.getOrCreate(SESSION);
            session.getLedger().processFill(TestData.fill("f0", TradeAction.BUY, "SPY", 100, "450", null));
            session.getDailyStats().recordFill(
                    TestData.fill("loss", TradeAction.SELL, "QQQ", 100, "390", null), new BigDecimal("-6000"), true);

            AdmissionDecision admission = pipeline.evaluate(TestData.sell("SPY", 50, "450"));

            assertThat(admission.getMode()).isEqualTo(TradingMode.LOCKDOWN);
            assertThat(admission.getDecision().getRuleName()).isEqualTo("LOSS_LIMITS");
            assertThat(admission.getRuleScores()).containsKeys("FREQUENCY", "POSITION_LIMITS", "BUYING_POWER");
        }

        @Test
        @DisplayName("DEFENSIVE scales the per-trade share limit down")
        void defensive_scalesLimits() {
            TradingSession session = sessionRegistry.getOrCreate(SESSION);
            session.getLedger().processFill(TestData.fill("f0", TradeAction.BUY, "SPY", 100, "450", null));
            session.getLedger().updateMarketPrices(Map.of("SPY", new BigDecimal("390")));

            AdmissionDecision tooBig = pipeline.evaluate(TestData.buy("F", 600, "10"));
            AdmissionDecision fits = pipeline.evaluate(TestData.buy("F", 400, "10"));

            assertThat(tooBig.getMode()).isEqualTo(TradingMode.DEFENSIVE);
            assertThat(tooBig.getDecision().getReason()).isEqualTo("Trade size 600 exceeds max shares per trade (500)");
            assertThat(fits.isApproved()).isTrue();
        }
    }

    // ==============================
    // FILLS
    // ==============================

    @Nested
    @DisplayName("Fills")
    class Fills {

        @Test
        @DisplayName("Fill of an approved signal updates the ledger, persists and clears the pending entry")
        void fill_appliedAndPersisted() {
            AdmissionDecision admission = pipeline.evaluate(TestData.buy("AAPL", 10, "150"));

            FillResult result = pipeline.onFill(fillFor(admission, "f1"));

            TradingSession session = sessionRegistry.require(SESSION);
            assertThat(result.getCashAfter()).isEqualByComparingTo("98499");
            assertThat(session.getLedger().getPosition("AAPL").getQuantity()).isEqualTo(10);
            assertThat(pendingSignalRegistry.size()).isZero();
            assertThat(session.getDailyStats().snapshot().tradesFor("AAPL")).isEqualTo(1);
            verify(ledgerPersistenceService).persistFill(eq(result.getTransaction()), any(PortfolioState.class));
            assertThat(publishedEvents()).hasAtLeastOneElementOfType(FillAppliedEvent.class);
        }

        @Test
        @DisplayName("Closing fill at a loss feeds the daily P&L and streak")
        void closingLoss_updatesStats() {
            pipeline.onFill(TestData.fill("f1", TradeAction.BUY, "AAPL", 10, "150", null));
            pipeline.onFill(TestData.fill("f2", TradeAction.SELL, "AAPL", 10, "140", null));

            DailyStats stats = sessionRegistry.require(SESSION).getDailyStats().snapshot();
            assertThat(stats.getRealizedPnl()).isEqualByComparingTo("-100");
            assertThat(stats.getConsecutiveLosses()).isEqualTo(1);
        }

        @Test
        @DisplayName("Duplicate fill is rethrown and reported as a ledger inconsistency")
        void duplicate_reported() {
            Fill fill = TestData.fill("f1", TradeAction.BUY, "AAPL", 10, "150", null);
            pipeline.onFill(fill);

            assertThatThrownBy(() -> pipeline.onFill(fill)).isInstanceOf(DuplicateFillException.class);

            assertThat(publishedEvents())
                    .filteredOn(RiskEvent.class::isInstance)
                    .extracting(event -> ((RiskEvent) event).getEventType())
                    .containsOnly(RiskEventType.LEDGER_INCONSISTENCY);
            verify(ledgerPersistenceService).persistFill(any(), any());
        }

        @Test
        @DisplayName("Oversell is rejected and reported, and the holding stays usable")
        void oversell_rejectedAndReported() {
            pipeline.onFill(TestData.fill("f1", TradeAction.BUY, "SPY", 100, "450", null));

            assertThatThrownBy(() -> pipeline.onFill(TestData.fill("f2", TradeAction.SELL, "SPY", 150, "455", null)))
                    .isInstanceOf(InsufficientPositionException.class);
            FillResult topUp = pipeline.onFill(TestData.fill("f3", TradeAction.BUY, "SPY", 50, "460", null));

            TradingSession session = sessionRegistry.require(SESSION);
            assertThat(session.getLedger().getPosition("SPY").getQuantity()).isEqualTo(150);
            assertThat(topUp.getCashAfter()).isEqualByComparingTo("32000");
            assertThat(session.getDailyStats().snapshot().getRealizedPnl()).isEqualByComparingTo("0");
            assertThat(publishedEvents())
                    .filteredOn(RiskEvent.class::isInstance)
                    .extracting(event -> ((RiskEvent) event).getEventType())
                    .containsOnly(RiskEventType.LEDGER_INCONSISTENCY);
            verify(ledgerPersistenceService, never()).persistFill(
                    argThat(tx -> "f2".equals(tx.getFillId())), any());
        }

        @Test
        @DisplayName("Malformed fill is refused without touching the ledger")
        void malformed_refused() {
            Fill fill = TestData.fill("f1", TradeAction.BUY, "AAPL", 10, "150", "-1");

            assertThatThrownBy(() -> pipeline.onFill(fill)).isInstanceOf(FillValidationException.class);

            verify(ledgerPersistenceService, never()).persistFill(any(), any());
        }
    }

    // ==============================
    // MARKET PRICES
    // ==============================

    @Test
    @DisplayName("Price batch marks the session's positions")
    void marketPrices_markPositions() {
        pipeline.onFill(TestData.fill("f1", TradeAction.BUY, "SPY", 100, "450", null));

        PortfolioState after = pipeline.onMarketPrices(
                MarketPriceUpdate.builder().sessionId(SESSION).prices(Map.of("SPY", new BigDecimal("460"))).build());

        assertThat(after.getPortfolioValue()).isEqualByComparingTo("101000");
        assertThat(pipeline.currentMode(SESSION).getMode()).isEqualTo(TradingMode.NORMAL);
    }
}
