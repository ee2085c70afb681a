package com.riskledger.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.riskledger.bus.DecisionPublisher;
import com.riskledger.domain.enums.TradeAction;
import com.riskledger.domain.model.FillResult;
import com.riskledger.event.AdmissionEvent;
import com.riskledger.event.FillAppliedEvent;
import com.riskledger.event.RiskEvent;
import com.riskledger.event.RiskEventType;
import com.riskledger.event.RiskLevel;
import com.riskledger.ledger.LedgerPersistenceService;
import com.riskledger.observability.CustomMetricsService;
import com.riskledger.pipeline.PendingSignalRegistry;
import com.riskledger.risk.BuyingPowerProvider;
import com.riskledger.session.TradingSessionRegistry;
import com.riskledger.stats.DailyStatsPersistenceService;
import com.riskledger.unit.support.Admissions;
import com.riskledger.unit.support.MutableClock;
import com.riskledger.unit.support.TestData;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Tests for CustomMetricsService: event-driven counters and the function counters and
 * gauges read from their owning components.
 *
 * <p>Lenient strictness because function counters only call their suppliers on read.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CustomMetricsServiceTest {

    private MeterRegistry meterRegistry;
    private PendingSignalRegistry pendingSignalRegistry;
    private CustomMetricsService customMetricsService;

    @Mock
    private LedgerPersistenceService ledgerPersistenceService;

    @Mock
    private DailyStatsPersistenceService dailyStatsPersistenceService;

    @Mock
    private BuyingPowerProvider buyingPowerProvider;

    @Mock
    private DecisionPublisher decisionPublisher;

    @Mock
    private TradingSessionRegistry sessionRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        pendingSignalRegistry = new PendingSignalRegistry(10, 100, new MutableClock(TestData.NOW));
        when(sessionRegistry.all()).thenReturn(List.of());
        customMetricsService = new CustomMetricsService(
                meterRegistry,
                ledgerPersistenceService,
                dailyStatsPersistenceService,
                buyingPowerProvider,
                pendingSignalRegistry,
                decisionPublisher,
                sessionRegistry);
    }

    @Nested
    @DisplayName("Admission metrics")
    class AdmissionMetrics {

        @Test
        @DisplayName("signals.approved counts approvals and records latency")
        void approvedCounted() {
            customMetricsService.onAdmission(new AdmissionEvent(this, Admissions.approved(TestData.buy("AAPL", 10, "150"))));
            customMetricsService.onAdmission(new AdmissionEvent(this, Admissions.approved(TestData.buy("MSFT", 5, "400"))));

            assertThat(meterRegistry.get("signals.approved").counter().count()).isEqualTo(2.0);
            assertThat(meterRegistry.get("admission.latency").timer().count()).isEqualTo(2);
            assertThat(meterRegistry.get("admission.latency").timer().totalTime(TimeUnit.MILLISECONDS))
                    .isEqualTo(6.0);
        }

        @Test
        @DisplayName("signals.rejected is tagged with the rule that stopped the signal")
        void rejectedTaggedByRule() {
            customMetricsService.onAdmission(new AdmissionEvent(this, Admissions.rejected(
                    TestData.buy("SPY", 5000, "10"), "POSITION_LIMITS", "Trade size 5000 exceeds max shares per trade (1000)")));
            customMetricsService.onAdmission(new AdmissionEvent(this, Admissions.rejected(
                    TestData.buy("SPY", 10, "10"), "FREQUENCY", "Daily trade limit reached (100)")));
            customMetricsService.onAdmission(new AdmissionEvent(this, Admissions.rejected(
                    TestData.buy("SPY", 6000, "10"), "POSITION_LIMITS", "Trade size 6000 exceeds max shares per trade (1000)")));

            assertThat(meterRegistry.get("signals.rejected").tag("rule", "POSITION_LIMITS").counter().count())
                    .isEqualTo(2.0);
            assertThat(meterRegistry.get("signals.rejected").tag("rule", "FREQUENCY").counter().count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.get("signals.approved").counter().count()).isZero();
        }
    }

    @Nested
    @DisplayName("Fill and bus metrics")
    class FillMetrics {

        @Test
        @DisplayName("fills.applied increments per applied fill")
        void fillsApplied() {
            customMetricsService.onFillApplied(new FillAppliedEvent(
                    this, TestData.fill("f1", TradeAction.BUY, "AAPL", 10, "150", null), FillResult.builder().build()));

            assertThat(meterRegistry.get("fills.applied").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Risk events feed the invalid-message and rejected-fill counters")
        void riskEventsCounted() {
            customMetricsService.onRiskEvent(new RiskEvent(
                    this, TestData.SESSION, RiskEventType.INVALID_MESSAGE, RiskLevel.WARNING, "bad json"));
            customMetricsService.onRiskEvent(new RiskEvent(
                    this, TestData.SESSION, RiskEventType.LEDGER_INCONSISTENCY, RiskLevel.CRITICAL, "duplicate"));
            customMetricsService.onRiskEvent(new RiskEvent(
                    this, TestData.SESSION, RiskEventType.MODE_CHANGED, RiskLevel.CRITICAL, "lockdown"));

            assertThat(meterRegistry.get("messages.invalid").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("fills.rejected").counter().count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Component-backed metrics")
    class ComponentMetrics {

        @Test
        @DisplayName("Failure and fallback counters read their components on scrape")
        void functionCountersReadComponents() {
            when(ledgerPersistenceService.getFailureCount()).thenReturn(4L);
            when(dailyStatsPersistenceService.getFailureCount()).thenReturn(1L);
            when(buyingPowerProvider.getFallbackCount()).thenReturn(7L);
            when(decisionPublisher.getPublishFailures()).thenReturn(2L);

            assertThat(meterRegistry.get("ledger.persistence.failures").functionCounter().count()).isEqualTo(4.0);
            assertThat(meterRegistry.get("daily-stats.persistence.failures").functionCounter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("buying-power.fallbacks").functionCounter().count()).isEqualTo(7.0);
            assertThat(meterRegistry.get("bus.publish.failures").functionCounter().count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("pending.signals gauge tracks the pending registry")
        void pendingGauge() {
            pendingSignalRegistry.register(TestData.SESSION, TestData.buy("AAPL", 10, "150"));
            pendingSignalRegistry.register(TestData.SESSION, TestData.buy("MSFT", 5, "400"));

            assertThat(meterRegistry.get("pending.signals").gauge().value()).isEqualTo(2.0);
            assertThat(meterRegistry.get("sessions.active").gauge().value()).isZero();
        }
    }
}
