package com.riskledger.unit.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.riskledger.domain.enums.TradeAction;
import com.riskledger.domain.model.DailyStats;
import com.riskledger.domain.model.LedgerSnapshot;
import com.riskledger.domain.model.PortfolioState;
import com.riskledger.exception.ResourceNotFoundException;
import com.riskledger.ledger.LedgerPersistenceService;
import com.riskledger.risk.RiskLimits;
import com.riskledger.session.TradingSession;
import com.riskledger.session.TradingSessionRegistry;
import com.riskledger.stats.DailyStatsPersistenceService;
import com.riskledger.unit.support.MutableClock;
import com.riskledger.unit.support.TestData;
import java.math.BigDecimal;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TradingSessionRegistryTest {

    @Mock
    private LedgerPersistenceService ledgerPersistenceService;

    @Mock
    private DailyStatsPersistenceService dailyStatsPersistenceService;

    private TradingSessionRegistry registry;

    @BeforeEach
    void setUp() {
        RiskLimits limits = RiskLimits.builder()
                .capital(RiskLimits.Capital.builder().initialCapital(new BigDecimal("50000")).build())
                .build();
        registry = new TradingSessionRegistry(
                ledgerPersistenceService, dailyStatsPersistenceService, limits, new MutableClock(TestData.NOW), "paper", 1000);
    }

    // ==============================
    // OPENING
    // ==============================

    @Nested
    @DisplayName("Opening sessions")
    class Opening {

        @Test
        @DisplayName("Missing or blank session id resolves to the default session")
        void defaultSession() {
            assertThat(registry.resolveSessionId(null)).isEqualTo("paper");
            assertThat(registry.resolveSessionId("  ")).isEqualTo("paper");
            assertThat(registry.getOrCreate(null).getSessionId()).isEqualTo("paper");
        }

        @Test
        @DisplayName("New session starts from configured capital")
        void freshSession() {
            TradingSession session = registry.getOrCreate("bt-2");

            PortfolioState state = session.getLedger().getState();
            assertThat(state.getCash()).isEqualByComparingTo("50000");
            assertThat(state.getInitialCapital()).isEqualByComparingTo("50000");
            assertThat(state.getPositions()).isEmpty();
        }

        @Test
        @DisplayName("getOrCreate returns the same session on repeated calls")
        void sameInstance() {
            TradingSession first = registry.getOrCreate("bt-2");
            TradingSession second = registry.getOrCreate("bt-2");

            assertThat(second).isSameAs(first);
            verify(ledgerPersistenceService, times(1)).loadSnapshot("bt-2");
        }

        @Test
        @DisplayName("Stored ledger and today's stats are restored on open")
        void restoredFromPersistence() {
            LedgerSnapshot stored = TestData.ledgerHolding("100000", "SPY", 100, "450").snapshot();
            DailyStats todays = TestData.emptyStats().toBuilder().totalTrades(7).approvedTrades(6).rejectedTrades(1).build();
            when(ledgerPersistenceService.loadSnapshot(TestData.SESSION)).thenReturn(Optional.of(stored));
            when(dailyStatsPersistenceService.load(TestData.SESSION, TestData.TODAY)).thenReturn(Optional.of(todays));

            TradingSession session = registry.getOrCreate(TestData.SESSION);

            assertThat(session.getLedger().getPosition("SPY").getQuantity()).isEqualTo(100);
            assertThat(session.getLedger().getState().getCash()).isEqualByComparingTo("55000");
            assertThat(session.getLedger().hasApplied("seed-SPY")).isTrue();
            assertThat(session.getDailyStats().snapshot().getTotalTrades()).isEqualTo(7);
        }

        @Test
        @DisplayName("create uses the requested capital and ignores a second create")
        void explicitCreate() {
            TradingSession created = registry.create("bt-3", new BigDecimal("250000"));
            TradingSession again = registry.create("bt-3", new BigDecimal("1"));

            assertThat(again).isSameAs(created);
            assertThat(created.getLedger().getState().getInitialCapital()).isEqualByComparingTo("250000");
        }
    }

    // ==============================
    // LIFECYCLE
    // ==============================

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("require on an unknown session throws not found")
        void requireUnknown() {
            assertThatThrownBy(() -> registry.require("nope")).isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("close persists final state and drops the session")
        void closePersists() {
            registry.getOrCreate("bt-4");

            PortfolioState finalState = registry.close("bt-4");

            verify(ledgerPersistenceService).saveState(finalState);
            verify(ledgerPersistenceService).saveSnapshot(finalState);
            verify(dailyStatsPersistenceService).save(eq("bt-4"), any(DailyStats.class));
            assertThat(registry.find("bt-4")).isEmpty();
        }

        @Test
        @DisplayName("reset wipes history and restarts from the session's initial capital")
        void resetRestarts() {
            TradingSession original = registry.create("bt-5", new BigDecimal("80000"));
            original.getLedger().processFill(TestData.fill("f-1", TradeAction.BUY, "AAPL", 10, "150", null));

            TradingSession fresh = registry.reset("bt-5");

            verify(ledgerPersistenceService).deleteSession("bt-5");
            assertThat(fresh).isNotSameAs(original);
            assertThat(fresh.getLedger().getState().getCash()).isEqualByComparingTo("80000");
            assertThat(fresh.getLedger().hasApplied("f-1")).isFalse();
            assertThat(registry.require("bt-5")).isSameAs(fresh);
        }

        @Test
        @DisplayName("close of an unknown session writes nothing")
        void closeUnknown() {
            assertThatThrownBy(() -> registry.close("ghost")).isInstanceOf(ResourceNotFoundException.class);
            verify(ledgerPersistenceService, never()).saveState(any());
        }
    }
}
