package com.riskledger.observability;

import com.riskledger.bus.DecisionPublisher;
import com.riskledger.domain.model.AdmissionDecision;
import com.riskledger.event.AdmissionEvent;
import com.riskledger.event.FillAppliedEvent;
import com.riskledger.event.RiskEvent;
import com.riskledger.ledger.LedgerPersistenceService;
import com.riskledger.pipeline.PendingSignalRegistry;
import com.riskledger.risk.BuyingPowerProvider;
import com.riskledger.session.TradingSessionRegistry;
import com.riskledger.stats.DailyStatsPersistenceService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers the service's Micrometer meters.
 *
 * <ul>
 *   <li><b>signals.approved</b> / <b>signals.rejected</b> (counters, rejections tagged by rule)</li>
 *   <li><b>messages.invalid</b> (counter): undecodable or structurally invalid bus messages</li>
 *   <li><b>fills.applied</b> / <b>fills.rejected</b> (counters)</li>
 *   <li><b>admission.latency</b> (timer)</li>
 *   <li><b>ledger.persistence.failures</b>, <b>buying-power.fallbacks</b>,
 *       <b>pending.signals.evicted</b>, <b>bus.publish.failures</b> (function counters)</li>
 *   <li><b>pending.signals</b>, <b>sessions.active</b> (gauges)</li>
 * </ul>
 *
 * <p>Function counters and gauges read the owning component on scrape; event counters are
 * driven by Spring application events.
 */
@Service
public class CustomMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter approvedCounter;
    private final Counter invalidMessageCounter;
    private final Counter fillsAppliedCounter;
    private final Counter fillsRejectedCounter;
    private final Timer admissionLatencyTimer;

    public CustomMetricsService(
            MeterRegistry meterRegistry,
            LedgerPersistenceService ledgerPersistenceService,
            DailyStatsPersistenceService dailyStatsPersistenceService,
            BuyingPowerProvider buyingPowerProvider,
            PendingSignalRegistry pendingSignalRegistry,
            DecisionPublisher decisionPublisher,
            TradingSessionRegistry sessionRegistry) {
        this.meterRegistry = meterRegistry;

        // Counters
        this.approvedCounter = Counter.builder("signals.approved")
                .description("Signals approved by the risk chain")
                .register(meterRegistry);

        this.invalidMessageCounter = Counter.builder("messages.invalid")
                .description("Bus messages dropped as undecodable or invalid")
                .register(meterRegistry);

        this.fillsAppliedCounter = Counter.builder("fills.applied")
                .description("Fills booked into a ledger")
                .register(meterRegistry);

        this.fillsRejectedCounter = Counter.builder("fills.rejected")
                .description("Fills refused by a ledger as duplicate or unmatched")
                .register(meterRegistry);

        // Timer
        this.admissionLatencyTimer = Timer.builder("admission.latency")
                .description("Time from signal receipt to decision")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(5))
                .register(meterRegistry);

        // Function counters
        FunctionCounter.builder("ledger.persistence.failures", ledgerPersistenceService,
                        service -> service.getFailureCount())
                .description("Failed ledger writes; the in-memory ledger stays authoritative")
                .register(meterRegistry);

        FunctionCounter.builder("daily-stats.persistence.failures", dailyStatsPersistenceService,
                        service -> service.getFailureCount())
                .register(meterRegistry);

        FunctionCounter.builder("buying-power.fallbacks", buyingPowerProvider,
                        provider -> provider.getFallbackCount())
                .description("Remote buying power queries answered by the local estimate")
                .register(meterRegistry);

        FunctionCounter.builder("pending.signals.evicted", pendingSignalRegistry,
                        registry -> registry.getEvictionCount())
                .register(meterRegistry);

        FunctionCounter.builder("bus.publish.failures", decisionPublisher,
                        publisher -> publisher.getPublishFailures())
                .register(meterRegistry);

        // Gauges
        meterRegistry.gauge("pending.signals", pendingSignalRegistry, PendingSignalRegistry::size);
        meterRegistry.gauge("sessions.active", sessionRegistry, registry -> registry.all().size());
    }

    @EventListener
    @Order(20)
    public void onAdmission(AdmissionEvent event) {
        AdmissionDecision decision = event.getDecision();
        if (decision.isApproved()) {
            approvedCounter.increment();
        } else {
            rejectedCounter(decision.getDecision().getRuleName()).increment();
        }
        admissionLatencyTimer.record(decision.getProcessingTimeMs(), TimeUnit.MILLISECONDS);
    }

    @EventListener
    @Order(20)
    public void onFillApplied(FillAppliedEvent event) {
        fillsAppliedCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        switch (event.getEventType()) {
            case INVALID_MESSAGE -> invalidMessageCounter.increment();
            case LEDGER_INCONSISTENCY -> fillsRejectedCounter.increment();
            default -> {
                // mode changes are published on the bus, not counted
            }
        }
    }

    private Counter rejectedCounter(String ruleName) {
        return Counter.builder("signals.rejected")
                .description("Signals rejected, by the rule that stopped them")
                .tag("rule", ruleName)
                .register(meterRegistry);
    }
}
