package com.riskledger.observability;

import com.riskledger.domain.enums.SignalState;
import com.riskledger.domain.model.AdmissionDecision;
import com.riskledger.domain.model.RiskEventRecord;
import com.riskledger.domain.model.TradeSignal;
import com.riskledger.entity.RiskEventEntity;
import com.riskledger.event.AdmissionEvent;
import com.riskledger.mapper.RiskEventMapper;
import com.riskledger.repository.jpa.RiskEventJpaRepository;
import com.riskledger.risk.RiskDecision;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Audit log of admission decisions in the {@code risk_events} table.
 *
 * <p>Decisions are queued as they happen and written in batches on a fixed schedule, so
 * the admission path never waits on the database. After {@value #FAILURE_THRESHOLD}
 * consecutive failed flushes the writer backs off for {@value #RECOVERY_INTERVAL_MS}ms;
 * queued rows are kept and retried.
 */
@Service
public class RiskAuditService {

    private static final Logger log = LoggerFactory.getLogger(RiskAuditService.class);

    private static final int FAILURE_THRESHOLD = 3;
    private static final long RECOVERY_INTERVAL_MS = 60_000;
    private static final int MAX_BATCH_SIZE = 200;
    private static final int MAX_QUERY_LIMIT = 1000;

    private static final TypeReference<Map<String, Object>> DETAILS = new TypeReference<>() {};

    private final RiskEventJpaRepository riskEventJpaRepository;
    private final ObjectMapper objectMapper;
    private final RiskEventMapper riskEventMapper = Mappers.getMapper(RiskEventMapper.class);

    private final ConcurrentLinkedQueue<RiskEventEntity> pendingQueue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicBoolean circuitOpen = new AtomicBoolean(false);
    private volatile long circuitOpenedAt = 0;

    public RiskAuditService(RiskEventJpaRepository riskEventJpaRepository, ObjectMapper objectMapper) {
        this.riskEventJpaRepository = riskEventJpaRepository;
        this.objectMapper = objectMapper;
    }

    @EventListener
    @Order(10)
    public void onAdmission(AdmissionEvent event) {
        pendingQueue.add(toEntity(event.getDecision()));
    }

    @Scheduled(fixedRateString = "${risk-ledger.audit.flush-interval-ms:5000}")
    public void flush() {
        if (pendingQueue.isEmpty()) {
            return;
        }

        if (circuitOpen.get()) {
            if (System.currentTimeMillis() - circuitOpenedAt < RECOVERY_INTERVAL_MS) {
                log.debug("Audit writer backing off, {} records queued", pendingQueue.size());
                return;
            }
            log.info("Audit writer recovery attempt, {} records queued", pendingQueue.size());
        }

        List<RiskEventEntity> batch = new ArrayList<>(MAX_BATCH_SIZE);
        for (int i = 0; i < MAX_BATCH_SIZE; i++) {
            RiskEventEntity entity = pendingQueue.poll();
            if (entity == null) {
                break;
            }
            batch.add(entity);
        }
        if (batch.isEmpty()) {
            return;
        }

        try {
            riskEventJpaRepository.saveAll(batch);
            if (circuitOpen.compareAndSet(true, false)) {
                log.info("Audit writer recovered");
            }
            consecutiveFailures.set(0);
            log.debug("Flushed {} risk events", batch.size());
        } catch (RuntimeException e) {
            int failures = consecutiveFailures.incrementAndGet();
            log.error("Failed to persist {} risk events (failure {}/{}): {}",
                    batch.size(), failures, FAILURE_THRESHOLD, e.getMessage());
            if (failures >= FAILURE_THRESHOLD && circuitOpen.compareAndSet(false, true)) {
                circuitOpenedAt = System.currentTimeMillis();
                log.warn("Audit writer paused for {}ms after {} consecutive failures, {} records queued",
                        RECOVERY_INTERVAL_MS, failures, pendingQueue.size() + batch.size());
            }
            pendingQueue.addAll(batch);
        }
    }

    /** Drains the queue on shutdown regardless of the back-off state. */
    @PreDestroy
    public void flushOnShutdown() {
        circuitOpen.set(false);
        consecutiveFailures.set(0);
        int attempts = 0;
        while (!pendingQueue.isEmpty() && consecutiveFailures.get() == 0 && attempts++ < 50) {
            flush();
        }
    }

    // ==============================
    // QUERIES
    // ==============================

    /** Newest first; {@code decision} null for all outcomes. */
    public List<RiskEventRecord> recentEvents(int limit, SignalState decision) {
        PageRequest page = PageRequest.of(0, clamp(limit));
        List<RiskEventEntity> rows = decision == null
                ? riskEventJpaRepository.findAllByOrderByEvaluatedAtDesc(page)
                : riskEventJpaRepository.findByDecisionOrderByEvaluatedAtDesc(decision, page);
        return rows.stream().map(this::toRecord).toList();
    }

    public List<RiskEventRecord> recentRejections(int limit) {
        return recentEvents(limit, SignalState.REJECTED);
    }

    public int getPendingCount() {
        return pendingQueue.size();
    }

    public boolean isCircuitOpen() {
        return circuitOpen.get();
    }

    private RiskEventEntity toEntity(AdmissionDecision admission) {
        TradeSignal signal = admission.getSignal();
        RiskDecision decision = admission.getDecision();
        Map<String, Object> details = new LinkedHashMap<>(decision.getDetails());
        if (admission.getRuleScores() != null && !admission.getRuleScores().isEmpty()) {
            details.put("ruleScores", admission.getRuleScores());
        }
        return RiskEventEntity.builder()
                .sessionId(admission.getSessionId())
                .signalId(signal.getSignalId())
                .strategyId(signal.getStrategyId())
                .symbol(signal.getSymbol())
                .action(signal.getAction())
                .quantity(signal.getQuantity())
                .price(signal.getPrice())
                .decision(admission.getState())
                .ruleName(decision.getRuleName())
                .reason(truncate(decision.getReason(), 500))
                .score(decision.getScore())
                .mode(admission.getMode())
                .portfolioValue(admission.getPortfolioValue())
                .processingTimeMs(admission.getProcessingTimeMs())
                .detailsJson(writeDetails(details))
                .evaluatedAt(admission.getEvaluatedAt())
                .build();
    }

    private RiskEventRecord toRecord(RiskEventEntity entity) {
        RiskEventRecord record = riskEventMapper.toRecord(entity);
        if (entity.getDetailsJson() != null) {
            try {
                record.setDetails(objectMapper.readValue(entity.getDetailsJson(), DETAILS));
            } catch (RuntimeException e) {
                log.warn("Unreadable details on risk event {}: {}", entity.getId(), e.getMessage());
            }
        }
        return record;
    }

    private String writeDetails(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (RuntimeException e) {
            log.warn("Could not serialize decision details: {}", e.getMessage());
            return null;
        }
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }

    private static int clamp(int limit) {
        return Math.max(1, Math.min(limit, MAX_QUERY_LIMIT));
    }
}
