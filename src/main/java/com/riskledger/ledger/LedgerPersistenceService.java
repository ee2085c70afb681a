package com.riskledger.ledger;

import com.riskledger.domain.model.LedgerSnapshot;
import com.riskledger.domain.model.LedgerTransaction;
import com.riskledger.domain.model.PortfolioSnapshotRecord;
import com.riskledger.domain.model.PortfolioState;
import com.riskledger.domain.model.Position;
import com.riskledger.entity.PortfolioSnapshotEntity;
import com.riskledger.entity.PortfolioStateEntity;
import com.riskledger.entity.PositionEntity;
import com.riskledger.entity.TransactionEntity;
import com.riskledger.mapper.PositionMapper;
import com.riskledger.mapper.TransactionMapper;
import com.riskledger.repository.jpa.PortfolioSnapshotJpaRepository;
import com.riskledger.repository.jpa.PortfolioStateJpaRepository;
import com.riskledger.repository.jpa.PositionJpaRepository;
import com.riskledger.repository.jpa.TransactionJpaRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Best-effort persistence of ledger state to H2.
 *
 * <p>The in-memory ledger is authoritative. A failed write is logged, counted and
 * otherwise ignored: it never rolls back or blocks the fill that triggered it. The failure
 * count is exported as {@code ledger.persistence.failures} and shown on the risk status
 * endpoint, so a silently degrading database is still visible.
 *
 * <p>A fill's journal row and the state it produced are written in one transaction, so
 * storage never holds a journaled fill without its state or the reverse.
 *
 * <p>Tables:
 * <ul>
 *   <li>{@code portfolio_state}: latest totals, one row per session</li>
 *   <li>{@code positions}: open positions, one row per (session, symbol)</li>
 *   <li>{@code transactions}: append-only fill journal, also the source of the most recent
 *       applied fill ids on restore</li>
 *   <li>{@code portfolio_snapshots}: periodic history</li>
 * </ul>
 */
@Service
public class LedgerPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(LedgerPersistenceService.class);

    private static final TypeReference<List<Position>> POSITION_LIST = new TypeReference<>() {};

    private final PortfolioStateJpaRepository portfolioStateJpaRepository;
    private final PositionJpaRepository positionJpaRepository;
    private final TransactionJpaRepository transactionJpaRepository;
    private final PortfolioSnapshotJpaRepository portfolioSnapshotJpaRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final int fillIdWindow;

    private final PositionMapper positionMapper = Mappers.getMapper(PositionMapper.class);
    private final TransactionMapper transactionMapper = Mappers.getMapper(TransactionMapper.class);

    private final AtomicLong failureCount = new AtomicLong();
    private volatile Instant lastFailureAt;
    private volatile String lastFailure;

    public LedgerPersistenceService(
            PortfolioStateJpaRepository portfolioStateJpaRepository,
            PositionJpaRepository positionJpaRepository,
            TransactionJpaRepository transactionJpaRepository,
            PortfolioSnapshotJpaRepository portfolioSnapshotJpaRepository,
            ObjectMapper objectMapper,
            PlatformTransactionManager transactionManager,
            Clock clock,
            @Value("${risk-ledger.ledger.fill-id-window:50000}") int fillIdWindow) {
        this.portfolioStateJpaRepository = portfolioStateJpaRepository;
        this.positionJpaRepository = positionJpaRepository;
        this.transactionJpaRepository = transactionJpaRepository;
        this.portfolioSnapshotJpaRepository = portfolioSnapshotJpaRepository;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.fillIdWindow = fillIdWindow;
    }

    // ==============================
    // WRITES (never throw)
    // ==============================

    /** Journals the transaction and overwrites the session's state and positions, atomically. */
    public void persistFill(LedgerTransaction transaction, PortfolioState state) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                transactionJpaRepository.save(transactionMapper.toEntity(transaction));
                writeState(state);
            });
        } catch (RuntimeException e) {
            recordFailure("persist fill " + transaction.getFillId(), transaction.getSessionId(), e);
        }
    }

    public void saveState(PortfolioState state) {
        try {
            transactionTemplate.executeWithoutResult(status -> writeState(state));
        } catch (RuntimeException e) {
            recordFailure("save state", state.getSessionId(), e);
        }
    }

    public void saveSnapshot(PortfolioState state) {
        try {
            portfolioSnapshotJpaRepository.save(PortfolioSnapshotEntity.builder()
                    .sessionId(state.getSessionId())
                    .cash(state.getCash())
                    .portfolioValue(state.getPortfolioValue())
                    .totalRealizedPnl(state.getTotalRealizedPnl())
                    .totalUnrealizedPnl(state.getTotalUnrealizedPnl())
                    .drawdown(state.getDrawdown())
                    .numPositions(state.getNumPositions())
                    .positionsJson(objectMapper.writeValueAsString(new ArrayList<>(state.getPositions().values())))
                    .snapshotTime(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            recordFailure("save snapshot", state.getSessionId(), e);
        }
    }

    // ==============================
    // RESTORE / LIFECYCLE
    // ==============================

    /**
     * Rebuilds a ledger snapshot from the stored state, open positions and the ids of the
     * last {@code fillIdWindow} journaled fills. Empty when the session was never persisted
     * or the read fails.
     */
    public Optional<LedgerSnapshot> loadSnapshot(String sessionId) {
        try {
            Optional<PortfolioStateEntity> stateRow = portfolioStateJpaRepository.findById(sessionId);
            if (stateRow.isEmpty()) {
                return Optional.empty();
            }
            PortfolioStateEntity state = stateRow.get();
            List<Position> positions = positionMapper.toDomainList(positionJpaRepository.findBySessionId(sessionId));
            List<String> fillIds = new ArrayList<>(
                    transactionJpaRepository.findRecentFillIds(sessionId, PageRequest.of(0, fillIdWindow)));
            Collections.reverse(fillIds);

            return Optional.of(LedgerSnapshot.builder()
                    .sessionId(sessionId)
                    .initialCapital(state.getInitialCapital())
                    .cash(state.getCash())
                    .peakValue(state.getPeakValue())
                    .totalRealizedPnl(state.getTotalRealizedPnl())
                    .totalUnrealizedPnl(state.getTotalUnrealizedPnl())
                    .totalCommissions(state.getTotalCommissions())
                    .totalTrades(state.getTotalTrades())
                    .positions(positions)
                    .appliedFillIds(new LinkedHashSet<>(fillIds))
                    .build());
        } catch (RuntimeException e) {
            recordFailure("load state", sessionId, e);
            return Optional.empty();
        }
    }

    /** Removes every stored row of the session. Used by session reset. */
    @Transactional
    public void deleteSession(String sessionId) {
        transactionJpaRepository.deleteBySessionId(sessionId);
        positionJpaRepository.deleteBySessionId(sessionId);
        portfolioSnapshotJpaRepository.deleteBySessionId(sessionId);
        portfolioStateJpaRepository.deleteById(sessionId);
        log.info("[{}] Deleted persisted ledger data", sessionId);
    }

    // ==============================
    // QUERIES
    // ==============================

    /** Newest first. */
    public List<LedgerTransaction> getTransactions(String sessionId, int limit, int offset) {
        List<TransactionEntity> page = transactionJpaRepository.findBySessionIdOrderByTimestampDescIdDesc(
                sessionId, PageRequest.of(0, offset + limit));
        List<TransactionEntity> window = page.size() > offset ? page.subList(offset, page.size()) : List.of();
        return transactionMapper.toDomainList(window);
    }

    /** Oldest first; the whole journal of the session. */
    public List<LedgerTransaction> getAllTransactions(String sessionId) {
        return transactionMapper.toDomainList(transactionJpaRepository.findBySessionIdOrderByIdAsc(sessionId));
    }

    /** Newest first. */
    public List<PortfolioSnapshotRecord> getSnapshots(String sessionId, int limit) {
        return portfolioSnapshotJpaRepository
                .findBySessionIdOrderBySnapshotTimeDesc(sessionId, PageRequest.of(0, limit))
                .stream()
                .map(this::toRecord)
                .toList();
    }

    // ==============================
    // FAILURE ACCOUNTING
    // ==============================

    public long getFailureCount() {
        return failureCount.get();
    }

    public Instant getLastFailureAt() {
        return lastFailureAt;
    }

    public String getLastFailure() {
        return lastFailure;
    }

    private void recordFailure(String operation, String sessionId, RuntimeException e) {
        long failures = failureCount.incrementAndGet();
        lastFailureAt = clock.instant();
        lastFailure = operation + ": " + e.getMessage();
        log.error("[{}] Ledger persistence failed ({}), {} failures total: {}",
                sessionId, operation, failures, e.getMessage(), e);
    }

    private void writeState(PortfolioState state) {
        Instant now = clock.instant();
        portfolioStateJpaRepository.save(PortfolioStateEntity.builder()
                .sessionId(state.getSessionId())
                .cash(state.getCash())
                .initialCapital(state.getInitialCapital())
                .totalRealizedPnl(state.getTotalRealizedPnl())
                .totalUnrealizedPnl(state.getTotalUnrealizedPnl())
                .totalCommissions(state.getTotalCommissions())
                .totalTrades(state.getTotalTrades())
                .peakValue(state.getPeakValue())
                .portfolioValue(state.getPortfolioValue())
                .updatedAt(now)
                .build());

        Map<String, PositionEntity> stored = new HashMap<>();
        positionJpaRepository.findBySessionId(state.getSessionId())
                .forEach(entity -> stored.put(entity.getSymbol(), entity));

        List<PositionEntity> upserts = new ArrayList<>();
        for (Position position : state.getPositions().values()) {
            PositionEntity entity = positionMapper.toEntity(position);
            PositionEntity existing = stored.remove(position.getSymbol());
            entity.setId(existing != null ? existing.getId() : null);
            entity.setSessionId(state.getSessionId());
            entity.setUpdatedAt(now);
            upserts.add(entity);
        }
        positionJpaRepository.saveAll(upserts);
        if (!stored.isEmpty()) {
            positionJpaRepository.deleteAll(stored.values());
        }
    }

    private PortfolioSnapshotRecord toRecord(PortfolioSnapshotEntity entity) {
        List<Position> positions;
        try {
            positions = entity.getPositionsJson() != null
                    ? objectMapper.readValue(entity.getPositionsJson(), POSITION_LIST)
                    : List.of();
        } catch (RuntimeException e) {
            log.warn("Unreadable positions in snapshot {}: {}", entity.getId(), e.getMessage());
            positions = List.of();
        }
        return PortfolioSnapshotRecord.builder()
                .sessionId(entity.getSessionId())
                .cash(entity.getCash())
                .portfolioValue(entity.getPortfolioValue())
                .totalRealizedPnl(entity.getTotalRealizedPnl())
                .totalUnrealizedPnl(entity.getTotalUnrealizedPnl())
                .drawdown(entity.getDrawdown())
                .numPositions(entity.getNumPositions())
                .positions(positions)
                .snapshotTime(entity.getSnapshotTime())
                .build();
    }
}
