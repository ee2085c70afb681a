package com.riskledger.pipeline;

import com.riskledger.domain.model.TradeSignal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Approved signals waiting for their first fill, keyed by signal id.
 *
 * <p>Bounded two ways: entries older than the TTL are swept on a schedule, and when the
 * map is full the oldest entry is dropped to make room. A signal that never fills simply
 * ages out; that is not an error.
 */
@Component
public class PendingSignalRegistry {

    private static final Logger log = LoggerFactory.getLogger(PendingSignalRegistry.class);

    private final ConcurrentHashMap<String, PendingSignal> pending = new ConcurrentHashMap<>();
    private final AtomicLong evictions = new AtomicLong();

    private final Duration ttl;
    private final int maxPending;
    private final Clock clock;

    public PendingSignalRegistry(
            @Value("${risk-ledger.pipeline.pending-ttl-minutes:10}") long ttlMinutes,
            @Value("${risk-ledger.pipeline.max-pending:10000}") int maxPending,
            Clock clock) {
        this.ttl = Duration.ofMinutes(ttlMinutes);
        this.maxPending = maxPending;
        this.clock = clock;
    }

    public void register(String sessionId, TradeSignal signal) {
        if (pending.size() >= maxPending) {
            evictOldest();
        }
        pending.put(signal.getSignalId(), new PendingSignal(sessionId, signal, clock.instant()));
    }

    /** Removes the signal on its first fill. Returns false when it was unknown or already expired. */
    public boolean complete(String signalId) {
        return signalId != null && pending.remove(signalId) != null;
    }

    public Optional<PendingSignal> find(String signalId) {
        return Optional.ofNullable(pending.get(signalId));
    }

    @Scheduled(fixedDelayString = "${risk-ledger.pipeline.sweep-interval-ms:60000}")
    public int evictExpired() {
        Instant cutoff = clock.instant().minus(ttl);
        int before = pending.size();
        pending.entrySet().removeIf(entry -> entry.getValue().approvedAt().isBefore(cutoff));
        int evicted = before - pending.size();
        if (evicted > 0) {
            evictions.addAndGet(evicted);
            log.debug("Evicted {} pending signals older than {}", evicted, ttl);
        }
        return evicted;
    }

    public int size() {
        return pending.size();
    }

    public long getEvictionCount() {
        return evictions.get();
    }

    private void evictOldest() {
        pending.entrySet().stream()
                .min(Comparator.comparing((Map.Entry<String, PendingSignal> e) -> e.getValue().approvedAt()))
                .ifPresent(oldest -> {
                    if (pending.remove(oldest.getKey(), oldest.getValue())) {
                        evictions.incrementAndGet();
                        log.warn("Pending signal registry full ({}), dropped {}", maxPending, oldest.getKey());
                    }
                });
    }

    public record PendingSignal(String sessionId, TradeSignal signal, Instant approvedAt) {}
}
