package com.riskledger.ledger;

import com.riskledger.domain.enums.TradeAction;
import com.riskledger.domain.model.Fill;
import com.riskledger.domain.model.FillResult;
import com.riskledger.domain.model.LedgerSnapshot;
import com.riskledger.domain.model.LedgerTransaction;
import com.riskledger.domain.model.PortfolioState;
import com.riskledger.domain.model.Position;
import com.riskledger.exception.DuplicateFillException;
import com.riskledger.exception.InsufficientPositionException;
import com.riskledger.exception.LedgerConsistencyException;
import com.riskledger.exception.NoPositionException;
import com.riskledger.risk.RiskMath;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authoritative cash, position and P&L book for one trading session.
 *
 * <p>Every mutation and every read runs under one lock, so a {@link PortfolioState}
 * is never built from a half-applied fill. Fills are applied atomically: all new values
 * are computed first and committed only when nothing can fail any more.
 *
 * <p>Accounting rules (cash-and-long equity, commissions charged on both sides):
 * <ul>
 *   <li>BUY: cash -= qty x price + commission; avg price re-weighted; last price = fill price</li>
 *   <li>SELL: realized = qty x (price - avg) - commission; cash += qty x price - commission;
 *       avg price unchanged; the position is dropped when its quantity reaches exactly zero</li>
 * </ul>
 *
 * <p>A SELL may never exceed the held quantity, so positions are never negative. Average
 * prices are kept at {@link #PRICE_SCALE} decimals, the scale of the persisted columns, so
 * a ledger restored from storage reports the same state it had when it was saved.
 *
 * <p>Duplicate detection remembers the most recent {@code fillIdWindow} fill ids.
 */
public class PortfolioLedger {

    private static final Logger log = LoggerFactory.getLogger(PortfolioLedger.class);

    /** Decimal places of stored prices and money amounts. */
    public static final int PRICE_SCALE = 6;

    public static final int DEFAULT_FILL_ID_WINDOW = 50_000;

    private final String sessionId;
    private final Clock clock;
    private final int fillIdWindow;
    private final ReentrantLock lock = new ReentrantLock();

    private BigDecimal initialCapital;
    private BigDecimal cash;
    private BigDecimal peakValue;
    private BigDecimal totalRealizedPnl = BigDecimal.ZERO;
    private BigDecimal totalUnrealizedPnl = BigDecimal.ZERO;
    private BigDecimal totalCommissions = BigDecimal.ZERO;
    private int totalTrades;

    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final Set<String> appliedFillIds = new LinkedHashSet<>();

    public PortfolioLedger(String sessionId, BigDecimal initialCapital, Clock clock) {
        this(sessionId, initialCapital, clock, DEFAULT_FILL_ID_WINDOW);
    }

    public PortfolioLedger(String sessionId, BigDecimal initialCapital, Clock clock, int fillIdWindow) {
        if (fillIdWindow <= 0) {
            throw new IllegalArgumentException("fillIdWindow must be positive: " + fillIdWindow);
        }
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.clock = clock;
        this.fillIdWindow = fillIdWindow;
        this.initialCapital = initialCapital;
        this.cash = initialCapital;
        this.peakValue = initialCapital;
    }

    public static PortfolioLedger fromSnapshot(LedgerSnapshot snapshot, Clock clock) {
        return fromSnapshot(snapshot, clock, DEFAULT_FILL_ID_WINDOW);
    }

    public static PortfolioLedger fromSnapshot(LedgerSnapshot snapshot, Clock clock, int fillIdWindow) {
        PortfolioLedger ledger =
                new PortfolioLedger(snapshot.getSessionId(), snapshot.getInitialCapital(), clock, fillIdWindow);
        ledger.restore(snapshot);
        return ledger;
    }

    public String getSessionId() {
        return sessionId;
    }

    // ==============================
    // MUTATIONS
    // ==============================

    /**
     * Applies one fill. Throws {@link DuplicateFillException} for a fill id already applied,
     * {@link NoPositionException} for a SELL of an unheld symbol and
     * {@link InsufficientPositionException} for a SELL above the held quantity. On any of
     * them the ledger is left exactly as it was.
     */
    public FillResult processFill(Fill fill) {
        Objects.requireNonNull(fill.getFillId(), "fillId");
        lock.lock();
        try {
            if (appliedFillIds.contains(fill.getFillId())) {
                throw new DuplicateFillException(sessionId, fill.getFillId());
            }

            String symbol = fill.getSymbol();
            int quantity = fill.getQuantity();
            if (quantity <= 0) {
                throw new LedgerConsistencyException(
                        "Fill quantity must be positive: " + quantity,
                        Map.of("sessionId", sessionId, "fillId", fill.getFillId(), "quantity", quantity));
            }
            BigDecimal price = fill.getPrice();
            BigDecimal commission = fill.commissionOrZero();
            BigDecimal gross = price.multiply(BigDecimal.valueOf(quantity));

            BigDecimal cashBefore = cash;
            BigDecimal valueBefore = portfolioValue();
            Position current = positions.get(symbol);

            BigDecimal newCash;
            BigDecimal realized = null;
            Position updated;

            if (fill.getAction() == TradeAction.BUY) {
                newCash = cash.subtract(gross).subtract(commission);
                if (current == null) {
                    updated = Position.builder()
                            .symbol(symbol)
                            .quantity(quantity)
                            .avgPrice(price)
                            .lastPrice(price)
                            .build();
                } else {
                    int newQuantity = current.getQuantity() + quantity;
                    BigDecimal costBasis = current.getAvgPrice()
                            .multiply(BigDecimal.valueOf(current.getQuantity()))
                            .add(gross);
                    updated = current.toBuilder()
                            .quantity(newQuantity)
                            .avgPrice(costBasis
                                    .divide(BigDecimal.valueOf(newQuantity), MathContext.DECIMAL64)
                                    .setScale(PRICE_SCALE, RoundingMode.HALF_UP))
                            .lastPrice(price)
                            .build();
                }
            } else {
                if (current == null) {
                    throw new NoPositionException(sessionId, symbol, fill.getFillId());
                }
                if (quantity > current.getQuantity()) {
                    throw new InsufficientPositionException(
                            sessionId, symbol, fill.getFillId(), quantity, current.getQuantity());
                }
                realized = price.subtract(current.getAvgPrice())
                        .multiply(BigDecimal.valueOf(quantity))
                        .subtract(commission);
                newCash = cash.add(gross).subtract(commission);
                updated = current.toBuilder()
                        .quantity(current.getQuantity() - quantity)
                        .realizedPnl(current.getRealizedPnl().add(realized))
                        .build();
            }
            updated.setUnrealizedPnl(unrealizedOf(updated));

            // Commit
            cash = newCash;
            if (updated.getQuantity() == 0) {
                positions.remove(symbol);
            } else {
                positions.put(symbol, updated);
            }
            if (realized != null) {
                totalRealizedPnl = totalRealizedPnl.add(realized);
            }
            totalCommissions = totalCommissions.add(commission);
            totalTrades++;
            rememberFillId(fill.getFillId());
            totalUnrealizedPnl = sumUnrealized();

            BigDecimal valueAfter = portfolioValue();
            raisePeak(valueAfter);

            LedgerTransaction transaction = LedgerTransaction.builder()
                    .sessionId(sessionId)
                    .fillId(fill.getFillId())
                    .symbol(symbol)
                    .action(fill.getAction())
                    .quantity(quantity)
                    .price(price)
                    .amount(gross)
                    .commission(commission)
                    .realizedPnl(realized)
                    .cashBefore(cashBefore)
                    .cashAfter(cash)
                    .portfolioValueBefore(valueBefore)
                    .portfolioValueAfter(valueAfter)
                    .timestamp(fill.getTimestamp() != null ? fill.getTimestamp() : clock.instant())
                    .notes(fill.getStrategyId() != null ? "strategy=" + fill.getStrategyId() : null)
                    .build();

            log.info(
                    "[{}] Applied fill {}: {} {} x{} @ {} | cash {} -> {} | value {}",
                    sessionId,
                    fill.getFillId(),
                    fill.getAction(),
                    symbol,
                    quantity,
                    price,
                    cashBefore,
                    cash,
                    valueAfter);

            return FillResult.builder()
                    .sessionId(sessionId)
                    .fillId(fill.getFillId())
                    .symbol(symbol)
                    .cashAfter(cash)
                    .portfolioValue(valueAfter)
                    .realizedPnl(realized != null ? realized : BigDecimal.ZERO)
                    .transaction(transaction)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks held positions to the given prices. Symbols not held are ignored; cash and
     * realized figures are never touched.
     */
    public void updateMarketPrices(Map<String, BigDecimal> prices) {
        lock.lock();
        try {
            for (Map.Entry<String, BigDecimal> entry : prices.entrySet()) {
                Position position = positions.get(entry.getKey());
                if (position == null || entry.getValue() == null) {
                    continue;
                }
                position.setLastPrice(entry.getValue());
                position.setUnrealizedPnl(unrealizedOf(position));
            }
            totalUnrealizedPnl = sumUnrealized();
            raisePeak(portfolioValue());
        } finally {
            lock.unlock();
        }
    }

    // ==============================
    // READS
    // ==============================

    public PortfolioState getState() {
        lock.lock();
        try {
            Map<String, Position> copies = new LinkedHashMap<>();
            positions.forEach((symbol, position) -> copies.put(symbol, position.copy()));

            BigDecimal value = portfolioValue();
            BigDecimal drawdown = peakValue.signum() == 0
                    ? BigDecimal.ZERO
                    : RiskMath.fraction(peakValue.subtract(value), peakValue);

            return PortfolioState.builder()
                    .sessionId(sessionId)
                    .cash(cash)
                    .initialCapital(initialCapital)
                    .positions(Collections.unmodifiableMap(copies))
                    .totalRealizedPnl(totalRealizedPnl)
                    .totalUnrealizedPnl(totalUnrealizedPnl)
                    .totalCommissions(totalCommissions)
                    .totalTrades(totalTrades)
                    .peakValue(peakValue)
                    .portfolioValue(value)
                    .buyingPower(cash)
                    .exposure(exposure())
                    .drawdown(drawdown)
                    .totalPnl(value.subtract(initialCapital))
                    .numPositions(copies.size())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /** Copy of the position in {@code symbol}, or null when flat. */
    public Position getPosition(String symbol) {
        lock.lock();
        try {
            Position position = positions.get(symbol);
            return position != null ? position.copy() : null;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasApplied(String fillId) {
        lock.lock();
        try {
            return appliedFillIds.contains(fillId);
        } finally {
            lock.unlock();
        }
    }

    // ==============================
    // SNAPSHOT / RESTORE
    // ==============================

    public LedgerSnapshot snapshot() {
        lock.lock();
        try {
            List<Position> copies = new ArrayList<>(positions.size());
            positions.values().forEach(position -> copies.add(position.copy()));
            return LedgerSnapshot.builder()
                    .sessionId(sessionId)
                    .initialCapital(initialCapital)
                    .cash(cash)
                    .peakValue(peakValue)
                    .totalRealizedPnl(totalRealizedPnl)
                    .totalUnrealizedPnl(totalUnrealizedPnl)
                    .totalCommissions(totalCommissions)
                    .totalTrades(totalTrades)
                    .positions(Collections.unmodifiableList(copies))
                    .appliedFillIds(Collections.unmodifiableSet(new LinkedHashSet<>(appliedFillIds)))
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /** Replaces the whole ledger state with the snapshot's. */
    public void restore(LedgerSnapshot snapshot) {
        if (!sessionId.equals(snapshot.getSessionId())) {
            throw new IllegalArgumentException(
                    "Snapshot of session " + snapshot.getSessionId() + " cannot restore ledger " + sessionId);
        }
        lock.lock();
        try {
            initialCapital = snapshot.getInitialCapital();
            cash = snapshot.getCash();
            peakValue = snapshot.getPeakValue();
            totalRealizedPnl = snapshot.getTotalRealizedPnl();
            totalUnrealizedPnl = snapshot.getTotalUnrealizedPnl();
            totalCommissions = snapshot.getTotalCommissions();
            totalTrades = snapshot.getTotalTrades();

            positions.clear();
            snapshot.getPositions().forEach(position -> positions.put(position.getSymbol(), position.copy()));

            appliedFillIds.clear();
            if (snapshot.getAppliedFillIds() != null) {
                snapshot.getAppliedFillIds().forEach(this::rememberFillId);
            }
        } finally {
            lock.unlock();
        }
        log.info("[{}] Ledger restored: cash {}, {} positions, {} trades",
                sessionId, snapshot.getCash(), snapshot.getPositions().size(), snapshot.getTotalTrades());
    }

    // Callers hold the lock.

    private void rememberFillId(String fillId) {
        appliedFillIds.add(fillId);
        if (appliedFillIds.size() > fillIdWindow) {
            Iterator<String> oldest = appliedFillIds.iterator();
            oldest.next();
            oldest.remove();
        }
    }

    private BigDecimal portfolioValue() {
        BigDecimal value = cash;
        for (Position position : positions.values()) {
            value = value.add(position.getMarketValue());
        }
        return value;
    }

    private BigDecimal exposure() {
        BigDecimal exposure = BigDecimal.ZERO;
        for (Position position : positions.values()) {
            exposure = exposure.add(position.getMarketValue().abs());
        }
        return exposure;
    }

    private BigDecimal sumUnrealized() {
        BigDecimal total = BigDecimal.ZERO;
        for (Position position : positions.values()) {
            total = total.add(position.getUnrealizedPnl());
        }
        return total;
    }

    private void raisePeak(BigDecimal value) {
        if (value.compareTo(peakValue) > 0) {
            peakValue = value;
        }
    }

    private static BigDecimal unrealizedOf(Position position) {
        return position.markPrice()
                .subtract(position.getAvgPrice())
                .multiply(BigDecimal.valueOf(position.getQuantity()));
    }
}
