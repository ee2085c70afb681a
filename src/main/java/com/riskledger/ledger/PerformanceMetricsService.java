package com.riskledger.ledger;

import com.riskledger.domain.enums.TradeAction;
import com.riskledger.domain.model.LedgerTransaction;
import com.riskledger.domain.model.PerformanceMetrics;
import com.riskledger.domain.model.PortfolioSnapshotRecord;
import com.riskledger.domain.model.PortfolioState;
import com.riskledger.risk.RiskMath;
import com.riskledger.session.TradingSession;
import com.riskledger.session.TradingSessionRegistry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Performance summary of a session.
 *
 * <ul>
 *   <li>Total return: current value against initial capital, in dollars and percent</li>
 *   <li>Sharpe: mean over standard deviation of snapshot-to-snapshot returns, annualized by sqrt(252)</li>
 *   <li>Max drawdown: largest drawdown fraction over the snapshots and the live state</li>
 *   <li>Win rate (percent), profit factor: from closing SELL transactions</li>
 * </ul>
 */
@Service
public class PerformanceMetricsService {

    private static final int SNAPSHOT_HISTORY = 10_000;
    private static final double TRADING_DAYS = 252.0;

    private final TradingSessionRegistry sessionRegistry;
    private final LedgerPersistenceService ledgerPersistenceService;

    public PerformanceMetricsService(
            TradingSessionRegistry sessionRegistry, LedgerPersistenceService ledgerPersistenceService) {
        this.sessionRegistry = sessionRegistry;
        this.ledgerPersistenceService = ledgerPersistenceService;
    }

    public PerformanceMetrics calculate(String sessionId) {
        TradingSession session = sessionRegistry.require(sessionId);
        PortfolioState state = session.getLedger().getState();

        List<PortfolioSnapshotRecord> snapshots =
                new ArrayList<>(ledgerPersistenceService.getSnapshots(session.getSessionId(), SNAPSHOT_HISTORY));
        Collections.reverse(snapshots);
        List<LedgerTransaction> transactions = ledgerPersistenceService.getAllTransactions(session.getSessionId());

        BigDecimal totalReturn = state.getPortfolioValue().subtract(state.getInitialCapital());

        int closingTrades = 0;
        int wins = 0;
        int losses = 0;
        double grossProfit = 0;
        double grossLoss = 0;
        for (LedgerTransaction tx : transactions) {
            if (tx.getAction() != TradeAction.SELL || tx.getRealizedPnl() == null) {
                continue;
            }
            closingTrades++;
            double pnl = tx.getRealizedPnl().doubleValue();
            if (pnl > 0) {
                wins++;
                grossProfit += pnl;
            } else if (pnl < 0) {
                losses++;
                grossLoss += -pnl;
            }
        }

        return PerformanceMetrics.builder()
                .sessionId(session.getSessionId())
                .initialCapital(state.getInitialCapital())
                .currentValue(state.getPortfolioValue())
                .totalReturn(totalReturn.setScale(2, RoundingMode.HALF_UP))
                .totalReturnPct(RiskMath.ratio(totalReturn, state.getInitialCapital()) * 100.0)
                .sharpeRatio(sharpe(snapshots))
                .maxDrawdown(maxDrawdown(snapshots, state))
                .winRate(closingTrades > 0 ? wins * 100.0 / closingTrades : 0.0)
                .profitFactor(grossLoss > 0 ? grossProfit / grossLoss : 0.0)
                .totalTrades(closingTrades)
                .winningTrades(wins)
                .losingTrades(losses)
                .totalCommissions(state.getTotalCommissions())
                .build();
    }

    /** Snapshots in chronological order. Zero with fewer than two usable points or no variance. */
    static double sharpe(List<PortfolioSnapshotRecord> snapshots) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < snapshots.size(); i++) {
            double previous = snapshots.get(i - 1).getPortfolioValue().doubleValue();
            double current = snapshots.get(i).getPortfolioValue().doubleValue();
            if (previous > 0) {
                returns.add((current - previous) / previous);
            }
        }
        if (returns.size() < 2) {
            return 0.0;
        }
        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = returns.stream()
                .mapToDouble(r -> (r - mean) * (r - mean))
                .average()
                .orElse(0.0);
        double stdDev = Math.sqrt(variance);
        return stdDev > 0 ? mean / stdDev * Math.sqrt(TRADING_DAYS) : 0.0;
    }

    static double maxDrawdown(List<PortfolioSnapshotRecord> snapshots, PortfolioState state) {
        double max = state.getDrawdown() != null ? state.getDrawdown().doubleValue() : 0.0;
        for (PortfolioSnapshotRecord snapshot : snapshots) {
            if (snapshot.getDrawdown() != null) {
                max = Math.max(max, snapshot.getDrawdown().doubleValue());
            }
        }
        return max;
    }
}
