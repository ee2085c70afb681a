package com.riskledger.risk;

import com.riskledger.domain.enums.BuyingPowerSource;
import com.riskledger.domain.model.BuyingPowerQuote;
import com.riskledger.domain.model.PortfolioState;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Supplies the buying-power figure the {@code BUYING_POWER} rule checks against.
 *
 * <p>LOCAL mode reads the ledger snapshot already taken for the evaluation. REMOTE mode
 * queries the ledger service through a circuit breaker; any failure (timeout, error
 * response, open circuit) degrades to a local estimate of portfolio value minus exposure,
 * marked {@link BuyingPowerSource#FALLBACK} so the decision records where its number came from.
 */
@Component
public class BuyingPowerProvider {

    private static final Logger log = LoggerFactory.getLogger(BuyingPowerProvider.class);

    private final BuyingPowerSettings settings;
    private final RemoteBuyingPowerClient remoteClient;
    private final CircuitBreaker circuitBreaker;
    private final AtomicLong fallbackCount = new AtomicLong();

    public BuyingPowerProvider(
            BuyingPowerSettings settings, RemoteBuyingPowerClient remoteClient, CircuitBreaker buyingPowerCircuitBreaker) {
        this.settings = settings;
        this.remoteClient = remoteClient;
        this.circuitBreaker = buyingPowerCircuitBreaker;
    }

    public BuyingPowerQuote quote(PortfolioState portfolio) {
        if (settings.getMode() == BuyingPowerSettings.Mode.LOCAL) {
            return localQuote(portfolio);
        }

        try {
            BigDecimal remote =
                    circuitBreaker.executeSupplier(() -> remoteClient.fetchBuyingPower(portfolio.getSessionId()));
            return authoritative(remote, portfolio);
        } catch (RuntimeException e) {
            long total = fallbackCount.incrementAndGet();
            log.warn(
                    "Buying power query failed for session {}, using local estimate ({} fallbacks so far): {}",
                    portfolio.getSessionId(),
                    total,
                    e.getMessage());
            return fallback(portfolio, e.getMessage());
        }
    }

    /** Authoritative quote straight from the ledger snapshot, without any remote call. */
    public BuyingPowerQuote localQuote(PortfolioState portfolio) {
        return authoritative(portfolio.getBuyingPower(), portfolio);
    }

    public long getFallbackCount() {
        return fallbackCount.get();
    }

    public CircuitBreaker.State getCircuitState() {
        return circuitBreaker.getState();
    }

    private static BuyingPowerQuote authoritative(BigDecimal buyingPower, PortfolioState portfolio) {
        return BuyingPowerQuote.builder()
                .buyingPower(buyingPower)
                .source(BuyingPowerSource.AUTHORITATIVE)
                .portfolioValue(portfolio.getPortfolioValue())
                .exposure(portfolio.getExposure())
                .build();
    }

    private static BuyingPowerQuote fallback(PortfolioState portfolio, String error) {
        return BuyingPowerQuote.builder()
                .buyingPower(portfolio.getPortfolioValue().subtract(portfolio.getExposure()))
                .source(BuyingPowerSource.FALLBACK)
                .portfolioValue(portfolio.getPortfolioValue())
                .exposure(portfolio.getExposure())
                .error(error)
                .build();
    }
}
