package com.riskledger.config;

import com.riskledger.bus.BusTopics;
import com.riskledger.bus.FillMessageListener;
import com.riskledger.bus.MarketPriceMessageListener;
import com.riskledger.bus.SignalMessageListener;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Redis pub/sub wiring for the message bus.
 *
 * <p>Inbound channels (subscribed by pattern):
 * <ul>
 *   <li>{@code strategy.signals.*}: trade signals to admit</li>
 *   <li>{@code execution.fills.*}: executed fills to book</li>
 *   <li>{@code market.prices.*}: price batches to mark positions</li>
 * </ul>
 *
 * <p>Outbound channels:
 * <ul>
 *   <li>{@code risk.approved.<symbol>} / {@code risk.rejected.<symbol>}: admission outcomes</li>
 *   <li>{@code risk.mode-change}: trading mode transitions</li>
 *   <li>{@code risk.stats}: daily aggregates after each decision</li>
 * </ul>
 *
 * <p>The listener container dispatches on a single thread, so messages are handed over in
 * the order Redis delivered them.
 */
@Configuration
public class RedisConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisConfig.class);

    public static final String SIGNALS_PATTERN = "strategy.signals.*";
    public static final String FILLS_PATTERN = "execution.fills.*";
    public static final String PRICES_PATTERN = "market.prices.*";
    public static final String APPROVED_PREFIX = "risk.approved.";
    public static final String REJECTED_PREFIX = "risk.rejected.";
    public static final String MODE_CHANGE_CHANNEL = "risk.mode-change";
    public static final String STATS_CHANNEL = "risk.stats";

    @Bean
    public BusTopics busTopics(
            @Value("${risk-ledger.bus.signals:" + SIGNALS_PATTERN + "}") String signals,
            @Value("${risk-ledger.bus.fills:" + FILLS_PATTERN + "}") String fills,
            @Value("${risk-ledger.bus.prices:" + PRICES_PATTERN + "}") String prices,
            @Value("${risk-ledger.bus.approved-prefix:" + APPROVED_PREFIX + "}") String approvedPrefix,
            @Value("${risk-ledger.bus.rejected-prefix:" + REJECTED_PREFIX + "}") String rejectedPrefix,
            @Value("${risk-ledger.bus.mode-change:" + MODE_CHANGE_CHANNEL + "}") String modeChange,
            @Value("${risk-ledger.bus.stats:" + STATS_CHANNEL + "}") String stats) {
        return BusTopics.builder()
                .signalsPattern(signals)
                .fillsPattern(fills)
                .pricesPattern(prices)
                .approvedPrefix(approvedPrefix)
                .rejectedPrefix(rejectedPrefix)
                .modeChange(modeChange)
                .stats(stats)
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "risk-ledger.bus.enabled", havingValue = "true", matchIfMissing = true)
    public RedisMessageListenerContainer redisMessageListenerContainer(
            RedisConnectionFactory connectionFactory,
            BusTopics busTopics,
            @Qualifier("busDispatchExecutor") Executor busDispatchExecutor,
            SignalMessageListener signalMessageListener,
            FillMessageListener fillMessageListener,
            MarketPriceMessageListener marketPriceMessageListener) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.setTaskExecutor(busDispatchExecutor);
        container.addMessageListener(signalMessageListener, new PatternTopic(busTopics.getSignalsPattern()));
        container.addMessageListener(fillMessageListener, new PatternTopic(busTopics.getFillsPattern()));
        container.addMessageListener(marketPriceMessageListener, new PatternTopic(busTopics.getPricesPattern()));
        log.info("Bus subscriptions: signals={}, fills={}, prices={}",
                busTopics.getSignalsPattern(), busTopics.getFillsPattern(), busTopics.getPricesPattern());
        return container;
    }
}
