package com.riskledger.config;

import com.riskledger.risk.BuyingPowerSettings;
import com.riskledger.risk.RemoteBuyingPowerClient;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import java.net.http.HttpClient;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires buying-power sourcing: the mode switch, the HTTP client for the remote ledger
 * query and the circuit breaker around it.
 *
 * <p>Properties prefix: {@code risk-ledger.risk.buying-power.*}
 */
@Configuration
public class BuyingPowerConfig {

    private static final Logger log = LoggerFactory.getLogger(BuyingPowerConfig.class);

    @Bean
    public BuyingPowerSettings buyingPowerSettings(
            @Value("${risk-ledger.risk.buying-power.mode:LOCAL}") BuyingPowerSettings.Mode mode,
            @Value("${risk-ledger.risk.buying-power.remote-url:http://localhost:8088}") String remoteUrl,
            @Value("${risk-ledger.risk.buying-power.timeout-ms:2000}") long timeoutMs,
            @Value("${risk-ledger.risk.buying-power.allow-fallback-approval:true}") boolean allowFallbackApproval) {
        log.info(
                "Buying power source: {} (remote {}, timeout {}ms, fallback approvals {})",
                mode,
                remoteUrl,
                timeoutMs,
                allowFallbackApproval ? "allowed" : "disabled");
        return BuyingPowerSettings.builder()
                .mode(mode)
                .remoteUrl(remoteUrl)
                .timeout(Duration.ofMillis(timeoutMs))
                .allowFallbackApproval(allowFallbackApproval)
                .build();
    }

    @Bean
    public RemoteBuyingPowerClient remoteBuyingPowerClient(BuyingPowerSettings settings) {
        HttpClient httpClient =
                HttpClient.newBuilder().connectTimeout(settings.getTimeout()).build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(settings.getTimeout());

        RestClient restClient = RestClient.builder()
                .baseUrl(settings.getRemoteUrl())
                .requestFactory(requestFactory)
                .build();
        return new RemoteBuyingPowerClient(restClient);
    }

    @Bean
    public CircuitBreaker buyingPowerCircuitBreaker() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .permittedNumberOfCallsInHalfOpenState(2)
                .build();
        CircuitBreaker circuitBreaker = CircuitBreaker.of("buyingPower", config);
        circuitBreaker
                .getEventPublisher()
                .onStateTransition(event -> log.warn("Buying power circuit breaker: {}", event.getStateTransition()));
        return circuitBreaker;
    }
}
