package com.riskledger.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single time source for trading-day boundaries, rate windows and TTL eviction.
 * Tests substitute a fixed or mutable clock.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${risk-ledger.trading-zone:America/New_York}") String tradingZone) {
        return Clock.system(ZoneId.of(tradingZone));
    }
}
