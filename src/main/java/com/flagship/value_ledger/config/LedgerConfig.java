package com.flagship.value_ledger.config;

import com.flagship.value_ledger.loyalty.TierEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableScheduling
public class LedgerConfig {

    /**
     * All ledger timestamps (journal rows, expiry, limit windows) are taken from this clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TierEngine tierEngine() {
        return TierEngine.standardTiers();
    }
}
