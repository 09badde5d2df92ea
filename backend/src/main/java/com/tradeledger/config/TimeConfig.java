package com.tradeledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {

    /** UTC clock for ledger cutoffs, version timestamps and lease expiry. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
