package com.tradeledger.exchange.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Exchange fill-history API: endpoint, timeouts, rate limit, pagination and retry. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "tradeledger.exchange")
@NoArgsConstructor
@Getter
@Setter
public class ExchangeProperties {

    private String baseUrl = "https://api.exchange.example.com/api/v3/brokerage";

    /** Per-call timeout in ms. A timeout is a transient failure. */
    private long timeoutMs = 10_000L;

    private int requestsPerSecond = 10;

    /** How long a call may wait for a local rate limiter permit. */
    private long limiterTimeoutMs = 2_000L;

    private int pageSize = 250;

    /** Upper bound on pages per listing; exceeding it fails the listing instead of truncating it. */
    private int maxPages = 200;

    private Retry retry = new Retry();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {

        /** Total attempts including the first call. */
        private int maxAttempts = 4;

        private long initialDelayMs = 500L;

        private long maxDelayMs = 10_000L;

        /** Jitter factor 0..1 (e.g. 0.2 = ±20%). */
        private double jitterFactor = 0.2;
    }
}
