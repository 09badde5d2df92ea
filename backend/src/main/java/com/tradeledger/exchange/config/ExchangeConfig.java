package com.tradeledger.exchange.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeledger.common.RetryPolicy;
import com.tradeledger.exchange.ExchangeApiClient;
import com.tradeledger.exchange.ExchangeFillParser;
import com.tradeledger.exchange.ExchangeFillSource;
import com.tradeledger.exchange.HttpExchangeFillSource;
import com.tradeledger.exchange.WebClientExchangeApiClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the exchange fill source: WebClient client, resilience4j rate limiter and retry policy from properties.
 */
@Configuration
@EnableConfigurationProperties(ExchangeProperties.class)
public class ExchangeConfig {

    @Bean
    public ExchangeApiClient exchangeApiClient(WebClient.Builder webClientBuilder, ExchangeProperties properties) {
        return new WebClientExchangeApiClient(webClientBuilder, properties.getBaseUrl());
    }

    @Bean(name = "exchangeRateLimiter")
    public RateLimiter exchangeRateLimiter(ExchangeProperties properties) {
        int rps = Math.max(1, properties.getRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("exchange", config);
    }

    @Bean
    public ExchangeFillSource exchangeFillSource(
            ExchangeApiClient exchangeApiClient,
            RateLimiter exchangeRateLimiter,
            ObjectMapper objectMapper,
            ExchangeProperties properties
    ) {
        ExchangeProperties.Retry retry = properties.getRetry();
        RetryPolicy retryPolicy = new RetryPolicy(
                retry.getInitialDelayMs(),
                retry.getMaxDelayMs(),
                retry.getJitterFactor(),
                retry.getMaxAttempts());
        return new HttpExchangeFillSource(
                exchangeApiClient,
                new ExchangeFillParser(objectMapper),
                exchangeRateLimiter,
                retryPolicy,
                Duration.ofMillis(properties.getTimeoutMs()),
                Math.max(1, properties.getPageSize()),
                Math.max(1, properties.getMaxPages()));
    }
}
