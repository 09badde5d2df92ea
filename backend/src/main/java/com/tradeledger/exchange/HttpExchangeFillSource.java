package com.tradeledger.exchange;

import com.tradeledger.common.RetryPolicy;
import com.tradeledger.domain.RawFill;
import com.tradeledger.domain.TimeWindow;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Exchange fill source over REST. Every call takes a rate limiter permit, carries a timeout and is retried with
 * exponential backoff while failures are transient. A 404 or an empty fill list for an order is a definitive
 * not-found and is not retried.
 */
@Slf4j
public class HttpExchangeFillSource implements ExchangeFillSource {

    private final ExchangeApiClient client;
    private final ExchangeFillParser parser;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final Duration timeout;
    private final int pageSize;
    private final int maxPages;

    public HttpExchangeFillSource(
            ExchangeApiClient client,
            ExchangeFillParser parser,
            RateLimiter rateLimiter,
            RetryPolicy retryPolicy,
            Duration timeout,
            int pageSize,
            int maxPages
    ) {
        this.client = client;
        this.parser = parser;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.timeout = timeout;
        this.pageSize = pageSize;
        this.maxPages = maxPages;
    }

    @Override
    public List<RawFill> listFills(String symbol, TimeWindow window) {
        List<RawFill> pieces = new ArrayList<>();
        String cursor = null;
        int pages = 0;
        do {
            if (pages >= maxPages) {
                throw new SourceUnavailableException("Fill listing for " + symbol + " exceeded " + maxPages
                        + " pages; narrow the window");
            }
            String pageCursor = cursor;
            FillPage page = withRetry("listFills " + symbol, () -> {
                String body = await(client.fillsPage(symbol, window.from(), window.to(), pageCursor, pageSize), "listFills " + symbol);
                if (body == null) {
                    throw ExchangeCallException.permanentFailure("Empty response listing fills for " + symbol, null);
                }
                return parser.parsePage(body);
            });
            pieces.addAll(page.fills());
            cursor = page.nextCursor();
            pages++;
        } while (cursor != null && !cursor.isBlank());

        // An order is in the window by its aggregated (last piece) time, so straddling orders keep every piece.
        List<RawFill> orders = FillAggregator.aggregateByOrder(pieces.stream()
                .filter(f -> symbol.equalsIgnoreCase(f.symbol()))
                .toList());
        List<RawFill> fills = orders.stream()
                .filter(f -> window.contains(f.tradeTime()))
                .toList();
        if (fills.size() != orders.size()) {
            log.debug("Dropped {} orders outside {} / {}", orders.size() - fills.size(), symbol, window);
        }
        log.debug("Exchange listed {} orders ({} fills, {} pages) for {} in {}", fills.size(), pieces.size(), pages, symbol, window);
        return fills;
    }

    @Override
    @Cacheable(cacheNames = "exchange-order-fills", key = "#orderId", unless = "#result == null")
    public Optional<RawFill> getFill(String orderId) {
        List<RawFill> pieces = withRetry("getFill " + orderId, () -> {
            String body = await(client.orderFills(orderId), "getFill " + orderId);
            return body == null ? List.<RawFill>of() : parser.parseFills(body);
        });
        List<RawFill> ofOrder = pieces.stream().filter(f -> orderId.equals(f.orderId())).toList();
        if (ofOrder.isEmpty()) {
            log.info("Exchange does not know order {}", orderId);
            return Optional.empty();
        }
        return Optional.of(FillAggregator.merge(ofOrder));
    }

    private <T> T withRetry(String operation, Supplier<T> call) {
        int maxAttempts = retryPolicy.getMaxAttempts();
        ExchangeCallException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                acquirePermit(operation);
                return call.get();
            } catch (ExchangeCallException e) {
                if (!e.isTransientFailure()) {
                    throw new SourceUnavailableException(operation + " failed: " + e.getMessage(), e);
                }
                lastFailure = e;
                if (attempt < maxAttempts) {
                    long delay = retryPolicy.delayMs(attempt - 1);
                    log.warn("{} attempt {}/{} failed ({}), retrying in {}ms", operation, attempt, maxAttempts, e.getMessage(), delay);
                    sleep(delay, operation);
                }
            }
        }
        throw new SourceUnavailableException(operation + " failed after " + maxAttempts + " attempts: "
                + lastFailure.getMessage(), lastFailure);
    }

    private void acquirePermit(String operation) {
        if (!rateLimiter.acquirePermission()) {
            throw ExchangeCallException.transientFailure("Local rate limiter timeout for " + operation, null);
        }
    }

    private String await(Mono<String> call, String operation) {
        return call
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> ExchangeCallException.transientFailure(
                        operation + " timed out after " + timeout.toMillis() + "ms", e))
                .block();
    }

    private static void sleep(long delayMs, String operation) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(operation + " interrupted while backing off", e);
        }
    }
}
