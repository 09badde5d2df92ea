package com.tradeledger.exchange;

import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Raw HTTP access to the exchange fill endpoints. Retries, timeouts and rate limiting are handled by the
 * fill source using this client.
 */
public interface ExchangeApiClient {

    /**
     * One page of fills for a product.
     *
     * @param cursor continuation cursor from the previous page, null for the first page
     * @return response body (JSON); errors as {@link ExchangeCallException}
     */
    Mono<String> fillsPage(String symbol, Instant from, Instant to, String cursor, int limit);

    /**
     * Fills of one order.
     *
     * @return response body (JSON), or empty when the exchange answers 404
     */
    Mono<String> orderFills(String orderId);
}
