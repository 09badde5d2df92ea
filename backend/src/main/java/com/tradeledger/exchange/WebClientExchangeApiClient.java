package com.tradeledger.exchange;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Exchange REST client using WebClient. Used by HttpExchangeFillSource.
 */
public class WebClientExchangeApiClient implements ExchangeApiClient {

    private final WebClient webClient;

    public WebClientExchangeApiClient(WebClient.Builder builder, String baseUrl) {
        this.webClient = builder.baseUrl(baseUrl).build();
    }

    @Override
    public Mono<String> fillsPage(String symbol, Instant from, Instant to, String cursor, int limit) {
        return webClient.get()
                .uri(uri -> {
                    uri.path("/fills")
                            .queryParam("product_id", symbol)
                            .queryParam("start_date", from.toString())
                            .queryParam("end_date", to.toString())
                            .queryParam("limit", limit);
                    if (cursor != null && !cursor.isBlank()) {
                        uri.queryParam("cursor", cursor);
                    }
                    return uri.build();
                })
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class, e -> ExchangeCallException.fromStatus(e.getStatusCode().value(), e))
                .onErrorMap(WebClientRequestException.class, e -> ExchangeCallException.transientFailure(e.getMessage(), e));
    }

    @Override
    public Mono<String> orderFills(String orderId) {
        return webClient.get()
                .uri("/orders/{orderId}/fills", orderId)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                .onErrorMap(WebClientResponseException.class, e -> ExchangeCallException.fromStatus(e.getStatusCode().value(), e))
                .onErrorMap(WebClientRequestException.class, e -> ExchangeCallException.transientFailure(e.getMessage(), e));
    }
}
