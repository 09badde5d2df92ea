package com.tradeledger.exchange;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeledger.common.RetryPolicy;
import com.tradeledger.domain.RawFill;
import com.tradeledger.domain.TimeWindow;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpExchangeFillSourceTest {

    private static final TimeWindow WINDOW = new TimeWindow(
            Instant.parse("2025-03-01T00:00:00Z"), Instant.parse("2025-03-02T00:00:00Z"));

    private ScriptedApiClient client;
    private HttpExchangeFillSource source;

    @BeforeEach
    void setUp() {
        client = new ScriptedApiClient();
        source = newSource(Duration.ofSeconds(2), 10);
    }

    private HttpExchangeFillSource newSource(Duration timeout, int maxPages) {
        return new HttpExchangeFillSource(client, new ExchangeFillParser(new ObjectMapper()), fastLimiter(),
                new RetryPolicy(0L, 0L, 0.0, 3), timeout, 100, maxPages);
    }

    @Test
    void listFills_followsCursorAndAggregatesPartialFills() {
        client.pages.add(() -> Mono.just(page("c2",
                fill("O1", "T1", "BTC-USD", "BUY", "1", "100", "0.1", "2025-03-01T10:00:00Z"))));
        client.pages.add(() -> Mono.just(page(null,
                fill("O1", "T2", "BTC-USD", "BUY", "3", "104", "0.3", "2025-03-01T10:00:05Z"),
                fill("O2", "T3", "BTC-USD", "SELL", "2", "110", "0.2", "2025-03-01T11:00:00Z"))));

        List<RawFill> fills = source.listFills("BTC-USD", WINDOW);

        assertThat(fills).extracting(RawFill::orderId).containsExactly("O1", "O2");
        RawFill o1 = fills.get(0);
        assertThat(o1.quantity()).isEqualByComparingTo("4");
        assertThat(o1.price()).isEqualByComparingTo("103");
        assertThat(o1.fee()).isEqualByComparingTo("0.4");
        assertThat(o1.tradeId()).isEqualTo("T2");
        assertThat(client.cursors).containsExactly(null, "c2");
    }

    @Test
    void listFills_dropsFillsOutsideWindowOrSymbol() {
        client.pages.add(() -> Mono.just(page(null,
                fill("O1", "T1", "BTC-USD", "BUY", "1", "100", "0", "2025-03-01T10:00:00Z"),
                fill("O2", "T2", "ETH-USD", "BUY", "1", "100", "0", "2025-03-01T10:00:00Z"),
                fill("O3", "T3", "BTC-USD", "BUY", "1", "100", "0", "2025-03-05T10:00:00Z"))));

        assertThat(source.listFills("BTC-USD", WINDOW)).extracting(RawFill::orderId).containsExactly("O1");
    }

    @Test
    void listFills_orderStraddlingWindowStart_keepsEveryPiece() {
        client.pages.add(() -> Mono.just(page(null,
                fill("O1", "T1", "BTC-USD", "BUY", "1", "100", "0.1", "2025-02-28T23:59:58Z"),
                fill("O1", "T2", "BTC-USD", "BUY", "1", "102", "0.1", "2025-03-01T00:00:02Z"))));

        List<RawFill> fills = source.listFills("BTC-USD", WINDOW);

        assertThat(fills).singleElement().satisfies(o1 -> {
            assertThat(o1.quantity()).isEqualByComparingTo("2");
            assertThat(o1.price()).isEqualByComparingTo("101");
            assertThat(o1.fee()).isEqualByComparingTo("0.2");
            assertThat(o1.tradeTime()).isEqualTo(Instant.parse("2025-03-01T00:00:02Z"));
        });
    }

    @Test
    void listFills_orderCompletingAfterWindowEnd_isDroppedWhole() {
        client.pages.add(() -> Mono.just(page(null,
                fill("O1", "T1", "BTC-USD", "SELL", "1", "100", "0", "2025-03-01T23:59:59Z"),
                fill("O1", "T2", "BTC-USD", "SELL", "1", "100", "0", "2025-03-02T00:00:01Z"),
                fill("O2", "T3", "BTC-USD", "BUY", "1", "100", "0", "2025-03-01T12:00:00Z"))));

        assertThat(source.listFills("BTC-USD", WINDOW)).extracting(RawFill::orderId).containsExactly("O2");
    }

    @Test
    void listFills_fillWithoutOrderId_sourceUnavailable() {
        client.pages.add(() -> Mono.just("{\"fills\":[{\"trade_id\":\"T1\",\"product_id\":\"BTC-USD\",\"size\":\"1\","
                + "\"price\":\"100\",\"trade_time\":\"2025-03-01T10:00:00Z\"}]}"));

        assertThatThrownBy(() -> source.listFills("BTC-USD", WINDOW))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("order_id");
        assertThat(client.calls).isEqualTo(1);
    }

    @Test
    void listFills_transientFailureIsRetried() {
        client.pages.add(() -> Mono.error(ExchangeCallException.fromStatus(503, null)));
        client.pages.add(() -> Mono.just(page(null,
                fill("O1", "T1", "BTC-USD", "BUY", "1", "100", "0", "2025-03-01T10:00:00Z"))));

        assertThat(source.listFills("BTC-USD", WINDOW)).hasSize(1);
        assertThat(client.calls).isEqualTo(2);
    }

    @Test
    void listFills_exhaustedRetries_sourceUnavailable() {
        for (int i = 0; i < 3; i++) {
            client.pages.add(() -> Mono.error(ExchangeCallException.fromStatus(429, null)));
        }

        assertThatThrownBy(() -> source.listFills("BTC-USD", WINDOW))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("after 3 attempts");
        assertThat(client.calls).isEqualTo(3);
    }

    @Test
    void listFills_permanentFailureIsNotRetried() {
        client.pages.add(() -> Mono.error(ExchangeCallException.fromStatus(401, null)));

        assertThatThrownBy(() -> source.listFills("BTC-USD", WINDOW)).isInstanceOf(SourceUnavailableException.class);
        assertThat(client.calls).isEqualTo(1);
    }

    @Test
    void listFills_malformedBodyIsSourceUnavailable() {
        client.pages.add(() -> Mono.just("{\"unexpected\":true}"));

        assertThatThrownBy(() -> source.listFills("BTC-USD", WINDOW)).isInstanceOf(SourceUnavailableException.class);
    }

    @Test
    void listFills_timeoutIsTransient() {
        source = newSource(Duration.ofMillis(50), 10);
        for (int i = 0; i < 3; i++) {
            client.pages.add(Mono::never);
        }

        assertThatThrownBy(() -> source.listFills("BTC-USD", WINDOW))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("timed out");
        assertThat(client.calls).isEqualTo(3);
    }

    @Test
    void listFills_tooManyPages_sourceUnavailable() {
        source = newSource(Duration.ofSeconds(2), 2);
        for (int i = 0; i < 3; i++) {
            client.pages.add(() -> Mono.just(page("more")));
        }

        assertThatThrownBy(() -> source.listFills("BTC-USD", WINDOW))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("exceeded 2 pages");
    }

    @Test
    void getFill_notFoundIsEmptyAndNotRetried() {
        client.orders.add(Mono::empty);

        assertThat(source.getFill("X404")).isEmpty();
        assertThat(client.calls).isEqualTo(1);
    }

    @Test
    void getFill_mergesOrderPieces() {
        client.orders.add(() -> Mono.just("{\"fills\":["
                + fill("X123", "T1", "BTC-USD", "SELL", "0.5", "100", "0.01", "2025-03-01T10:00:00Z") + ","
                + fill("X123", "T2", "BTC-USD", "SELL", "0.5", "102", "0.01", "2025-03-01T10:00:01Z") + "]}"));

        Optional<RawFill> fill = source.getFill("X123");

        assertThat(fill).isPresent();
        assertThat(fill.get().quantity()).isEqualByComparingTo("1");
        assertThat(fill.get().price()).isEqualByComparingTo("101");
        assertThat(fill.get().tradeTime()).isEqualTo(Instant.parse("2025-03-01T10:00:01Z"));
    }

    private static String page(String cursor, String... fills) {
        return "{\"fills\":[" + String.join(",", fills) + "]"
                + (cursor != null ? ",\"cursor\":\"" + cursor + "\"" : "") + "}";
    }

    private static String fill(String orderId, String tradeId, String symbol, String side, String size, String price,
                               String commission, String time) {
        return "{\"order_id\":\"" + orderId + "\",\"trade_id\":\"" + tradeId + "\",\"product_id\":\"" + symbol
                + "\",\"side\":\"" + side + "\",\"size\":\"" + size + "\",\"price\":\"" + price
                + "\",\"commission\":\"" + commission + "\",\"trade_time\":\"" + time + "\"}";
    }

    private static RateLimiter fastLimiter() {
        return RateLimiter.of("test", RateLimiterConfig.custom()
                .limitForPeriod(1000)
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ZERO)
                .build());
    }

    /** Replays scripted responses in call order. */
    private static final class ScriptedApiClient implements ExchangeApiClient {
        private final Deque<Supplier<Mono<String>>> pages = new ArrayDeque<>();
        private final Deque<Supplier<Mono<String>>> orders = new ArrayDeque<>();
        private final List<String> cursors = new ArrayList<>();
        private int calls;

        @Override
        public Mono<String> fillsPage(String symbol, Instant from, Instant to, String cursor, int limit) {
            calls++;
            cursors.add(cursor);
            return pages.isEmpty() ? Mono.error(new AssertionError("unexpected page call")) : pages.poll().get();
        }

        @Override
        public Mono<String> orderFills(String orderId) {
            calls++;
            return orders.isEmpty() ? Mono.error(new AssertionError("unexpected order call")) : orders.poll().get();
        }
    }
}
