package com.tradeledger.api.controller;

import com.tradeledger.allocation.config.AllocationConfig;
import com.tradeledger.domain.ReconciliationTier;
import com.tradeledger.exchange.SourceUnavailableException;
import com.tradeledger.reconciliation.ReconciliationRequest;
import com.tradeledger.reconciliation.ReconciliationRunResult;
import com.tradeledger.reconciliation.ReconciliationRunService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = ReconciliationController.class)
@Import(AllocationConfig.class)
class ReconciliationControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    ReconciliationRunService reconciliationRunService;

    @Test
    @DisplayName("run request maps tiers, symbols and window")
    void run_mapsRequest() {
        when(reconciliationRunService.run(any())).thenReturn(new ReconciliationRunResult("run-1", List.of(), null));

        webTestClient.post()
                .uri("/api/v1/reconciliations")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"namespace":"desk-a","tiers":["2","presence"],"symbols":["BTC-USD"],
                         "from":"2025-03-01T00:00:00Z","to":"2025-03-02T00:00:00Z","autoBackfill":true}
                        """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.runId").isEqualTo("run-1");

        ArgumentCaptor<ReconciliationRequest> request = ArgumentCaptor.forClass(ReconciliationRequest.class);
        verify(reconciliationRunService).run(request.capture());
        assertThat(request.getValue().namespace()).isEqualTo("desk-a");
        assertThat(request.getValue().tiers()).containsExactly(ReconciliationTier.PRESENCE, ReconciliationTier.VALUE);
        assertThat(request.getValue().symbols()).containsExactly("BTC-USD");
        assertThat(request.getValue().window().from()).isEqualTo(Instant.parse("2025-03-01T00:00:00Z"));
        assertThat(request.getValue().autoBackfill()).isTrue();
    }

    @Test
    @DisplayName("unknown tier is rejected with INVALID_TIER")
    void run_unknownTier() {
        webTestClient.post()
                .uri("/api/v1/reconciliations")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"tiers\":[\"3\"],\"from\":\"2025-03-01T00:00:00Z\",\"to\":\"2025-03-02T00:00:00Z\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_TIER")
                .jsonPath("$.message").isEqualTo("Tiers must be 1, 2, presence, value or all");
        verifyNoInteractions(reconciliationRunService);
    }

    @Test
    @DisplayName("missing window bound is rejected with INVALID_WINDOW")
    void run_missingWindowBound() {
        webTestClient.post()
                .uri("/api/v1/reconciliations")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"from\":\"2025-03-01T00:00:00Z\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_WINDOW")
                .jsonPath("$.message").isEqualTo("Both from and to are required");
        verifyNoInteractions(reconciliationRunService);
    }

    @Test
    @DisplayName("inverted window is rejected")
    void run_invertedWindow() {
        webTestClient.post()
                .uri("/api/v1/reconciliations")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"from\":\"2025-03-02T00:00:00Z\",\"to\":\"2025-03-01T00:00:00Z\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_WINDOW");
    }

    @Test
    @DisplayName("unavailable exchange is answered with 503 SOURCE_UNAVAILABLE")
    void run_sourceUnavailable() {
        when(reconciliationRunService.run(any())).thenThrow(new SourceUnavailableException("listFills BTC-USD failed"));

        webTestClient.post()
                .uri("/api/v1/reconciliations")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"from\":\"2025-03-01T00:00:00Z\",\"to\":\"2025-03-02T00:00:00Z\"}")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("SOURCE_UNAVAILABLE");
    }
}
