package com.tradeledger.allocation.run;

import com.tradeledger.allocation.config.AllocationProperties;
import com.tradeledger.allocation.version.ComputationInProgressException;
import com.tradeledger.domain.AllocationRecomputeRequestedEvent;
import com.tradeledger.domain.VersionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AllocationRecomputeListenerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    AllocationRunService allocationRunService;

    private AllocationProperties properties;
    private AllocationRecomputeListener listener;

    @BeforeEach
    void setUp() {
        properties = new AllocationProperties();
        properties.setRecomputeLeaseWaitTimeout(Duration.ofSeconds(30));
        listener = new AllocationRecomputeListener(allocationRunService, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void recompute_runsScopedAndWaitsForLease() {
        when(allocationRunService.run(any())).thenReturn(new AllocationRunResult("default", 4L, VersionStatus.VALID, true,
                3L, List.of("BTC-USD"), List.of(), 1, 1, 1, 0, 0, BigDecimal.TEN, 5L, List.of(), List.of(), null));

        assertThatCode(() -> listener.onRecomputeRequested(
                new AllocationRecomputeRequestedEvent("default", Set.of("BTC-USD"), "backfill", null)))
                .doesNotThrowAnyException();

        ArgumentCaptor<AllocationRunRequest> request = ArgumentCaptor.forClass(AllocationRunRequest.class);
        verify(allocationRunService).run(request.capture());
        assertThat(request.getValue().allSymbols()).isFalse();
        assertThat(request.getValue().symbols()).containsExactly("BTC-USD");
        assertThat(request.getValue().triggeredBy()).isEqualTo("backfill");
        assertThat(request.getValue().leaseWait()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void recompute_rowsWrittenWithinCutoffLag_holdsRunBack() {
        properties.setCutoffLag(Duration.ofMillis(300));
        when(allocationRunService.run(any())).thenThrow(new ComputationInProgressException("default"));

        long started = System.nanoTime();
        listener.onRecomputeRequested(new AllocationRecomputeRequestedEvent("default", Set.of("BTC-USD"), "backfill", NOW));

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isGreaterThanOrEqualTo(Duration.ofMillis(250));
        verify(allocationRunService).run(any());
    }

    @Test
    void recompute_rowsOlderThanCutoffLag_runsImmediately() {
        when(allocationRunService.run(any())).thenThrow(new ComputationInProgressException("default"));

        long started = System.nanoTime();
        listener.onRecomputeRequested(new AllocationRecomputeRequestedEvent(
                "default", Set.of("BTC-USD"), "backfill", NOW.minusSeconds(60)));

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(2));
        verify(allocationRunService).run(any());
    }

    @Test
    void recompute_busyNamespaceIsLoggedNotThrown() {
        when(allocationRunService.run(any())).thenThrow(new ComputationInProgressException("default"));

        assertThatCode(() -> listener.onRecomputeRequested(
                new AllocationRecomputeRequestedEvent("default", Set.of("BTC-USD"), "backfill", null)))
                .doesNotThrowAnyException();
    }

    @Test
    void recompute_withoutSymbolsIsIgnored() {
        listener.onRecomputeRequested(new AllocationRecomputeRequestedEvent("default", Set.of(), "backfill", null));

        verifyNoInteractions(allocationRunService);
    }
}
