package com.tradeledger.allocation.run;

import com.tradeledger.allocation.config.AllocationProperties;
import com.tradeledger.common.LedgerException;
import com.tradeledger.config.AsyncConfig;
import com.tradeledger.domain.AllocationRecomputeRequestedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Consumes AllocationRecomputeRequestedEvent (e.g. from backfill) and runs a scoped allocation on
 * recompute-executor, waiting for the namespace lease instead of failing fast. A run started right after a
 * write is held back until its lagged ledger cutoff covers the written rows.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AllocationRecomputeListener {

    private final AllocationRunService allocationRunService;
    private final AllocationProperties properties;
    private final Clock clock;

    @EventListener
    @Async(AsyncConfig.RECOMPUTE_EXECUTOR)
    public void onRecomputeRequested(AllocationRecomputeRequestedEvent event) {
        if (event.symbols().isEmpty()) {
            log.debug("Recompute request for {} without symbols ignored", event.namespace());
            return;
        }
        if (!awaitCutoffCovers(event)) {
            return;
        }
        AllocationRunRequest request = AllocationRunRequest
                .scoped(event.namespace(), event.symbols(), event.triggeredBy())
                .withLeaseWait(properties.getRecomputeLeaseWaitTimeout());
        try {
            AllocationRunResult result = allocationRunService.run(request);
            log.info("Recompute for {} {} produced version {} ({})", event.namespace(), event.symbols(),
                    result.versionNumber(), result.status());
        } catch (LedgerException e) {
            log.warn("Recompute for {} {} not completed: {} {}", event.namespace(), event.symbols(), e.getErrorCode(), e.getMessage());
        } catch (Exception e) {
            log.error("Recompute for {} {} failed", event.namespace(), event.symbols(), e);
        }
    }

    private boolean awaitCutoffCovers(AllocationRecomputeRequestedEvent event) {
        if (event.ingestedUpTo() == null) {
            return true;
        }
        Duration delay = Duration.between(clock.instant(), event.ingestedUpTo().plus(properties.getCutoffLag()));
        if (delay.isNegative() || delay.isZero()) {
            return true;
        }
        log.debug("Recompute for {} waits {}ms for its rows to fall inside the ledger cutoff", event.namespace(), delay.toMillis());
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Recompute for {} {} interrupted before it started", event.namespace(), event.symbols());
            return false;
        }
    }
}
