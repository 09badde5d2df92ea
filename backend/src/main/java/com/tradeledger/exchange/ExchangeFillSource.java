package com.tradeledger.exchange;

import com.tradeledger.domain.RawFill;
import com.tradeledger.domain.TimeWindow;

import java.util.List;
import java.util.Optional;

/**
 * Capability required by reconciliation and backfill: read access to the exchange's authoritative fill history.
 * Implementations rate-limit, time out and retry transient failures; when they give up they throw
 * {@link SourceUnavailableException}. They never return an empty result in place of a failure.
 */
public interface ExchangeFillSource {

    /**
     * Fills of one symbol with trade time inside the window, one entry per order (pieces aggregated),
     * ordered by (tradeTime, orderId).
     */
    List<RawFill> listFills(String symbol, TimeWindow window);

    /**
     * The fill of one order, or empty when the exchange definitively does not know the order.
     */
    Optional<RawFill> getFill(String orderId);
}
