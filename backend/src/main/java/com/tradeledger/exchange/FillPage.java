package com.tradeledger.exchange;

import com.tradeledger.domain.RawFill;

import java.util.List;

/**
 * One page of the exchange fill listing. {@code nextCursor} is null on the last page.
 */
public record FillPage(List<RawFill> fills, String nextCursor) {

    public boolean hasNext() {
        return nextCursor != null && !nextCursor.isBlank();
    }
}
