package com.tradeledger.backfill;

import com.tradeledger.common.LedgerErrorCode;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of one backfill pass. {@code errorCode} is PARTIAL_BACKFILL_FAILURE whenever {@code failed} is not empty.
 */
public record BackfillResult(
        String namespace,
        BackfillStatus status,
        List<String> inserted,
        List<String> alreadyPresent,
        List<BackfillFailure> failed,
        Set<String> affectedSymbols,
        boolean recomputeRequested
) {

    public BackfillResult {
        inserted = List.copyOf(inserted);
        alreadyPresent = List.copyOf(alreadyPresent);
        failed = List.copyOf(failed);
        affectedSymbols = Collections.unmodifiableSortedSet(new TreeSet<>(affectedSymbols));
    }

    public LedgerErrorCode errorCode() {
        return failed.isEmpty() ? null : LedgerErrorCode.PARTIAL_BACKFILL_FAILURE;
    }

    public static BackfillResult nothingToDo(String namespace) {
        return new BackfillResult(namespace, BackfillStatus.NOTHING_TO_DO, List.of(), List.of(), List.of(), Set.of(), false);
    }
}
