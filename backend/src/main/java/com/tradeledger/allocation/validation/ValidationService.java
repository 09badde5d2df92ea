package com.tradeledger.allocation.validation;

import com.tradeledger.allocation.version.AllocationVersionStore;
import com.tradeledger.allocation.version.VersionManager;
import com.tradeledger.domain.AllocationVersion;
import com.tradeledger.domain.TradeRecord;
import com.tradeledger.ledger.TradeLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Loads a version's rows and its ledger scope (recomputed symbols at the version's cutoff) and runs the
 * validator. Read-only: status transitions are applied by the allocation run that owns the version.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ValidationService {

    private final AllocationVersionStore store;
    private final VersionManager versionManager;
    private final TradeLedger tradeLedger;
    private final AllocationValidator validator;

    public ValidationResult validate(AllocationVersion version) {
        List<String> symbols = version.getComputedSymbols();
        String namespace = version.getNamespace();
        long number = version.getVersionNumber();
        if (symbols.isEmpty()) {
            return new ValidationResult(namespace, number, List.of(), List.of());
        }
        List<TradeRecord> scope = tradeLedger.scan(symbols, version.getLedgerCutoff());
        ValidationResult result = validator.validate(namespace, number, scope,
                store.findAllocations(namespace, number, symbols),
                store.findResidues(namespace, number, symbols),
                store.findOpenLots(namespace, number, symbols));
        log.info("Validated version {} of {}: {} errors, {} warnings", number, namespace,
                result.errors().size(), result.warnings().size());
        return result;
    }

    /**
     * Standalone validation run of an existing version.
     *
     * @param strict treat warnings (e.g. unmatched sell residue) as errors
     */
    public ValidationResult validateVersion(String namespace, long versionNumber, boolean strict) {
        ValidationResult result = validate(versionManager.getByVersion(namespace, versionNumber));
        return strict ? result.strict() : result;
    }
}
