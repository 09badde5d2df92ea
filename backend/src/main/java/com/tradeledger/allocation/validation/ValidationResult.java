package com.tradeledger.allocation.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Verdict for one allocation version. Valid when there are no errors; warnings flag audit-visible anomalies.
 */
public record ValidationResult(String namespace, long versionNumber, List<Violation> errors, List<Violation> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean valid() {
        return errors.isEmpty();
    }

    /** Strict mode: every warning counts as an error. */
    public ValidationResult strict() {
        if (warnings.isEmpty()) {
            return this;
        }
        List<Violation> all = new ArrayList<>(errors);
        all.addAll(warnings);
        return new ValidationResult(namespace, versionNumber, all, List.of());
    }

    public List<String> errorReasons() {
        return errors.stream().map(Violation::toReason).toList();
    }

    public List<String> warningReasons() {
        return warnings.stream().map(Violation::toReason).toList();
    }
}
