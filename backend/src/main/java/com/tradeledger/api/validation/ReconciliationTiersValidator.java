package com.tradeledger.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.List;

/**
 * Accepts tier selectors understood by {@link TierSelectors}.
 */
public class ReconciliationTiersValidator implements ConstraintValidator<ReconciliationTiers, List<String>> {

    @Override
    public boolean isValid(List<String> value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }
        return value.stream().allMatch(TierSelectors::isValid);
    }
}
