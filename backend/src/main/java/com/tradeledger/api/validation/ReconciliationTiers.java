package com.tradeledger.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * List of reconciliation tier selectors; null or empty means all tiers.
 * Error code for API: INVALID_TIER.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = ReconciliationTiersValidator.class)
public @interface ReconciliationTiers {

    String message() default "INVALID_TIER";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
