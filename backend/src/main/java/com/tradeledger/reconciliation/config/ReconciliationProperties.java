package com.tradeledger.reconciliation.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Reconciliation runs. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "tradeledger.reconciliation")
@NoArgsConstructor
@Getter
@Setter
public class ReconciliationProperties {

    /** Absolute tolerance for quantity, price and fee comparison in the value tier. Zero means exact. */
    private BigDecimal amountTolerance = BigDecimal.ZERO;

    /** Longest accepted time window. */
    private Duration maxWindow = Duration.ofDays(400);

    /** Write EXTRA_TRADE and AMOUNT_MISMATCH discrepancies to the manual review queue. */
    private boolean flagAnomalies = true;
}
