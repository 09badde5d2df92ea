package com.tradeledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Audit record of one tier of a reconciliation run. Only meaningful relative to {@link #snapshotCutoff}:
 * ledger rows ingested later were not compared. Inserted once, never updated.
 */
@Document(collection = "reconciliation_reports")
@CompoundIndex(name = "namespace_createdAt", def = "{'namespace': 1, 'createdAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ReconciliationReport {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    /** Groups the reports of tiers executed in one run. */
    private String runId;
    private String namespace;
    private ReconciliationTier tier;
    private List<String> symbols = new ArrayList<>();
    private Instant windowFrom;
    private Instant windowTo;
    private Instant snapshotCutoff;
    private Instant createdAt;
    private int localOrderCount;
    private int externalOrderCount;
    private List<Discrepancy> discrepancies = new ArrayList<>();

    public List<Discrepancy> discrepanciesOf(DiscrepancyKind kind) {
        return discrepancies.stream().filter(d -> d.getKind() == kind).toList();
    }
}
