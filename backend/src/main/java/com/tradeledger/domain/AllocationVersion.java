package com.tradeledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Numbered snapshot of one FIFO computation for a namespace. Only status fields and the promotion lineage
 * change after insert; rows are never deleted.
 */
@Document(collection = "allocation_versions")
@CompoundIndexes({
    @CompoundIndex(name = "namespace_versionNumber", def = "{'namespace': 1, 'versionNumber': 1}", unique = true),
    @CompoundIndex(name = "namespace_createdAt", def = "{'namespace': 1, 'createdAt': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class AllocationVersion {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String namespace;
    private long versionNumber;
    private VersionStatus status;
    private AllocationRunMode mode;
    private Instant createdAt;
    /** Ledger snapshot: records with ingestedAt &lt;= cutoff. */
    private Instant ledgerCutoff;
    /** Symbols recomputed by this run. */
    private List<String> computedSymbols = new ArrayList<>();
    /** Symbols copied unchanged from {@link #basedOnVersion}. */
    private List<String> carriedForwardSymbols = new ArrayList<>();
    /** Current version when this run started; null for the first version of a namespace. */
    private Long basedOnVersion;
    private Long supersedes;
    private Long supersededBy;
    private Instant promotedAt;
    private Instant completedAt;
    private String triggeredBy;

    private int buysProcessed;
    private int sellsProcessed;
    private int allocationCount;
    private int residueCount;
    private int openLotCount;
    private BigDecimal totalRealizedPnl;
    private long durationMs;

    /** Audit flag: at least one sell had quantity without a buy lot. */
    private boolean hasUnmatchedResidue;
    private List<String> validationErrors = new ArrayList<>();
    private List<String> validationWarnings = new ArrayList<>();
}
