package com.tradeledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Data-integrity anomaly waiting for a human decision. One item per (orderId, issueType); re-flagging refreshes
 * the description and keeps the resolution state.
 */
@Document(collection = "manual_review_queue")
@CompoundIndexes({
    @CompoundIndex(name = "orderId_issueType", def = "{'orderId': 1, 'issueType': 1}", unique = true),
    @CompoundIndex(name = "status_createdAt", def = "{'status': 1, 'createdAt': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ManualReviewItem {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String orderId;
    private String symbol;
    private ReviewIssueType issueType;
    private ReviewSeverity severity;
    private ReviewStatus status;
    private String description;
    /** Where the anomaly was found, e.g. "allocation:default:v7" or "reconciliation:&lt;runId&gt;". */
    private String detectedBy;
    private Instant createdAt;
    private Instant updatedAt;
    private String resolution;
    private String resolvedBy;
    private Instant resolvedAt;
}
