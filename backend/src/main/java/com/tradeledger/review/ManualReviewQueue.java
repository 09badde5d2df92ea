package com.tradeledger.review;

import com.tradeledger.common.InvalidRequestException;
import com.tradeledger.common.LedgerErrorCode;
import com.tradeledger.common.LedgerException;
import com.tradeledger.domain.ManualReviewItem;
import com.tradeledger.domain.ManualReviewItemRepository;
import com.tradeledger.domain.ReviewIssueType;
import com.tradeledger.domain.ReviewSeverity;
import com.tradeledger.domain.ReviewStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Data-integrity anomalies for human review. Flagging upserts on (orderId, issueType): the description is
 * refreshed, status and resolution of an existing item are kept. Nothing here resolves items automatically.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ManualReviewQueue {

    private final MongoTemplate mongoTemplate;
    private final ManualReviewItemRepository repository;
    private final Clock clock;

    public void flag(String orderId, String symbol, ReviewIssueType issueType, ReviewSeverity severity,
                     String description, String detectedBy) {
        Instant now = clock.instant();
        Query query = new Query(where("orderId").is(orderId).and("issueType").is(issueType));
        Update update = new Update()
                .set("symbol", symbol)
                .set("severity", severity)
                .set("description", description)
                .set("detectedBy", detectedBy)
                .set("updatedAt", now)
                .setOnInsert("status", ReviewStatus.PENDING)
                .setOnInsert("createdAt", now);
        mongoTemplate.upsert(query, update, ManualReviewItem.class);
        log.info("Flagged {} for order {} ({}) for manual review", issueType, orderId, symbol);
    }

    public List<ManualReviewItem> findByStatus(ReviewStatus status) {
        return repository.findByStatusOrderByCreatedAtAsc(status);
    }

    /**
     * Records a human decision on an item.
     *
     * @param status RESOLVED or IGNORED
     */
    public ManualReviewItem resolve(String itemId, ReviewStatus status, String resolution, String resolvedBy) {
        if (status == ReviewStatus.PENDING) {
            throw new InvalidRequestException("Resolution status must be RESOLVED or IGNORED");
        }
        ManualReviewItem item = repository.findById(itemId)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.NOT_FOUND, "No review item " + itemId));
        item.setStatus(status);
        item.setResolution(resolution);
        item.setResolvedBy(resolvedBy);
        item.setResolvedAt(clock.instant());
        item.setUpdatedAt(item.getResolvedAt());
        return repository.save(item);
    }
}
