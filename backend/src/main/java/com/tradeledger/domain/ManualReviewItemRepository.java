package com.tradeledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ManualReviewItemRepository extends MongoRepository<ManualReviewItem, String> {

    List<ManualReviewItem> findByStatusOrderByCreatedAtAsc(ReviewStatus status);

    Optional<ManualReviewItem> findByOrderIdAndIssueType(String orderId, ReviewIssueType issueType);
}
