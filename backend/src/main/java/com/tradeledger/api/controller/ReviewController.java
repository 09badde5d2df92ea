package com.tradeledger.api.controller;

import com.tradeledger.api.dto.ReviewResolutionRequest;
import com.tradeledger.domain.ManualReviewItem;
import com.tradeledger.domain.ReviewStatus;
import com.tradeledger.review.ManualReviewQueue;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Manual review queue: residues, extra trades and amount mismatches awaiting a human decision.
 */
@RestController
@RequestMapping("/api/v1/review-items")
@RequiredArgsConstructor
public class ReviewController {

    private final ManualReviewQueue manualReviewQueue;

    @GetMapping
    public ResponseEntity<List<ManualReviewItem>> items(
            @RequestParam(required = false, defaultValue = "PENDING") ReviewStatus status
    ) {
        return ResponseEntity.ok(manualReviewQueue.findByStatus(status));
    }

    @PostMapping("/{id}/resolution")
    public ResponseEntity<ManualReviewItem> resolve(@PathVariable String id,
                                                    @RequestBody @Valid ReviewResolutionRequest request) {
        return ResponseEntity.ok(manualReviewQueue.resolve(id, request.status(), request.resolution(), request.resolvedBy()));
    }
}
