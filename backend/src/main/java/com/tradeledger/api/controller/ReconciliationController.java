package com.tradeledger.api.controller;

import com.tradeledger.allocation.config.AllocationProperties;
import com.tradeledger.api.dto.ErrorBody;
import com.tradeledger.api.dto.ReconciliationRunRequestBody;
import com.tradeledger.api.validation.TierSelectors;
import com.tradeledger.domain.ReconciliationReport;
import com.tradeledger.domain.TimeWindow;
import com.tradeledger.reconciliation.ReconciliationRequest;
import com.tradeledger.reconciliation.ReconciliationRunResult;
import com.tradeledger.reconciliation.ReconciliationRunService;
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

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reconciliation runs against the exchange and report history.
 */
@RestController
@RequestMapping("/api/v1/reconciliations")
@RequiredArgsConstructor
public class ReconciliationController {

    private final ReconciliationRunService reconciliationRunService;
    private final AllocationProperties allocationProperties;

    @PostMapping
    public ResponseEntity<?> run(@RequestBody @Valid ReconciliationRunRequestBody request) {
        if (!request.from().isBefore(request.to())) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_WINDOW", "from must be before to"));
        }
        Set<String> symbols = request.symbols() == null ? Set.of() : request.symbols().stream()
                .filter(s -> s != null && !s.isBlank())
                .map(String::trim)
                .collect(Collectors.toSet());
        String namespace = request.namespace() == null || request.namespace().isBlank()
                ? allocationProperties.getDefaultNamespace()
                : request.namespace().trim();
        ReconciliationRunResult result = reconciliationRunService.run(new ReconciliationRequest(
                namespace,
                TierSelectors.parseAll(request.tiers()),
                symbols,
                new TimeWindow(request.from(), request.to()),
                request.autoBackfill()));
        return ResponseEntity.ok(result);
    }

    @GetMapping
    public ResponseEntity<List<ReconciliationReport>> reports(
            @RequestParam(required = false) String namespace,
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to
    ) {
        String ns = namespace == null || namespace.isBlank() ? allocationProperties.getDefaultNamespace() : namespace;
        return ResponseEntity.ok(reconciliationRunService.findReports(ns, from, to));
    }

    @GetMapping("/{runId}")
    public ResponseEntity<List<ReconciliationReport>> run(@PathVariable String runId) {
        List<ReconciliationReport> reports = reconciliationRunService.findRun(runId);
        if (reports.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(reports);
    }
}
