package com.tradeledger.api.controller;

import com.tradeledger.allocation.config.AllocationProperties;
import com.tradeledger.allocation.query.AllocationQueryService;
import com.tradeledger.allocation.query.PnlReport;
import com.tradeledger.allocation.run.AllocationRunRequest;
import com.tradeledger.allocation.run.AllocationRunResult;
import com.tradeledger.allocation.run.AllocationRunService;
import com.tradeledger.allocation.validation.ValidationResult;
import com.tradeledger.allocation.validation.ValidationService;
import com.tradeledger.allocation.version.VersionManager;
import com.tradeledger.api.dto.AllocationRunRequestBody;
import com.tradeledger.api.dto.AllocationVersionResponse;
import com.tradeledger.api.dto.ErrorBody;
import com.tradeledger.common.LedgerErrorCode;
import com.tradeledger.domain.FifoAllocation;
import com.tradeledger.domain.OpenLot;
import com.tradeledger.domain.UnmatchedSellResidue;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Allocation runs, standalone validation and version-addressed reads.
 */
@RestController
@RequestMapping("/api/v1/allocations")
@RequiredArgsConstructor
public class AllocationController {

    static final String API_TRIGGER = "api";

    private final AllocationRunService allocationRunService;
    private final ValidationService validationService;
    private final VersionManager versionManager;
    private final AllocationQueryService queryService;
    private final AllocationProperties allocationProperties;

    /**
     * Runs an allocation synchronously. 200 when promoted, 422 with the run result when validation failed.
     */
    @PostMapping("/runs")
    public ResponseEntity<?> run(@RequestBody @Valid AllocationRunRequestBody request) {
        boolean all = Boolean.TRUE.equals(request.all());
        Set<String> symbols = request.symbols() == null ? Set.of() : request.symbols().stream()
                .filter(s -> s != null && !s.isBlank())
                .map(String::trim)
                .collect(Collectors.toSet());
        if (!all && symbols.isEmpty()) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", "symbols or all=true is required"));
        }
        if (all && !symbols.isEmpty()) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", "symbols and all=true are exclusive"));
        }
        String namespace = namespaceOrDefault(request.namespace());
        AllocationRunRequest runRequest = all
                ? AllocationRunRequest.all(namespace, API_TRIGGER)
                : AllocationRunRequest.scoped(namespace, symbols, API_TRIGGER);
        if (request.leaseWaitMs() != null) {
            runRequest = runRequest.withLeaseWait(Duration.ofMillis(request.leaseWaitMs()));
        }
        AllocationRunResult result = allocationRunService.run(runRequest);
        if (result.errorCode() == LedgerErrorCode.VALIDATION_FAILURE) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @PostMapping("/{namespace}/versions/{versionNumber}/validation")
    public ResponseEntity<ValidationResult> validate(
            @PathVariable String namespace,
            @PathVariable long versionNumber,
            @RequestParam(required = false, defaultValue = "false") boolean strict
    ) {
        return ResponseEntity.ok(validationService.validateVersion(namespace, versionNumber, strict));
    }

    @GetMapping("/{namespace}/versions/current")
    public ResponseEntity<AllocationVersionResponse> current(@PathVariable String namespace) {
        return ResponseEntity.ok(AllocationVersionResponse.from(versionManager.requireCurrent(namespace)));
    }

    @GetMapping("/{namespace}/versions/{versionNumber}")
    public ResponseEntity<AllocationVersionResponse> version(@PathVariable String namespace,
                                                             @PathVariable long versionNumber) {
        return ResponseEntity.ok(AllocationVersionResponse.from(versionManager.getByVersion(namespace, versionNumber)));
    }

    @GetMapping("/{namespace}/versions")
    public ResponseEntity<List<AllocationVersionResponse>> versions(
            @PathVariable String namespace,
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to
    ) {
        return ResponseEntity.ok(versionManager.findVersions(namespace, from, to).stream()
                .map(AllocationVersionResponse::from)
                .toList());
    }

    @GetMapping("/{namespace}/versions/{versionNumber}/allocations")
    public ResponseEntity<List<FifoAllocation>> allocations(
            @PathVariable String namespace,
            @PathVariable long versionNumber,
            @RequestParam(required = false) List<String> symbol
    ) {
        return ResponseEntity.ok(queryService.allocations(namespace, versionNumber, symbol == null ? List.of() : symbol));
    }

    @GetMapping("/{namespace}/versions/{versionNumber}/residues")
    public ResponseEntity<List<UnmatchedSellResidue>> residues(@PathVariable String namespace,
                                                               @PathVariable long versionNumber) {
        return ResponseEntity.ok(queryService.residues(namespace, versionNumber));
    }

    @GetMapping("/{namespace}/versions/{versionNumber}/open-lots")
    public ResponseEntity<List<OpenLot>> openLots(@PathVariable String namespace,
                                                  @PathVariable long versionNumber) {
        return ResponseEntity.ok(queryService.openLots(namespace, versionNumber));
    }

    /** P&amp;L of the given version, or of the current version when none is given. */
    @GetMapping("/{namespace}/pnl")
    public ResponseEntity<PnlReport> pnl(@PathVariable String namespace,
                                         @RequestParam(required = false) Long version) {
        return ResponseEntity.ok(queryService.pnl(namespace, version));
    }

    private String namespaceOrDefault(String namespace) {
        return namespace == null || namespace.isBlank() ? allocationProperties.getDefaultNamespace() : namespace.trim();
    }
}
