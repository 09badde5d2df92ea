package com.tradeledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for allocation_versions. Time-range reads use MongoTemplate (inclusive bounds) in the version store.
 */
public interface AllocationVersionRepository extends MongoRepository<AllocationVersion, String> {

    Optional<AllocationVersion> findByNamespaceAndVersionNumber(String namespace, long versionNumber);

    List<AllocationVersion> findByNamespaceAndStatus(String namespace, VersionStatus status);
}
