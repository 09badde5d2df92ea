package com.tradeledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface FifoAllocationRepository extends MongoRepository<FifoAllocation, String> {

    List<FifoAllocation> findByNamespaceAndVersionNumberOrderBySequenceAsc(String namespace, long versionNumber);

    List<FifoAllocation> findByNamespaceAndVersionNumberAndSymbolInOrderBySequenceAsc(
            String namespace, long versionNumber, Collection<String> symbols);
}
