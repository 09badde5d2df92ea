package com.tradeledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface UnmatchedSellResidueRepository extends MongoRepository<UnmatchedSellResidue, String> {

    List<UnmatchedSellResidue> findByNamespaceAndVersionNumberOrderBySequenceAsc(String namespace, long versionNumber);

    List<UnmatchedSellResidue> findByNamespaceAndVersionNumberAndSymbolInOrderBySequenceAsc(
            String namespace, long versionNumber, Collection<String> symbols);
}
