package com.tradeledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface OpenLotRepository extends MongoRepository<OpenLot, String> {

    List<OpenLot> findByNamespaceAndVersionNumberOrderBySymbolAscBuyTimeAscBuyOrderIdAsc(String namespace, long versionNumber);

    List<OpenLot> findByNamespaceAndVersionNumberAndSymbolInOrderBySymbolAscBuyTimeAscBuyOrderIdAsc(
            String namespace, long versionNumber, Collection<String> symbols);
}
