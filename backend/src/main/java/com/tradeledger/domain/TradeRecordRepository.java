package com.tradeledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for trade_records. Writes go through the ledger so duplicates are absorbed by the unique index.
 */
public interface TradeRecordRepository extends MongoRepository<TradeRecord, String> {

    Optional<TradeRecord> findByOrderIdAndSymbol(String orderId, String symbol);

    boolean existsByOrderId(String orderId);
}
