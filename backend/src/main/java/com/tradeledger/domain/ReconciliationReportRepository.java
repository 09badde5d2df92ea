package com.tradeledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ReconciliationReportRepository extends MongoRepository<ReconciliationReport, String> {

    List<ReconciliationReport> findByRunIdOrderByTierAsc(String runId);
}
