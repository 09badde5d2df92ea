package com.tradeledger.allocation.version;

import com.tradeledger.domain.AllocationLease;
import com.tradeledger.domain.AllocationVersion;
import com.tradeledger.domain.AllocationVersionRepository;
import com.tradeledger.domain.CurrentVersionPointer;
import com.tradeledger.domain.FifoAllocation;
import com.tradeledger.domain.FifoAllocationRepository;
import com.tradeledger.domain.OpenLot;
import com.tradeledger.domain.OpenLotRepository;
import com.tradeledger.domain.UnmatchedSellResidue;
import com.tradeledger.domain.UnmatchedSellResidueRepository;
import com.tradeledger.domain.VersionCounter;
import com.tradeledger.domain.VersionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoDB version store. Counters, pointer swaps and leases use single-document atomic operations
 * (findAndModify / conditional update / unique _id) so they hold across processes.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class MongoAllocationVersionStore implements AllocationVersionStore {

    private final MongoTemplate mongoTemplate;
    private final AllocationVersionRepository versionRepository;
    private final FifoAllocationRepository allocationRepository;
    private final UnmatchedSellResidueRepository residueRepository;
    private final OpenLotRepository openLotRepository;

    @Override
    public long reserveVersionNumber(String namespace) {
        Query query = new Query(where("_id").is(namespace));
        Update update = new Update().inc("lastNumber", 1L);
        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true).upsert(true);
        VersionCounter counter;
        try {
            counter = mongoTemplate.findAndModify(query, update, options, VersionCounter.class);
        } catch (DuplicateKeyException e) {
            // two first-ever upserts raced; the counter document exists now
            counter = mongoTemplate.findAndModify(query, update, options, VersionCounter.class);
        }
        if (counter == null) {
            throw new IllegalStateException("Version counter upsert returned nothing for " + namespace);
        }
        return counter.getLastNumber();
    }

    @Override
    public AllocationVersion insertVersion(AllocationVersion version) {
        try {
            return mongoTemplate.insert(version);
        } catch (DuplicateKeyException e) {
            throw new VersionConflictException("Version " + version.getVersionNumber() + " of namespace "
                    + version.getNamespace() + " was claimed concurrently", e);
        }
    }

    @Override
    public boolean updateVersion(AllocationVersion version, VersionStatus expectedStatus) {
        Query query = new Query(where("_id").is(version.getId()).and("status").is(expectedStatus));
        return mongoTemplate.findAndReplace(query, version) != null;
    }

    @Override
    public void writeRows(List<FifoAllocation> allocations, List<UnmatchedSellResidue> residues, List<OpenLot> openLots) {
        if (!allocations.isEmpty()) {
            mongoTemplate.insert(allocations, FifoAllocation.class);
        }
        if (!residues.isEmpty()) {
            mongoTemplate.insert(residues, UnmatchedSellResidue.class);
        }
        if (!openLots.isEmpty()) {
            mongoTemplate.insert(openLots, OpenLot.class);
        }
    }

    @Override
    public Optional<AllocationVersion> findVersion(String namespace, long versionNumber) {
        return versionRepository.findByNamespaceAndVersionNumber(namespace, versionNumber);
    }

    @Override
    public List<AllocationVersion> findVersions(String namespace, Instant from, Instant to) {
        Criteria criteria = where("namespace").is(namespace);
        if (from != null || to != null) {
            Criteria createdAt = criteria.and("createdAt");
            if (from != null) {
                createdAt.gte(from);
            }
            if (to != null) {
                createdAt.lte(to);
            }
        }
        Query query = new Query(criteria).with(Sort.by(Sort.Order.asc("versionNumber")));
        return mongoTemplate.find(query, AllocationVersion.class);
    }

    @Override
    public List<AllocationVersion> findByStatus(String namespace, VersionStatus status) {
        return versionRepository.findByNamespaceAndStatus(namespace, status);
    }

    @Override
    public List<FifoAllocation> findAllocations(String namespace, long versionNumber, Collection<String> symbols) {
        if (symbols == null || symbols.isEmpty()) {
            return allocationRepository.findByNamespaceAndVersionNumberOrderBySequenceAsc(namespace, versionNumber);
        }
        return allocationRepository.findByNamespaceAndVersionNumberAndSymbolInOrderBySequenceAsc(namespace, versionNumber, symbols);
    }

    @Override
    public List<UnmatchedSellResidue> findResidues(String namespace, long versionNumber, Collection<String> symbols) {
        if (symbols == null || symbols.isEmpty()) {
            return residueRepository.findByNamespaceAndVersionNumberOrderBySequenceAsc(namespace, versionNumber);
        }
        return residueRepository.findByNamespaceAndVersionNumberAndSymbolInOrderBySequenceAsc(namespace, versionNumber, symbols);
    }

    @Override
    public List<OpenLot> findOpenLots(String namespace, long versionNumber, Collection<String> symbols) {
        if (symbols == null || symbols.isEmpty()) {
            return openLotRepository.findByNamespaceAndVersionNumberOrderBySymbolAscBuyTimeAscBuyOrderIdAsc(namespace, versionNumber);
        }
        return openLotRepository.findByNamespaceAndVersionNumberAndSymbolInOrderBySymbolAscBuyTimeAscBuyOrderIdAsc(
                namespace, versionNumber, symbols);
    }

    @Override
    public Optional<Long> findCurrentVersionNumber(String namespace) {
        return Optional.ofNullable(mongoTemplate.findById(namespace, CurrentVersionPointer.class))
                .map(CurrentVersionPointer::getVersionNumber);
    }

    @Override
    public boolean compareAndSetCurrent(String namespace, Long expected, long next) {
        if (expected == null) {
            CurrentVersionPointer pointer = new CurrentVersionPointer();
            pointer.setId(namespace);
            pointer.setVersionNumber(next);
            pointer.setUpdatedAt(Instant.now());
            try {
                mongoTemplate.insert(pointer);
                return true;
            } catch (DuplicateKeyException e) {
                return false;
            }
        }
        Query query = new Query(where("_id").is(namespace).and("versionNumber").is(expected));
        Update update = new Update().set("versionNumber", next).set("updatedAt", Instant.now());
        return mongoTemplate.updateFirst(query, update, CurrentVersionPointer.class).getModifiedCount() == 1;
    }

    @Override
    public boolean tryAcquireLease(String namespace, String holder, Instant now, Duration ttl) {
        Query query = new Query(where("_id").is(namespace)
                .orOperator(where("expiresAt").lt(now), where("holder").is(holder)));
        Update update = new Update()
                .set("holder", holder)
                .set("acquiredAt", now)
                .set("expiresAt", now.plus(ttl));
        try {
            mongoTemplate.upsert(query, update, AllocationLease.class);
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Allocation lease of {} is held", namespace);
            return false;
        }
    }

    @Override
    public void releaseLease(String namespace, String holder) {
        mongoTemplate.remove(new Query(where("_id").is(namespace).and("holder").is(holder)), AllocationLease.class);
    }
}
