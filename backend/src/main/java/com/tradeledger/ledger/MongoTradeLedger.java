package com.tradeledger.ledger;

import com.tradeledger.domain.TimeWindow;
import com.tradeledger.domain.TradeRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Trade ledger on trade_records. Idempotency relies on the unique (orderId, symbol) index: a concurrent second
 * insert fails with DuplicateKeyException and is treated as a no-op, so the first writer wins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MongoTradeLedger implements TradeLedger {

    private static final Sort LEDGER_ORDER = Sort.by(Sort.Order.asc("exchangeTimestamp"), Sort.Order.asc("orderId"));

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean append(TradeRecord record) {
        if (record.getId() != null) {
            throw new IllegalArgumentException("Ledger records are insert-only; id must be unset");
        }
        try {
            mongoTemplate.insert(record);
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Trade {} {} already in ledger, append is a no-op", record.getOrderId(), record.getSymbol());
            record.setId(null);
            return false;
        }
    }

    @Override
    public List<TradeRecord> scan(Collection<String> symbols, Instant cutoff) {
        Criteria criteria = where("ingestedAt").lte(cutoff);
        if (symbols != null && !symbols.isEmpty()) {
            criteria = criteria.and("symbol").in(symbols);
        }
        return mongoTemplate.find(new Query(criteria).with(LEDGER_ORDER), TradeRecord.class);
    }

    @Override
    public List<TradeRecord> findInWindow(String symbol, TimeWindow window, Instant cutoff) {
        Query query = new Query(where("symbol").is(symbol)
                .and("exchangeTimestamp").gte(window.from()).lte(window.to())
                .and("ingestedAt").lte(cutoff))
                .with(LEDGER_ORDER);
        return mongoTemplate.find(query, TradeRecord.class);
    }

    @Override
    public Set<String> distinctSymbols(Instant cutoff) {
        Query query = new Query(where("ingestedAt").lte(cutoff));
        return new TreeSet<>(mongoTemplate.findDistinct(query, "symbol", TradeRecord.class, String.class));
    }
}
