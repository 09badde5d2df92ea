package com.tradeledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One executed fill in the append-only trade ledger. Unique by (orderId, symbol); rows are inserted once and
 * never updated. Corrections are new compensating records.
 */
@Document(collection = "trade_records")
@CompoundIndexes({
    @CompoundIndex(name = "orderId_symbol", def = "{'orderId': 1, 'symbol': 1}", unique = true),
    @CompoundIndex(name = "symbol_exchangeTimestamp", def = "{'symbol': 1, 'exchangeTimestamp': 1}"),
    @CompoundIndex(name = "ingestedAt", def = "{'ingestedAt': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TradeRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String orderId;
    /** Exchange trade id of the (last) fill, when known. */
    private String tradeId;
    private String symbol;
    private TradeSide side;
    private BigDecimal quantity;
    private BigDecimal price;
    private BigDecimal fee;
    private Instant exchangeTimestamp;
    private Instant ingestedAt;
    private TradeSource source;

    public boolean isBuy() {
        return side == TradeSide.BUY;
    }

    public BigDecimal feeOrZero() {
        return fee != null ? fee : BigDecimal.ZERO;
    }
}
