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
 * One matched lot: {@code quantity} units of a sell funded by a buy, inside one allocation version.
 * realizedPnl = netProceeds - costBasis = quantity * (sellPrice - buyPrice) - buyFeeShare - sellFeeShare.
 */
@Document(collection = "fifo_allocations")
@CompoundIndexes({
    @CompoundIndex(name = "namespace_version_sequence", def = "{'namespace': 1, 'versionNumber': 1, 'sequence': 1}", unique = true),
    @CompoundIndex(name = "namespace_version_symbol", def = "{'namespace': 1, 'versionNumber': 1, 'symbol': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class FifoAllocation {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String namespace;
    private long versionNumber;
    /** Position in the version's deterministic output order. */
    private int sequence;
    private String symbol;
    private String sellOrderId;
    private String buyOrderId;
    private BigDecimal quantity;
    private BigDecimal buyPrice;
    private BigDecimal sellPrice;
    private BigDecimal buyFeeShare;
    private BigDecimal sellFeeShare;
    private BigDecimal costBasis;
    private BigDecimal proceeds;
    private BigDecimal netProceeds;
    private BigDecimal realizedPnl;
    private Instant buyTime;
    private Instant sellTime;
}
