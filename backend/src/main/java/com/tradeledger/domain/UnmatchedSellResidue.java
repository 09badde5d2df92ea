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
 * Quantity of a sell for which no open buy lot existed in the scanned history. Carries proceeds but no cost
 * basis and no realized P&amp;L: the numeric treatment is left to whoever owns P&amp;L policy.
 */
@Document(collection = "unmatched_sell_residues")
@CompoundIndexes({
    @CompoundIndex(name = "namespace_version_sequence", def = "{'namespace': 1, 'versionNumber': 1, 'sequence': 1}", unique = true)
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class UnmatchedSellResidue {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String namespace;
    private long versionNumber;
    private int sequence;
    private String symbol;
    private String sellOrderId;
    private BigDecimal quantity;
    private BigDecimal sellPrice;
    private BigDecimal sellFeeShare;
    private BigDecimal proceeds;
    private BigDecimal netProceeds;
    private Instant sellTime;
    private String note;
}
