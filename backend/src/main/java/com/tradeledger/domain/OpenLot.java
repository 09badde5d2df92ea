package com.tradeledger.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Inventory snapshot: a buy lot with quantity still unmatched at the end of a version's computation.
 */
@Document(collection = "open_lots")
@CompoundIndex(name = "namespace_version_symbol", def = "{'namespace': 1, 'versionNumber': 1, 'symbol': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class OpenLot {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String namespace;
    private long versionNumber;
    private String symbol;
    private String buyOrderId;
    private BigDecimal originalQuantity;
    private BigDecimal remainingQuantity;
    private BigDecimal buyPrice;
    private Instant buyTime;
}
