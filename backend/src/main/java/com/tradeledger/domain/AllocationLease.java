package com.tradeledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mutual-exclusion lease for allocation computations of one namespace. A lease past {@code expiresAt}
 * may be taken over; the holder token identifies who may release it.
 */
@Document(collection = "allocation_leases")
@NoArgsConstructor
@Getter
@Setter
public class AllocationLease {

    /** Namespace. */
    @Id
    private String id;
    private String holder;
    private Instant acquiredAt;
    private Instant expiresAt;
}
