package com.tradeledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Per-namespace sequence for version numbers; incremented atomically with findAndModify.
 */
@Document(collection = "version_counters")
@NoArgsConstructor
@Getter
@Setter
public class VersionCounter {

    /** Namespace. */
    @Id
    private String id;
    private long lastNumber;
}
