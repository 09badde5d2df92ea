package com.tradeledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * The single current version of a namespace. Swapped only by compare-and-set on {@code versionNumber}.
 */
@Document(collection = "current_versions")
@NoArgsConstructor
@Getter
@Setter
public class CurrentVersionPointer {

    /** Namespace. */
    @Id
    private String id;
    private long versionNumber;
    private Instant updatedAt;
}
