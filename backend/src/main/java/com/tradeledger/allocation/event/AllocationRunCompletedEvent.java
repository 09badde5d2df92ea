package com.tradeledger.allocation.event;

import com.tradeledger.domain.VersionStatus;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every allocation run that reserved a version, whatever its outcome.
 */
@Getter
public class AllocationRunCompletedEvent extends ApplicationEvent {

    private final String namespace;
    private final long versionNumber;
    private final VersionStatus status;
    private final boolean promoted;

    public AllocationRunCompletedEvent(Object source, String namespace, long versionNumber, VersionStatus status, boolean promoted) {
        super(source);
        this.namespace = namespace;
        this.versionNumber = versionNumber;
        this.status = status;
        this.promoted = promoted;
    }
}
