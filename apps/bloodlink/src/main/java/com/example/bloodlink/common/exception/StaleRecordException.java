package com.example.bloodlink.common.exception;

import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import lombok.Getter;

/**
 * Exception thrown when a record changed between the policy check and the write.
 * The decision was made on a state that no longer exists, so the write is dropped.
 */
@Getter
public class StaleRecordException extends RuntimeException {

    private final ResourceType resourceType;
    private final String resourceId;

    public StaleRecordException(ResourceType resourceType, String resourceId, Throwable cause) {
        super(String.format("%s %s was modified concurrently", resourceType.displayName(), resourceId), cause);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
}
