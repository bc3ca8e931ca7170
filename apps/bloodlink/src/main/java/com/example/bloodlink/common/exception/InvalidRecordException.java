package com.example.bloodlink.common.exception;

import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import lombok.Getter;

/**
 * Exception thrown when a record written to the store breaks one of its own constraints
 * (e.g. a campaign ending before it starts).
 */
@Getter
public class InvalidRecordException extends RuntimeException {

    private final ResourceType resourceType;
    private final String field;

    public InvalidRecordException(ResourceType resourceType, String field, String message) {
        super(message);
        this.resourceType = resourceType;
        this.field = field;
    }
}
