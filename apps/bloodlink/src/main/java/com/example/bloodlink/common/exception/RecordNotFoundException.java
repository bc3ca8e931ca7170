package com.example.bloodlink.common.exception;

import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import lombok.Getter;

@Getter
public class RecordNotFoundException extends RuntimeException {

    private final ResourceType resourceType;
    private final String resourceId;

    public RecordNotFoundException(ResourceType resourceType, String resourceId) {
        super(String.format("%s %s not found", resourceType.displayName(), resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
}
