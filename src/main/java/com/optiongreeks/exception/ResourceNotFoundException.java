package com.optiongreeks.exception;

import java.util.Map;

/** A position or other tracked resource could not be found. Details carry the lookup key. */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        this(
                resourceType,
                identifier,
                Map.of("resourceType", String.valueOf(resourceType), "identifier", String.valueOf(identifier)));
    }

    public ResourceNotFoundException(String resourceType, String identifier, Map<String, Object> details) {
        super(ErrorCode.NOT_FOUND, String.format("%s not found with identifier: %s", resourceType, identifier), details);
    }
}
