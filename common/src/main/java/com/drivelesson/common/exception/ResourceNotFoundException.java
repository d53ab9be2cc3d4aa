package com.drivelesson.common.exception;

/**
 * Thrown when a provider, booking or credit cannot be found.
 */
public class ResourceNotFoundException extends BusinessException {
    public static final String CODE = "RESOURCE_NOT_FOUND";

    public ResourceNotFoundException(String message) {
        super(message, CODE);
    }

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("%s with identifier %s not found", resourceType, identifier), CODE);
    }
}
