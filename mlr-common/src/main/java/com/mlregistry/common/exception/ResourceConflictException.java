package com.mlregistry.common.exception;

/**
 * Thrown when a uniqueness rule is violated.
 * Carries the id of the row that already holds the unique key,
 * so a caller can reuse the existing registration.
 */
public class ResourceConflictException extends RegistryException {

    private final Long existingId;

    public ResourceConflictException(ErrorCode errorCode, String message, Long existingId) {
        super(errorCode, message);
        this.existingId = existingId;
    }

    public ResourceConflictException(ErrorCode errorCode, String message, Long existingId, Throwable cause) {
        super(errorCode, message, cause);
        this.existingId = existingId;
    }

    public Long getExistingId() {
        return existingId;
    }
}
