package com.mlregistry.common.exception;

/**
 * Thrown when a broker, topic, dataset or link referenced by id does not exist.
 */
public class ResourceNotFoundException extends RegistryException {

    public ResourceNotFoundException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ResourceNotFoundException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ResourceNotFoundException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
