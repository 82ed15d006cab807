package com.mlregistry.common.exception;

/**
 * Thrown for malformed addresses, non-positive ports and other invalid input.
 */
public class RequestValidationException extends RegistryException {

    public RequestValidationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public RequestValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public RequestValidationException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
