package com.mlregistry.common.exception;

/**
 * Thrown when the message broker cannot be contacted or read from.
 */
public class StreamTransportException extends RegistryException {

    public StreamTransportException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
