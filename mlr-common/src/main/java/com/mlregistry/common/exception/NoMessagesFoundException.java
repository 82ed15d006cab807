package com.mlregistry.common.exception;

/**
 * Thrown when a stream read finished its window without receiving a record.
 * The dataset, topic and broker configuration is valid in this case.
 */
public class NoMessagesFoundException extends RegistryException {

    public NoMessagesFoundException(String message) {
        super(ErrorCode.NO_MESSAGES_FOUND, message);
    }
}
