package com.mlregistry.common.exception;

/**
 * Thrown when a message payload cannot be decoded into a structured record.
 */
public class MessageDecodeException extends RegistryException {

    public MessageDecodeException(String message, Throwable cause) {
        super(ErrorCode.MESSAGE_DECODE_FAILED, message, cause);
    }
}
