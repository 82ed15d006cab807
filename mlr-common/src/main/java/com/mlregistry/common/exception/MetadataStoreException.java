package com.mlregistry.common.exception;

/**
 * Thrown when the relational metadata store fails underneath an operation.
 */
public class MetadataStoreException extends RegistryException {

    public MetadataStoreException(ErrorCode errorCode) {
        super(errorCode);
    }

    public MetadataStoreException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public MetadataStoreException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
