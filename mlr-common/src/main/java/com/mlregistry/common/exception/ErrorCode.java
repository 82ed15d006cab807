package com.mlregistry.common.exception;

/**
 * Error codes for categorizing registry and stream failures.
 * Error codes are organized by category:
 * - 1xxx: Validation errors
 * - 2xxx: Resource not found
 * - 3xxx: Conflicts with existing rows
 * - 4xxx: Stream reachable but empty
 * - 5xxx: Broker transport and payload errors
 * - 6xxx: Metadata store errors
 */
public enum ErrorCode {

    // Validation errors (1xxx)
    INVALID_REQUEST(1001, "Invalid request parameters"),
    INVALID_BROKER_ADDRESS(1002, "Broker address is not a valid IPv4 or IPv6 literal"),
    INVALID_BROKER_PORT(1003, "Broker port must be greater than 0"),
    INVALID_DATASET_TYPE(1004, "Dataset type must be 0 (train), 1 (inference) or 2 (both)"),
    INVALID_RECORD_COUNT(1005, "Number of records must be a positive integer within the allowed limit"),
    INVALID_OFFSET_POLICY(1006, "Offset policy must be 'earliest' or 'latest'"),

    // Not found (2xxx)
    BROKER_NOT_FOUND(2001, "Broker does not exist"),
    TOPIC_NOT_FOUND(2002, "Topic does not exist"),
    DATASET_NOT_FOUND(2003, "Dataset does not exist"),
    DATASET_MESSAGE_DETAILS_NOT_FOUND(2004, "Dataset message configuration not found"),
    NO_BROKERS_DEFINED(2005, "No broker defined"),
    NO_TOPICS_DEFINED(2006, "No topic defined"),

    // Conflicts (3xxx)
    BROKER_ALREADY_EXISTS(3001, "Broker already exists"),
    TOPIC_ALREADY_EXISTS(3002, "Topic already exists for this broker"),

    // Stream empty (4xxx)
    NO_MESSAGES_FOUND(4001, "No messages found in the stream window"),

    // Transport and payload (5xxx)
    BROKER_UNREACHABLE(5001, "Unable to reach message broker"),
    STREAM_READ_FAILED(5002, "Failed to read from message broker"),
    MESSAGE_DECODE_FAILED(5003, "Failed to decode message payload"),

    // Metadata store (6xxx)
    METADATA_STORE_ERROR(6001, "Metadata store operation failed"),

    // Unknown errors
    UNKNOWN_ERROR(9999, "Unknown error occurred");

    private final int code;
    private final String message;

    ErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
