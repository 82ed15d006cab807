package com.mlregistry.dataset.stream;

/**
 * What a stream read does with a message whose payload cannot be decoded.
 */
public enum DecodeFailurePolicy {

    /** Abort the read with a decode error on the first bad message. */
    FAIL_FAST,

    /** Log the bad message and keep collecting. */
    SKIP
}
