package com.mlregistry.dataset.stream;

import com.mlregistry.common.constant.DatasetConstants;
import com.mlregistry.common.exception.ErrorCode;
import com.mlregistry.common.exception.RequestValidationException;

/**
 * Where a fresh subscription starts reading: the oldest retained message or only new ones.
 */
public enum OffsetPolicy {

    EARLIEST(DatasetConstants.OFFSET_EARLIEST),
    LATEST(DatasetConstants.OFFSET_LATEST);

    private final String value;

    OffsetPolicy(String value) {
        this.value = value;
    }

    /**
     * Value of the broker client's auto.offset.reset setting.
     */
    public String getValue() {
        return value;
    }

    public static OffsetPolicy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return LATEST;
        }
        for (OffsetPolicy policy : values()) {
            if (policy.value.equalsIgnoreCase(value.trim())) {
                return policy;
            }
        }
        throw new RequestValidationException(ErrorCode.INVALID_OFFSET_POLICY,
                "Invalid offset policy '" + value + "': must be 'earliest' or 'latest'");
    }
}
