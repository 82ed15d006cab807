package com.mlregistry.common.constant;

/**
 * Dataset and stream constants.
 */
public final class DatasetConstants {

    private DatasetConstants() {
        // Utility class - prevent instantiation
    }

    // Data source types (dataset_info.data_source_type)
    public static final int DATA_SOURCE_TYPE_FILE = 0;
    public static final int DATA_SOURCE_TYPE_TABLE = 1;
    public static final int DATA_SOURCE_TYPE_BROKER = 2;

    // Train / inference usage (dataset_info.train_and_inference_type)
    public static final int DATASET_TYPE_TRAIN = 0;
    public static final int DATASET_TYPE_INFERENCE = 1;
    public static final int DATASET_TYPE_BOTH = 2;

    // Stream reads
    public static final int DEFAULT_STREAM_RECORD_COUNT = 200;
    public static final long STREAM_POLL_TIMEOUT_MS = 10000L;     // 10 seconds
    public static final long BROKER_CONNECT_TIMEOUT_MS = 5000L;   // 5 seconds
    public static final int MAX_STREAM_RECORD_COUNT = 10000;

    // Offset policies
    public static final String OFFSET_EARLIEST = "earliest";
    public static final String OFFSET_LATEST = "latest";
}
