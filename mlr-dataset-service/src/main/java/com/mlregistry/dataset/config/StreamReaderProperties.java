package com.mlregistry.dataset.config;

import com.mlregistry.common.constant.DatasetConstants;
import com.mlregistry.dataset.stream.DecodeFailurePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Operator settings for live stream reads.
 * The poll window is fixed per deployment; API callers cannot change it.
 */
@Configuration
@ConfigurationProperties(prefix = "mlr.stream")
@Data
public class StreamReaderProperties {

    private long pollTimeoutMs = DatasetConstants.STREAM_POLL_TIMEOUT_MS;

    // Bound on the reachability check that precedes polling
    private long connectTimeoutMs = DatasetConstants.BROKER_CONNECT_TIMEOUT_MS;

    private int requestTimeoutMs = 10000;

    private int defaultMaxRecords = DatasetConstants.DEFAULT_STREAM_RECORD_COUNT;

    private int maxRecordsLimit = DatasetConstants.MAX_STREAM_RECORD_COUNT;

    private String consumerGroupPrefix = "mlr-stream-reader-";

    private String clientId = "mlr-dataset-service";

    private DecodeFailurePolicy decodeFailurePolicy = DecodeFailurePolicy.FAIL_FAST;

    public Duration getPollTimeout() {
        return Duration.ofMillis(pollTimeoutMs);
    }

    public Duration getConnectTimeout() {
        return Duration.ofMillis(connectTimeoutMs);
    }
}
