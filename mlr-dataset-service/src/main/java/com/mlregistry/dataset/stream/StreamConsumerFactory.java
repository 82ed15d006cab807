package com.mlregistry.dataset.stream;

import com.mlregistry.dataset.dto.StreamCoordinates;
import org.apache.kafka.clients.consumer.Consumer;

/**
 * Opens a fresh, unshared consumer session for one stream read.
 * The caller owns the returned consumer and must close it.
 */
public interface StreamConsumerFactory {

    Consumer<byte[], byte[]> createConsumer(StreamCoordinates coordinates, OffsetPolicy offsetPolicy, int maxRecords);
}
