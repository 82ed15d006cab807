package com.mlregistry.dataset.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.mlregistry.common.exception.ErrorCode;
import com.mlregistry.common.exception.NoMessagesFoundException;
import com.mlregistry.common.exception.RequestValidationException;
import com.mlregistry.common.exception.StreamTransportException;
import com.mlregistry.dataset.config.StreamReaderProperties;
import com.mlregistry.dataset.dto.DatasetTopicDataResponse;
import com.mlregistry.dataset.dto.StreamCoordinates;
import com.mlregistry.dataset.stream.OffsetPolicy;
import com.mlregistry.dataset.stream.StreamConsumerFactory;
import com.mlregistry.dataset.stream.StreamRecordDecoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Reads a bounded, time-boxed window of live messages from a dataset's topic.
 *
 * <p>Every call opens its own consumer session with a throwaway group id and closes it
 * before returning, whether the read succeeds, comes back empty or fails. Sessions are
 * never pooled and offsets are never committed. Transport failures are not retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StreamReaderService {

    private final DatasetTopicLinkService datasetTopicLinkService;
    private final StreamConsumerFactory consumerFactory;
    private final StreamRecordDecoder recordDecoder;
    private final StreamReaderProperties properties;

    /**
     * @param maxRecords upper bound on returned records, or null for the configured default
     * @param offsetPolicy where the fresh subscription starts, or null for latest
     * @throws NoMessagesFoundException when the window closes without a record
     * @throws StreamTransportException when the broker cannot be reached or read
     */
    public DatasetTopicDataResponse fetchStreamWindow(Long datasetId, Integer maxRecords, OffsetPolicy offsetPolicy) {
        int limit = resolveMaxRecords(maxRecords);
        OffsetPolicy policy = offsetPolicy != null ? offsetPolicy : OffsetPolicy.LATEST;
        StreamCoordinates coordinates = datasetTopicLinkService.resolveStreamCoordinates(datasetId);
        String topic = coordinates.getTopicName();

        log.debug("Reading up to {} records from topic {} at {} for dataset {} (offsetPolicy={})",
                limit, topic, coordinates.getBootstrapServers(), datasetId, policy.getValue());

        List<JsonNode> records;
        try (Consumer<byte[], byte[]> consumer = openSession(coordinates, policy, limit)) {
            ensureTopicAvailable(consumer, coordinates);
            consumer.subscribe(Collections.singletonList(topic));
            records = pollWindow(consumer, limit);
        } catch (KafkaException e) {
            log.error("Stream read from topic {} at {} failed: {}",
                    topic, coordinates.getBootstrapServers(), e.getMessage(), e);
            throw new StreamTransportException(ErrorCode.STREAM_READ_FAILED,
                    "Failed to read from topic " + topic + " at " + coordinates.getBootstrapServers(), e);
        }

        if (records.isEmpty()) {
            log.info("No messages on topic {} for dataset {} within {} ms",
                    topic, datasetId, properties.getPollTimeoutMs());
            throw new NoMessagesFoundException("No messages received from topic " + topic
                    + " within " + properties.getPollTimeoutMs() + " ms");
        }

        log.debug("Read {} records from topic {} for dataset {}", records.size(), topic, datasetId);
        return DatasetTopicDataResponse.builder()
                .datasetId(datasetId)
                .records(records)
                .recordCount(records.size())
                .topicName(topic)
                .build();
    }

    int resolveMaxRecords(Integer maxRecords) {
        if (maxRecords == null) {
            return properties.getDefaultMaxRecords();
        }
        if (maxRecords <= 0 || maxRecords > properties.getMaxRecordsLimit()) {
            throw new RequestValidationException(ErrorCode.INVALID_RECORD_COUNT,
                    "Invalid maxRecords " + maxRecords + ": must be between 1 and "
                            + properties.getMaxRecordsLimit());
        }
        return maxRecords;
    }

    private Consumer<byte[], byte[]> openSession(StreamCoordinates coordinates, OffsetPolicy policy, int limit) {
        try {
            return consumerFactory.createConsumer(coordinates, policy, limit);
        } catch (KafkaException e) {
            throw unreachable(coordinates, e);
        }
    }

    /**
     * The consumer reports an unreachable broker only as empty polls, so reachability is
     * confirmed up front by fetching the topic's partition metadata.
     */
    private void ensureTopicAvailable(Consumer<byte[], byte[]> consumer, StreamCoordinates coordinates) {
        List<PartitionInfo> partitions;
        try {
            partitions = consumer.partitionsFor(coordinates.getTopicName(), properties.getConnectTimeout());
        } catch (UnknownTopicOrPartitionException e) {
            partitions = Collections.emptyList();
        } catch (KafkaException e) {
            // includes the metadata timeout
            throw unreachable(coordinates, e);
        }

        if (partitions == null || partitions.isEmpty()) {
            log.warn("Topic {} does not exist on broker {}",
                    coordinates.getTopicName(), coordinates.getBootstrapServers());
            throw new NoMessagesFoundException("Topic " + coordinates.getTopicName()
                    + " has no partitions on broker " + coordinates.getBootstrapServers());
        }
    }

    private List<JsonNode> pollWindow(Consumer<byte[], byte[]> consumer, int limit) {
        List<JsonNode> records = new ArrayList<>();
        long deadline = System.nanoTime() + properties.getPollTimeout().toNanos();

        while (records.size() < limit) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                break;
            }

            ConsumerRecords<byte[], byte[]> batch = consumer.poll(Duration.ofMillis(remainingMs));
            if (batch.isEmpty()) {
                if (!records.isEmpty()) {
                    // stream drained, return what arrived
                    break;
                }
                continue;
            }

            for (ConsumerRecord<byte[], byte[]> record : batch) {
                if (records.size() >= limit) {
                    break;
                }
                recordDecoder.decode(record).ifPresent(records::add);
            }
        }
        return records;
    }

    private static StreamTransportException unreachable(StreamCoordinates coordinates, KafkaException e) {
        log.error("Broker {} unreachable for topic {}: {}",
                coordinates.getBootstrapServers(), coordinates.getTopicName(), e.getMessage());
        return new StreamTransportException(ErrorCode.BROKER_UNREACHABLE,
                "Unable to connect to broker " + coordinates.getBootstrapServers(), e);
    }
}
