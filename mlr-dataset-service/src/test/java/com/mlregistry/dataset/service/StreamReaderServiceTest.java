package com.mlregistry.dataset.service;

import com.mlregistry.common.exception.ErrorCode;
import com.mlregistry.common.exception.MessageDecodeException;
import com.mlregistry.common.exception.NoMessagesFoundException;
import com.mlregistry.common.exception.RequestValidationException;
import com.mlregistry.common.exception.ResourceNotFoundException;
import com.mlregistry.common.exception.StreamTransportException;
import com.mlregistry.dataset.config.StreamReaderProperties;
import com.mlregistry.dataset.dto.DatasetTopicDataResponse;
import com.mlregistry.dataset.dto.StreamCoordinates;
import com.mlregistry.dataset.stream.DecodeFailurePolicy;
import com.mlregistry.dataset.stream.OffsetPolicy;
import com.mlregistry.dataset.stream.StreamConsumerFactory;
import com.mlregistry.dataset.stream.StreamRecordDecoder;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for StreamReaderService using Kafka's MockConsumer
 */
@ExtendWith(MockitoExtension.class)
public class StreamReaderServiceTest {

    private static final Long DATASET_ID = 5L;
    private static final String TOPIC = "telemetry";
    private static final TopicPartition PARTITION = new TopicPartition(TOPIC, 0);
    private static final StreamCoordinates COORDINATES = StreamCoordinates.builder()
            .topicName(TOPIC)
            .brokerIp("10.0.0.5")
            .brokerPort(9092)
            .build();

    @Mock
    private DatasetTopicLinkService datasetTopicLinkService;

    @Mock
    private StreamConsumerFactory consumerFactory;

    private StreamReaderProperties properties;
    private StreamReaderService streamReaderService;

    @BeforeEach
    void setUp() {
        properties = new StreamReaderProperties();
        properties.setPollTimeoutMs(300);
        properties.setConnectTimeoutMs(100);
        properties.setMaxRecordsLimit(1000);
        streamReaderService = new StreamReaderService(datasetTopicLinkService, consumerFactory,
                new StreamRecordDecoder(properties), properties);
    }

    @Test
    void testReadsAvailableRecords() {
        MockConsumer<byte[], byte[]> consumer = consumerWithRecords(
                "{\"temperature\": 21.5}", "{\"temperature\": 22.0}", "{\"temperature\": 22.4}");
        givenConsumer(consumer);

        DatasetTopicDataResponse response = streamReaderService.fetchStreamWindow(
                DATASET_ID, 10, OffsetPolicy.EARLIEST);

        assertEquals(DATASET_ID, response.getDatasetId());
        assertEquals(TOPIC, response.getTopicName());
        assertEquals(3, response.getRecordCount());
        assertEquals(3, response.getRecords().size());
        assertEquals(21.5, response.getRecords().get(0).get("temperature").asDouble());
        assertTrue(consumer.closed());
        assertEquals(Collections.singleton(TOPIC), consumer.subscription());
        verify(consumerFactory).createConsumer(COORDINATES, OffsetPolicy.EARLIEST, 10);
    }

    @Test
    void testStopsAtMaxRecords() {
        MockConsumer<byte[], byte[]> consumer = consumerWithRecords("{\"n\":1}", "{\"n\":2}", "{\"n\":3}",
                "{\"n\":4}", "{\"n\":5}");
        givenConsumer(consumer);

        DatasetTopicDataResponse response = streamReaderService.fetchStreamWindow(
                DATASET_ID, 2, OffsetPolicy.EARLIEST);

        assertEquals(2, response.getRecordCount());
        assertEquals(1, response.getRecords().get(0).get("n").asInt());
        assertEquals(2, response.getRecords().get(1).get("n").asInt());
        assertTrue(consumer.closed());
    }

    @Test
    void testDefaultsApplyWhenOmitted() {
        MockConsumer<byte[], byte[]> consumer = consumerWithRecords("{\"n\":1}");
        givenConsumer(consumer);

        streamReaderService.fetchStreamWindow(DATASET_ID, null, null);

        verify(consumerFactory).createConsumer(COORDINATES, OffsetPolicy.LATEST,
                properties.getDefaultMaxRecords());
    }

    @Test
    void testIdleTopicFailsWithNoMessagesFound() {
        MockConsumer<byte[], byte[]> consumer = consumerWithRecords();
        givenConsumer(consumer);

        NoMessagesFoundException ex = assertThrows(NoMessagesFoundException.class,
                () -> streamReaderService.fetchStreamWindow(DATASET_ID, 10, OffsetPolicy.LATEST));

        assertEquals(ErrorCode.NO_MESSAGES_FOUND, ex.getErrorCode());
        assertTrue(consumer.closed());
    }

    @Test
    void testUnknownTopicOnBrokerFailsWithNoMessagesFound() {
        MockConsumer<byte[], byte[]> consumer = new MockConsumer<>(OffsetResetStrategy.LATEST);
        givenConsumer(consumer);

        assertThrows(NoMessagesFoundException.class,
                () -> streamReaderService.fetchStreamWindow(DATASET_ID, 10, OffsetPolicy.LATEST));
        assertTrue(consumer.closed());
        assertTrue(consumer.subscription().isEmpty());
    }

    @Test
    void testUnreachableBrokerFailsWithTransportError() {
        MockConsumer<byte[], byte[]> consumer = new MockConsumer<byte[], byte[]>(OffsetResetStrategy.LATEST) {
            @Override
            public synchronized List<PartitionInfo> partitionsFor(String topic, Duration timeout) {
                throw new TimeoutException("Timeout expired while fetching topic metadata");
            }
        };
        givenConsumer(consumer);

        StreamTransportException ex = assertThrows(StreamTransportException.class,
                () -> streamReaderService.fetchStreamWindow(DATASET_ID, 10, OffsetPolicy.LATEST));

        assertEquals(ErrorCode.BROKER_UNREACHABLE, ex.getErrorCode());
        assertTrue(consumer.closed());
    }

    @Test
    void testConsumerCreationFailureIsTransportError() {
        when(datasetTopicLinkService.resolveStreamCoordinates(DATASET_ID)).thenReturn(COORDINATES);
        when(consumerFactory.createConsumer(any(), any(), anyInt()))
                .thenThrow(new KafkaException("Failed to construct kafka consumer"));

        StreamTransportException ex = assertThrows(StreamTransportException.class,
                () -> streamReaderService.fetchStreamWindow(DATASET_ID, 10, OffsetPolicy.LATEST));

        assertEquals(ErrorCode.BROKER_UNREACHABLE, ex.getErrorCode());
    }

    @Test
    void testPollFailureIsTransportErrorAndClosesSession() {
        MockConsumer<byte[], byte[]> consumer = consumerWithRecords();
        consumer.setPollException(new KafkaException("connection reset"));
        givenConsumer(consumer);

        StreamTransportException ex = assertThrows(StreamTransportException.class,
                () -> streamReaderService.fetchStreamWindow(DATASET_ID, 10, OffsetPolicy.EARLIEST));

        assertEquals(ErrorCode.STREAM_READ_FAILED, ex.getErrorCode());
        assertTrue(consumer.closed());
    }

    @Test
    void testUndecodableMessageFailsFastByDefault() {
        MockConsumer<byte[], byte[]> consumer = consumerWithRecords("{\"n\":1}", "not json");
        givenConsumer(consumer);

        MessageDecodeException ex = assertThrows(MessageDecodeException.class,
                () -> streamReaderService.fetchStreamWindow(DATASET_ID, 10, OffsetPolicy.EARLIEST));

        assertTrue(ex.getMessage().contains("telemetry-0@1"));
        assertTrue(consumer.closed());
    }

    @Test
    void testUndecodableMessageSkippedWhenConfigured() {
        properties.setDecodeFailurePolicy(DecodeFailurePolicy.SKIP);
        MockConsumer<byte[], byte[]> consumer = consumerWithRecords("{\"n\":1}", "not json", "", "{\"n\":3}");
        givenConsumer(consumer);

        DatasetTopicDataResponse response = streamReaderService.fetchStreamWindow(
                DATASET_ID, 10, OffsetPolicy.EARLIEST);

        assertEquals(2, response.getRecordCount());
        assertEquals(3, response.getRecords().get(1).get("n").asInt());
        assertTrue(consumer.closed());
    }

    @Test
    void testUnresolvedDatasetNeverOpensSession() {
        when(datasetTopicLinkService.resolveStreamCoordinates(DATASET_ID))
                .thenThrow(new ResourceNotFoundException(ErrorCode.DATASET_MESSAGE_DETAILS_NOT_FOUND, "missing"));

        assertThrows(ResourceNotFoundException.class,
                () -> streamReaderService.fetchStreamWindow(DATASET_ID, 10, OffsetPolicy.LATEST));
        verify(consumerFactory, never()).createConsumer(any(), any(), anyInt());
    }

    @Test
    void testInvalidMaxRecordsRejectedBeforeResolving() {
        RequestValidationException zero = assertThrows(RequestValidationException.class,
                () -> streamReaderService.fetchStreamWindow(DATASET_ID, 0, OffsetPolicy.LATEST));
        RequestValidationException tooMany = assertThrows(RequestValidationException.class,
                () -> streamReaderService.fetchStreamWindow(DATASET_ID, 1001, OffsetPolicy.LATEST));

        assertEquals(ErrorCode.INVALID_RECORD_COUNT, zero.getErrorCode());
        assertEquals(ErrorCode.INVALID_RECORD_COUNT, tooMany.getErrorCode());
        verify(datasetTopicLinkService, never()).resolveStreamCoordinates(eq(DATASET_ID));
    }

    private void givenConsumer(MockConsumer<byte[], byte[]> consumer) {
        when(datasetTopicLinkService.resolveStreamCoordinates(DATASET_ID)).thenReturn(COORDINATES);
        when(consumerFactory.createConsumer(any(), any(), anyInt())).thenReturn(consumer);
    }

    /**
     * A consumer for a one-partition topic that delivers the given payloads on its first poll.
     */
    private static MockConsumer<byte[], byte[]> consumerWithRecords(String... payloads) {
        MockConsumer<byte[], byte[]> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        consumer.updatePartitions(TOPIC,
                Collections.singletonList(new PartitionInfo(TOPIC, 0, null, null, null)));
        consumer.updateBeginningOffsets(Collections.singletonMap(PARTITION, 0L));
        consumer.schedulePollTask(() -> {
            consumer.rebalance(Collections.singletonList(PARTITION));
            long offset = 0;
            for (String payload : payloads) {
                consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, offset++, null,
                        payload.getBytes(StandardCharsets.UTF_8)));
            }
        });
        return consumer;
    }
}
