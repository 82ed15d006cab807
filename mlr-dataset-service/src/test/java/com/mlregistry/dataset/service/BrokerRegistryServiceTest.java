package com.mlregistry.dataset.service;

import com.mlregistry.common.constant.DatasetConstants;
import com.mlregistry.common.exception.ErrorCode;
import com.mlregistry.common.exception.RequestValidationException;
import com.mlregistry.common.exception.ResourceConflictException;
import com.mlregistry.common.exception.ResourceNotFoundException;
import com.mlregistry.dataset.dto.BrokerResponse;
import com.mlregistry.dataset.dto.RegisterBrokerRequest;
import com.mlregistry.dataset.dto.UpdateBrokerRequest;
import com.mlregistry.dataset.entity.DatasetEntity;
import com.mlregistry.dataset.entity.DatasetTopicEntity;
import com.mlregistry.dataset.entity.TopicEntity;
import com.mlregistry.dataset.repository.BrokerRepository;
import com.mlregistry.dataset.repository.DatasetRepository;
import com.mlregistry.dataset.repository.DatasetTopicRepository;
import com.mlregistry.dataset.repository.TopicRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BrokerRegistryService against the embedded store
 */
@DataJpaTest
@Import({BrokerRegistryService.class, ExistingRowLookup.class})
public class BrokerRegistryServiceTest {

    @Autowired
    private BrokerRegistryService brokerRegistryService;

    @Autowired
    private BrokerRepository brokerRepository;

    @Autowired
    private TopicRepository topicRepository;

    @Autowired
    private DatasetRepository datasetRepository;

    @Autowired
    private DatasetTopicRepository datasetTopicRepository;

    @Test
    void testRegisterBroker() {
        BrokerResponse broker = brokerRegistryService.register(request("kafka-a", "10.0.0.5", 9092));

        assertNotNull(broker.getId());
        assertEquals("kafka-a", broker.getBrokerName());
        assertEquals("10.0.0.5", broker.getBrokerIp());
        assertEquals(9092, broker.getBrokerPort());
        assertNotNull(broker.getCreationDate());
    }

    @Test
    void testRegisterBrokerWithIpv6Address() {
        BrokerResponse broker = brokerRegistryService.register(request("kafka-v6", "FE80::1", 9092));

        assertEquals("fe80::1", broker.getBrokerIp());
    }

    @ParameterizedTest
    @ValueSource(strings = {"999.1.1.1", "10.0.0", "localhost", "kafka.internal", "1.2.3.04", "::g", "[::1]",
            ".:1", "..::1"})
    void testRegisterBrokerRejectsInvalidAddress(String address) {
        RequestValidationException ex = assertThrows(RequestValidationException.class,
                () -> brokerRegistryService.register(request("kafka-bad", address, 9092)));

        assertEquals(ErrorCode.INVALID_BROKER_ADDRESS, ex.getErrorCode());
        assertEquals(0, brokerRepository.count());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -9092})
    void testRegisterBrokerRejectsNonPositivePort(int port) {
        RequestValidationException ex = assertThrows(RequestValidationException.class,
                () -> brokerRegistryService.register(request("kafka-bad", "10.0.0.5", port)));

        assertEquals(ErrorCode.INVALID_BROKER_PORT, ex.getErrorCode());
        assertEquals(0, brokerRepository.count());
    }

    @Test
    void testDuplicateNameReportsExistingId() {
        BrokerResponse first = brokerRegistryService.register(request("kafka-a", "10.0.0.5", 9092));

        ResourceConflictException ex = assertThrows(ResourceConflictException.class,
                () -> brokerRegistryService.register(request("kafka-a", "10.0.0.6", 9093)));

        assertEquals(ErrorCode.BROKER_ALREADY_EXISTS, ex.getErrorCode());
        assertEquals(first.getId(), ex.getExistingId());
        assertEquals(1, brokerRepository.count());
    }

    @Test
    void testPartialUpdate() {
        BrokerResponse broker = brokerRegistryService.register(request("kafka-a", "10.0.0.5", 9092));

        BrokerResponse updated = brokerRegistryService.update(broker.getId(),
                UpdateBrokerRequest.builder().port(19092).build());

        assertEquals("kafka-a", updated.getBrokerName());
        assertEquals("10.0.0.5", updated.getBrokerIp());
        assertEquals(19092, updated.getBrokerPort());
    }

    @Test
    void testUpdateToOwnNameIsNotAConflict() {
        BrokerResponse broker = brokerRegistryService.register(request("kafka-a", "10.0.0.5", 9092));

        BrokerResponse updated = brokerRegistryService.update(broker.getId(),
                UpdateBrokerRequest.builder().name("kafka-a").ip("10.0.0.9").build());

        assertEquals("10.0.0.9", updated.getBrokerIp());
    }

    @Test
    void testUpdateToTakenNameConflicts() {
        BrokerResponse first = brokerRegistryService.register(request("kafka-a", "10.0.0.5", 9092));
        BrokerResponse second = brokerRegistryService.register(request("kafka-b", "10.0.0.6", 9092));

        ResourceConflictException ex = assertThrows(ResourceConflictException.class,
                () -> brokerRegistryService.update(second.getId(),
                        UpdateBrokerRequest.builder().name("kafka-a").build()));

        assertEquals(first.getId(), ex.getExistingId());
    }

    @Test
    void testUpdateValidatesAddress() {
        BrokerResponse broker = brokerRegistryService.register(request("kafka-a", "10.0.0.5", 9092));

        assertThrows(RequestValidationException.class, () -> brokerRegistryService.update(broker.getId(),
                UpdateBrokerRequest.builder().ip("not-an-ip").build()));
    }

    @Test
    void testUpdateMissingBroker() {
        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> brokerRegistryService.update(404L, UpdateBrokerRequest.builder().port(1).build()));

        assertEquals(ErrorCode.BROKER_NOT_FOUND, ex.getErrorCode());
    }

    @Test
    void testListEmptyRegistry() {
        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> brokerRegistryService.list());

        assertEquals(ErrorCode.NO_BROKERS_DEFINED, ex.getErrorCode());
    }

    @Test
    void testListBrokers() {
        brokerRegistryService.register(request("kafka-a", "10.0.0.5", 9092));
        brokerRegistryService.register(request("kafka-b", "10.0.0.6", 9092));

        List<BrokerResponse> brokers = brokerRegistryService.list();

        assertEquals(2, brokers.size());
    }

    @Test
    void testDeleteCascadesToTopicsAndLinks() {
        BrokerResponse broker = brokerRegistryService.register(request("kafka-a", "10.0.0.5", 9092));
        BrokerResponse other = brokerRegistryService.register(request("kafka-b", "10.0.0.6", 9092));
        TopicEntity telemetry = topicRepository.saveAndFlush(
                TopicEntity.builder().topicName("telemetry").brokerId(broker.getId()).build());
        TopicEntity metrics = topicRepository.saveAndFlush(
                TopicEntity.builder().topicName("metrics").brokerId(broker.getId()).build());
        TopicEntity unrelated = topicRepository.saveAndFlush(
                TopicEntity.builder().topicName("telemetry").brokerId(other.getId()).build());
        DatasetEntity dataset = datasetRepository.saveAndFlush(DatasetEntity.builder()
                .datasetName("sensor-ds")
                .trainAndInferenceType(DatasetConstants.DATASET_TYPE_TRAIN)
                .dataSourceType(DatasetConstants.DATA_SOURCE_TYPE_BROKER)
                .build());
        datasetTopicRepository.saveAndFlush(DatasetTopicEntity.builder()
                .datasetId(dataset.getId()).topicId(telemetry.getId()).build());

        brokerRegistryService.delete(broker.getId());

        assertFalse(brokerRepository.existsById(broker.getId()));
        assertFalse(topicRepository.existsById(telemetry.getId()));
        assertFalse(topicRepository.existsById(metrics.getId()));
        assertTrue(topicRepository.existsById(unrelated.getId()));
        assertTrue(datasetTopicRepository.findByDatasetId(dataset.getId()).isEmpty());
    }

    @Test
    void testDeleteBrokerWithoutTopics() {
        BrokerResponse broker = brokerRegistryService.register(request("kafka-a", "10.0.0.5", 9092));

        brokerRegistryService.delete(broker.getId());

        assertEquals(0, brokerRepository.count());
    }

    @Test
    void testDeleteMissingBroker() {
        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> brokerRegistryService.delete(404L));

        assertEquals(ErrorCode.BROKER_NOT_FOUND, ex.getErrorCode());
    }

    private static RegisterBrokerRequest request(String name, String ip, int port) {
        return RegisterBrokerRequest.builder().name(name).ip(ip).port(port).build();
    }
}
