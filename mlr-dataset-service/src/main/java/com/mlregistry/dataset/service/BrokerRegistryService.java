package com.mlregistry.dataset.service;

import com.mlregistry.common.exception.ErrorCode;
import com.mlregistry.common.exception.MetadataStoreException;
import com.mlregistry.common.exception.RegistryException;
import com.mlregistry.common.exception.RequestValidationException;
import com.mlregistry.common.exception.ResourceConflictException;
import com.mlregistry.common.exception.ResourceNotFoundException;
import com.mlregistry.dataset.dto.BrokerResponse;
import com.mlregistry.dataset.dto.RegisterBrokerRequest;
import com.mlregistry.dataset.dto.UpdateBrokerRequest;
import com.mlregistry.dataset.entity.BrokerEntity;
import com.mlregistry.dataset.entity.TopicEntity;
import com.mlregistry.dataset.repository.BrokerRepository;
import com.mlregistry.dataset.repository.DatasetTopicRepository;
import com.mlregistry.dataset.repository.TopicRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Registry of reachable message-broker endpoints.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BrokerRegistryService {

    private final BrokerRepository brokerRepository;
    private final TopicRepository topicRepository;
    private final DatasetTopicRepository datasetTopicRepository;
    private final ExistingRowLookup existingRowLookup;

    /**
     * Register a broker. Names are unique; a duplicate reports the existing broker's id.
     */
    @Transactional
    public BrokerResponse register(RegisterBrokerRequest request) {
        String name = requireName(request.getName());
        String address = BrokerAddressValidator.validateAddress(request.getIp());
        int port = BrokerAddressValidator.validatePort(request.getPort());

        try {
            ensureNameAvailable(name, null);

            BrokerEntity saved = brokerRepository.saveAndFlush(BrokerEntity.builder()
                    .brokerName(name)
                    .brokerIp(address)
                    .brokerPort(port)
                    .build());

            log.info("Registered broker id={} name={} at {}:{}", saved.getId(), name, address, port);
            return saved.toResponse();
        } catch (DataIntegrityViolationException e) {
            throw lostNameRace(name, null, e);
        } catch (DataAccessException e) {
            throw storeFailure("register broker " + name, e);
        }
    }

    /**
     * Apply the supplied fields of a partial update.
     */
    @Transactional
    public BrokerResponse update(Long brokerId, UpdateBrokerRequest request) {
        String name = request.getName() == null ? null : requireName(request.getName());
        try {
            BrokerEntity broker = findBroker(brokerId);

            if (name != null) {
                ensureNameAvailable(name, brokerId);
                broker.setBrokerName(name);
            }
            if (request.getIp() != null) {
                broker.setBrokerIp(BrokerAddressValidator.validateAddress(request.getIp()));
            }
            if (request.getPort() != null) {
                broker.setBrokerPort(BrokerAddressValidator.validatePort(request.getPort()));
            }

            BrokerEntity saved = brokerRepository.saveAndFlush(broker);
            log.info("Updated broker id={}", brokerId);
            return saved.toResponse();
        } catch (DataIntegrityViolationException e) {
            if (name == null) {
                throw storeFailure("update broker " + brokerId, e);
            }
            throw lostNameRace(name, brokerId, e);
        } catch (DataAccessException e) {
            throw storeFailure("update broker " + brokerId, e);
        }
    }

    /**
     * List all brokers. An empty registry is reported as not found.
     */
    @Transactional(readOnly = true)
    public List<BrokerResponse> list() {
        List<BrokerEntity> brokers;
        try {
            brokers = brokerRepository.findAll();
        } catch (DataAccessException e) {
            throw storeFailure("list brokers", e);
        }
        if (brokers.isEmpty()) {
            log.debug("No broker defined");
            throw new ResourceNotFoundException(ErrorCode.NO_BROKERS_DEFINED, "No broker defined");
        }
        return brokers.stream().map(BrokerEntity::toResponse).collect(Collectors.toList());
    }

    /**
     * Delete a broker together with its topics and every dataset link to those topics.
     */
    @Transactional
    public void delete(Long brokerId) {
        try {
            BrokerEntity broker = findBroker(brokerId);

            List<Long> topicIds = topicRepository.findByBrokerId(brokerId).stream()
                    .map(TopicEntity::getId)
                    .collect(Collectors.toList());
            int links = topicIds.isEmpty() ? 0 : datasetTopicRepository.deleteByTopicIdIn(topicIds);
            int topics = topicRepository.deleteByBrokerId(brokerId);
            brokerRepository.delete(broker);
            brokerRepository.flush();

            log.info("Deleted broker id={} with {} topics and {} dataset links", brokerId, topics, links);
        } catch (DataAccessException e) {
            throw storeFailure("delete broker " + brokerId, e);
        }
    }

    private BrokerEntity findBroker(Long brokerId) {
        return brokerRepository.findById(brokerId)
                .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.BROKER_NOT_FOUND,
                        "Broker not found for the id " + brokerId));
    }

    private void ensureNameAvailable(String name, Long selfId) {
        brokerRepository.findByBrokerName(name)
                .filter(existing -> !existing.getId().equals(selfId))
                .ifPresent(existing -> {
                    throw new ResourceConflictException(ErrorCode.BROKER_ALREADY_EXISTS,
                            "Broker id " + existing.getId() + " already exists with name " + name,
                            existing.getId());
                });
    }

    /**
     * A concurrent registration took the name after the pre-check passed.
     */
    private RegistryException lostNameRace(String name, Long selfId, DataIntegrityViolationException e) {
        Optional<Long> existingId;
        try {
            existingId = existingRowLookup.findBrokerId(name).filter(id -> !id.equals(selfId));
        } catch (DataAccessException lookupFailure) {
            lookupFailure.addSuppressed(e);
            return storeFailure("look up broker " + name, lookupFailure);
        }
        if (existingId.isEmpty()) {
            return storeFailure("save broker " + name, e);
        }
        log.warn("Broker name {} was taken concurrently by broker id {}", name, existingId.get());
        return new ResourceConflictException(ErrorCode.BROKER_ALREADY_EXISTS,
                "Broker id " + existingId.get() + " already exists with name " + name, existingId.get(), e);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new RequestValidationException(ErrorCode.INVALID_REQUEST, "Broker name is required");
        }
        return name.trim();
    }

    private static MetadataStoreException storeFailure(String operation, DataAccessException e) {
        log.error("Metadata store failure during {}: {}", operation, e.getMessage(), e);
        return new MetadataStoreException(ErrorCode.METADATA_STORE_ERROR, "Unable to " + operation, e);
    }
}
