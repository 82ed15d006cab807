package com.mlregistry.dataset.service;

import com.mlregistry.common.exception.ErrorCode;
import com.mlregistry.common.exception.MetadataStoreException;
import com.mlregistry.common.exception.RegistryException;
import com.mlregistry.common.exception.RequestValidationException;
import com.mlregistry.common.exception.ResourceConflictException;
import com.mlregistry.common.exception.ResourceNotFoundException;
import com.mlregistry.dataset.dto.RegisterTopicRequest;
import com.mlregistry.dataset.dto.TopicResponse;
import com.mlregistry.dataset.dto.UpdateTopicRequest;
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

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Registry of topics hosted on registered brokers.
 * A topic name is unique within its broker only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TopicRegistryService {

    private final TopicRepository topicRepository;
    private final BrokerRepository brokerRepository;
    private final DatasetTopicRepository datasetTopicRepository;
    private final ExistingRowLookup existingRowLookup;

    @Transactional
    public TopicResponse register(Long brokerId, RegisterTopicRequest request) {
        String name = requireName(request.getName());

        try {
            if (!brokerRepository.existsById(brokerId)) {
                throw new ResourceNotFoundException(ErrorCode.BROKER_NOT_FOUND,
                        "Broker not found for the id " + brokerId);
            }
            ensureNameAvailable(name, brokerId, null);

            TopicEntity topic = TopicEntity.builder()
                    .topicName(name)
                    .brokerId(brokerId)
                    .build();
            topic.setTopicSchema(request.getSchema());
            TopicEntity saved = topicRepository.saveAndFlush(topic);

            log.info("Registered topic id={} name={} on broker {}", saved.getId(), name, brokerId);
            return saved.toResponse();
        } catch (DataIntegrityViolationException e) {
            throw lostNameRace(name, brokerId, null, e);
        } catch (DataAccessException e) {
            throw storeFailure("register topic " + name, e);
        }
    }

    /**
     * Rename a topic or replace its schema. The owning broker never changes.
     */
    @Transactional
    public TopicResponse update(Long topicId, UpdateTopicRequest request) {
        String name = request.getName() == null ? null : requireName(request.getName());
        Long brokerId = null;
        try {
            TopicEntity topic = findTopic(topicId);
            brokerId = topic.getBrokerId();

            if (name != null) {
                ensureNameAvailable(name, brokerId, topicId);
                topic.setTopicName(name);
            }
            if (request.getSchema() != null) {
                topic.setTopicSchema(request.getSchema());
            }

            TopicEntity saved = topicRepository.saveAndFlush(topic);
            log.info("Updated topic id={}", topicId);
            return saved.toResponse();
        } catch (DataIntegrityViolationException e) {
            if (name == null || brokerId == null) {
                throw storeFailure("update topic " + topicId, e);
            }
            throw lostNameRace(name, brokerId, topicId, e);
        } catch (DataAccessException e) {
            throw storeFailure("update topic " + topicId, e);
        }
    }

    @Transactional(readOnly = true)
    public List<TopicResponse> list() {
        List<TopicEntity> topics;
        try {
            topics = topicRepository.findAll();
        } catch (DataAccessException e) {
            throw storeFailure("list topics", e);
        }
        if (topics.isEmpty()) {
            throw new ResourceNotFoundException(ErrorCode.NO_TOPICS_DEFINED, "No topic defined");
        }
        return topics.stream().map(TopicEntity::toResponse).collect(Collectors.toList());
    }

    /**
     * Delete a topic after removing every dataset link that references it.
     */
    @Transactional
    public void delete(Long topicId) {
        try {
            TopicEntity topic = findTopic(topicId);

            int links = datasetTopicRepository.deleteByTopicIdIn(Collections.singletonList(topicId));
            topicRepository.delete(topic);
            topicRepository.flush();

            log.info("Deleted topic id={} and {} dataset links", topicId, links);
        } catch (DataAccessException e) {
            throw storeFailure("delete topic " + topicId, e);
        }
    }

    private TopicEntity findTopic(Long topicId) {
        return topicRepository.findById(topicId)
                .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.TOPIC_NOT_FOUND,
                        "Topic not found for the id " + topicId));
    }

    private void ensureNameAvailable(String name, Long brokerId, Long selfId) {
        topicRepository.findByTopicNameAndBrokerId(name, brokerId)
                .filter(existing -> !existing.getId().equals(selfId))
                .ifPresent(existing -> {
                    throw new ResourceConflictException(ErrorCode.TOPIC_ALREADY_EXISTS,
                            "Topic id " + existing.getId() + " already exists with name " + name
                                    + " on broker " + brokerId,
                            existing.getId());
                });
    }

    /**
     * A concurrent registration took the name on this broker after the pre-check passed.
     */
    private RegistryException lostNameRace(String name, Long brokerId, Long selfId,
                                           DataIntegrityViolationException e) {
        Optional<Long> existingId;
        try {
            existingId = existingRowLookup.findTopicId(name, brokerId).filter(id -> !id.equals(selfId));
        } catch (DataAccessException lookupFailure) {
            lookupFailure.addSuppressed(e);
            return storeFailure("look up topic " + name, lookupFailure);
        }
        if (existingId.isEmpty()) {
            return storeFailure("save topic " + name + " on broker " + brokerId, e);
        }
        log.warn("Topic name {} on broker {} was taken concurrently by topic id {}", name, brokerId, existingId.get());
        return new ResourceConflictException(ErrorCode.TOPIC_ALREADY_EXISTS,
                "Topic id " + existingId.get() + " already exists with name " + name + " on broker " + brokerId,
                existingId.get(), e);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new RequestValidationException(ErrorCode.INVALID_REQUEST, "Topic name is required");
        }
        return name.trim();
    }

    private static MetadataStoreException storeFailure(String operation, DataAccessException e) {
        log.error("Metadata store failure during {}: {}", operation, e.getMessage(), e);
        return new MetadataStoreException(ErrorCode.METADATA_STORE_ERROR, "Unable to " + operation, e);
    }
}
