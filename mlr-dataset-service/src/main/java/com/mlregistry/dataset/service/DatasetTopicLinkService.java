package com.mlregistry.dataset.service;

import com.mlregistry.common.constant.DatasetConstants;
import com.mlregistry.common.exception.ErrorCode;
import com.mlregistry.common.exception.MetadataStoreException;
import com.mlregistry.common.exception.RequestValidationException;
import com.mlregistry.common.exception.ResourceNotFoundException;
import com.mlregistry.dataset.dto.DatasetMessageDetailsResponse;
import com.mlregistry.dataset.dto.DatasetMessageRow;
import com.mlregistry.dataset.dto.RegisterDatasetMessageRequest;
import com.mlregistry.dataset.dto.StreamCoordinates;
import com.mlregistry.dataset.entity.BrokerEntity;
import com.mlregistry.dataset.entity.DatasetEntity;
import com.mlregistry.dataset.entity.DatasetTopicEntity;
import com.mlregistry.dataset.entity.TopicEntity;
import com.mlregistry.dataset.repository.BrokerRepository;
import com.mlregistry.dataset.repository.DatasetRepository;
import com.mlregistry.dataset.repository.DatasetTopicRepository;
import com.mlregistry.dataset.repository.TopicRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Links broker-sourced datasets to a topic and assembles the dataset/broker/topic view.
 *
 * <p>The dataset row and its link row are written and removed together in one
 * transaction, so a dataset without a link is never visible to other readers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetTopicLinkService {

    private final DatasetRepository datasetRepository;
    private final DatasetTopicRepository datasetTopicRepository;
    private final BrokerRepository brokerRepository;
    private final TopicRepository topicRepository;

    @Transactional
    public DatasetMessageDetailsResponse registerDatasetMessageDetails(RegisterDatasetMessageRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new RequestValidationException(ErrorCode.INVALID_REQUEST, "Dataset name is required");
        }
        validateDatasetType(request.getDatasetType());

        try {
            BrokerEntity broker = brokerRepository.findById(request.getBrokerId())
                    .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.BROKER_NOT_FOUND,
                            "Broker not found for the id " + request.getBrokerId()));
            TopicEntity topic = topicRepository.findById(request.getTopicId())
                    .filter(t -> t.getBrokerId().equals(broker.getId()))
                    .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.TOPIC_NOT_FOUND,
                            "Topic " + request.getTopicId() + " not found on broker " + broker.getId()));

            // flush so the dataset has its identity before the link references it
            DatasetEntity dataset = datasetRepository.saveAndFlush(DatasetEntity.builder()
                    .datasetName(request.getName().trim())
                    .description(request.getDescription())
                    .trainAndInferenceType(request.getDatasetType())
                    .dataSourceType(DatasetConstants.DATA_SOURCE_TYPE_BROKER)
                    .build());

            datasetTopicRepository.save(DatasetTopicEntity.builder()
                    .datasetId(dataset.getId())
                    .topicId(topic.getId())
                    .build());
            datasetTopicRepository.flush();

            log.info("Registered dataset id={} name={} on topic {} of broker {}",
                    dataset.getId(), dataset.getDatasetName(), topic.getTopicName(), broker.getBrokerName());
            return DatasetMessageDetailsResponse.of(dataset, broker, topic);
        } catch (DataIntegrityViolationException e) {
            // the topic or its broker was deleted between the lookup and the link insert
            throw new ResourceNotFoundException(ErrorCode.TOPIC_NOT_FOUND,
                    "Topic " + request.getTopicId() + " was removed while registering dataset " + request.getName(), e);
        } catch (DataAccessException e) {
            log.error("Failed to register dataset {}: {}", request.getName(), e.getMessage(), e);
            throw new MetadataStoreException(ErrorCode.METADATA_STORE_ERROR,
                    "Unable to register dataset " + request.getName(), e);
        }
    }

    /**
     * Any missing hop in dataset, link, topic or broker is reported the same way.
     */
    @Transactional(readOnly = true)
    public DatasetMessageDetailsResponse fetchDatasetMessageDetails(Long datasetId) {
        return firstRow(datasetId).toResponse();
    }

    /**
     * Remove a broker-sourced dataset and its link. File and table datasets are not visible here.
     */
    @Transactional
    public void deregister(Long datasetId) {
        try {
            DatasetEntity dataset = datasetRepository
                    .findByIdAndDataSourceType(datasetId, DatasetConstants.DATA_SOURCE_TYPE_BROKER)
                    .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.DATASET_NOT_FOUND,
                            "Dataset not found for the id " + datasetId));

            List<DatasetTopicEntity> links = datasetTopicRepository.findByDatasetId(datasetId);
            datasetTopicRepository.deleteAll(links);
            datasetTopicRepository.flush();
            datasetRepository.delete(dataset);
            datasetRepository.flush();

            log.info("Deregistered dataset id={} with {} topic links", datasetId, links.size());
        } catch (DataAccessException e) {
            log.error("Failed to deregister dataset {}: {}", datasetId, e.getMessage(), e);
            throw new MetadataStoreException(ErrorCode.METADATA_STORE_ERROR,
                    "Unable to deregister dataset " + datasetId, e);
        }
    }

    /**
     * Topic name and broker endpoint a stream read for this dataset should use.
     */
    @Transactional(readOnly = true)
    public StreamCoordinates resolveStreamCoordinates(Long datasetId) {
        List<StreamCoordinates> coordinates;
        try {
            coordinates = datasetTopicRepository.findStreamCoordinatesByDatasetId(datasetId);
        } catch (DataAccessException e) {
            throw new MetadataStoreException(ErrorCode.METADATA_STORE_ERROR,
                    "Unable to resolve stream for dataset " + datasetId, e);
        }
        if (coordinates.isEmpty()) {
            throw messageDetailsNotFound(datasetId);
        }
        if (coordinates.size() > 1) {
            log.warn("Dataset {} has {} topic links, reading the first", datasetId, coordinates.size());
        }
        return coordinates.get(0);
    }

    private DatasetMessageRow firstRow(Long datasetId) {
        List<DatasetMessageRow> rows;
        try {
            rows = datasetTopicRepository.findMessageDetailsByDatasetId(datasetId);
        } catch (DataAccessException e) {
            throw new MetadataStoreException(ErrorCode.METADATA_STORE_ERROR,
                    "Unable to fetch message details for dataset " + datasetId, e);
        }
        if (rows.isEmpty()) {
            throw messageDetailsNotFound(datasetId);
        }
        if (rows.size() > 1) {
            log.warn("Dataset {} has {} topic links, reporting the first", datasetId, rows.size());
        }
        return rows.get(0);
    }

    private static void validateDatasetType(Integer datasetType) {
        if (datasetType == null
                || datasetType < DatasetConstants.DATASET_TYPE_TRAIN
                || datasetType > DatasetConstants.DATASET_TYPE_BOTH) {
            throw new RequestValidationException(ErrorCode.INVALID_DATASET_TYPE,
                    "Invalid dataset type " + datasetType + ": must be 0 (train), 1 (inference) or 2 (both)");
        }
    }

    private static ResourceNotFoundException messageDetailsNotFound(Long datasetId) {
        return new ResourceNotFoundException(ErrorCode.DATASET_MESSAGE_DETAILS_NOT_FOUND,
                "Dataset message details not found for the id " + datasetId);
    }
}
