package com.mlregistry.dataset.repository;

import com.mlregistry.common.constant.DatasetConstants;
import com.mlregistry.dataset.dto.DatasetMessageRow;
import com.mlregistry.dataset.dto.StreamCoordinates;
import com.mlregistry.dataset.entity.DatasetTopicEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for dataset-topic links and the dataset -> link -> topic -> broker join.
 * The joins only see broker-sourced datasets.
 */
@Repository
public interface DatasetTopicRepository extends JpaRepository<DatasetTopicEntity, Long> {

    List<DatasetTopicEntity> findByDatasetId(Long datasetId);

    @Query("SELECT new com.mlregistry.dataset.dto.DatasetMessageRow(d, b, t) "
            + "FROM DatasetEntity d, DatasetTopicEntity l, TopicEntity t, BrokerEntity b "
            + "WHERE l.datasetId = d.id AND l.topicId = t.id AND t.brokerId = b.id "
            + "AND d.id = :datasetId AND d.dataSourceType = " + DatasetConstants.DATA_SOURCE_TYPE_BROKER
            + " ORDER BY l.id")
    List<DatasetMessageRow> findMessageDetailsByDatasetId(@Param("datasetId") Long datasetId);

    @Query("SELECT new com.mlregistry.dataset.dto.StreamCoordinates(t.topicName, b.brokerIp, b.brokerPort) "
            + "FROM DatasetEntity d, DatasetTopicEntity l, TopicEntity t, BrokerEntity b "
            + "WHERE l.datasetId = d.id AND l.topicId = t.id AND t.brokerId = b.id "
            + "AND d.id = :datasetId AND d.dataSourceType = " + DatasetConstants.DATA_SOURCE_TYPE_BROKER
            + " ORDER BY l.id")
    List<StreamCoordinates> findStreamCoordinatesByDatasetId(@Param("datasetId") Long datasetId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM DatasetTopicEntity l WHERE l.topicId IN :topicIds")
    int deleteByTopicIdIn(@Param("topicIds") Collection<Long> topicIds);
}
