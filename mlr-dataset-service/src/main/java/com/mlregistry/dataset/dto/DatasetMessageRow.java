package com.mlregistry.dataset.dto;

import com.mlregistry.dataset.entity.BrokerEntity;
import com.mlregistry.dataset.entity.DatasetEntity;
import com.mlregistry.dataset.entity.TopicEntity;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One row of the dataset -> link -> topic -> broker join
 */
@Data
@AllArgsConstructor
public class DatasetMessageRow {

    private DatasetEntity dataset;
    private BrokerEntity broker;
    private TopicEntity topic;

    public DatasetMessageDetailsResponse toResponse() {
        return DatasetMessageDetailsResponse.of(dataset, broker, topic);
    }
}
