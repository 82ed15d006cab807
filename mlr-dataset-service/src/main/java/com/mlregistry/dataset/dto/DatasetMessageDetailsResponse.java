package com.mlregistry.dataset.dto;

import com.mlregistry.dataset.entity.BrokerEntity;
import com.mlregistry.dataset.entity.DatasetEntity;
import com.mlregistry.dataset.entity.TopicEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Composite view of a broker-sourced dataset with its broker and topic
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetMessageDetailsResponse {

    private DatasetInfoDetails dataset;
    private BrokerResponse brokerDetails;
    private TopicResponse topicDetails;

    /**
     * Shared by the register and fetch paths so both return the same shape.
     */
    public static DatasetMessageDetailsResponse of(DatasetEntity dataset, BrokerEntity broker, TopicEntity topic) {
        return DatasetMessageDetailsResponse.builder()
                .dataset(dataset.toDetails())
                .brokerDetails(broker.toResponse())
                .topicDetails(topic.toResponse())
                .build();
    }
}
