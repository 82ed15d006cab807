package com.mlregistry.dataset.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Window of decoded records read from a dataset's topic
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetTopicDataResponse {

    private Long datasetId;
    private List<JsonNode> records;
    private Integer recordCount;
    private String topicName;
}
