package com.mlregistry.dataset.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dataset fields exposed in the composite message view
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetInfoDetails {

    private Long id;
    private String datasetName;
    private String description;
    private Integer datasetType;
    private Integer dataSourceType;
}
