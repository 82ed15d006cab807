package com.mlregistry.dataset.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;

/**
 * Request DTO for registering a broker-sourced dataset linked to a topic
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterDatasetMessageRequest {

    @NotBlank(message = "name is required")
    private String name;

    private String description;

    // 0 train, 1 inference, 2 both
    @NotNull(message = "datasetType is required")
    private Integer datasetType;

    @NotNull(message = "brokerId is required")
    @Positive(message = "brokerId must be greater than 0")
    private Long brokerId;

    @NotNull(message = "topicId is required")
    @Positive(message = "topicId must be greater than 0")
    private Long topicId;
}
