package com.mlregistry.dataset.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.util.Map;

/**
 * Request DTO for registering a topic under a broker
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterTopicRequest {

    @NotBlank(message = "name is required")
    private String name;

    @NotNull(message = "schema is required")
    private Map<String, Object> schema;
}
