package com.mlregistry.dataset.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;

/**
 * Request DTO for registering a broker
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterBrokerRequest {

    @NotBlank(message = "name is required")
    private String name;

    @NotBlank(message = "ip is required")
    private String ip;

    @NotNull(message = "port is required")
    @Positive(message = "port must be greater than 0")
    private Integer port;
}
