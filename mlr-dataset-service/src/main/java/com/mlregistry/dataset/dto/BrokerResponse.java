package com.mlregistry.dataset.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Response DTO for broker information
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrokerResponse {

    private Long id;
    private String brokerName;
    private String brokerIp;
    private Integer brokerPort;
    private LocalDateTime creationDate;
}
