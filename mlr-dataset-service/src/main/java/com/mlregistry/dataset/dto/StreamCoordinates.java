package com.mlregistry.dataset.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resolved connection parameters for reading a dataset's topic
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamCoordinates {

    private String topicName;
    private String brokerIp;
    private Integer brokerPort;

    /**
     * host:port in the form the broker client expects; IPv6 literals are bracketed.
     */
    public String getBootstrapServers() {
        String host = brokerIp.indexOf(':') >= 0 && !brokerIp.startsWith("[")
                ? "[" + brokerIp + "]"
                : brokerIp;
        return host + ":" + brokerPort;
    }
}
