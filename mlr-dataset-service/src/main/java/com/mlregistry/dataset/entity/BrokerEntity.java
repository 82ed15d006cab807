package com.mlregistry.dataset.entity;

import com.mlregistry.dataset.dto.BrokerResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.persistence.*;
import java.time.LocalDateTime;

/**
 * JPA Entity for a registered message broker endpoint
 */
@Entity
@Table(name = "broker_details")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrokerEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "broker_name", nullable = false, unique = true)
    private String brokerName;

    @Column(name = "broker_ip", nullable = false)
    private String brokerIp;

    @Column(name = "broker_port", nullable = false)
    private Integer brokerPort;

    @Column(name = "creation_date", nullable = false)
    private LocalDateTime creationDate;

    @PrePersist
    protected void onCreate() {
        if (creationDate == null) {
            creationDate = LocalDateTime.now();
        }
    }

    public BrokerResponse toResponse() {
        return BrokerResponse.builder()
                .id(id)
                .brokerName(brokerName)
                .brokerIp(brokerIp)
                .brokerPort(brokerPort)
                .creationDate(creationDate)
                .build();
    }
}
