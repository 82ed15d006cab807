package com.mlregistry.dataset.repository;

import com.mlregistry.dataset.entity.BrokerEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for Broker entities
 */
@Repository
public interface BrokerRepository extends JpaRepository<BrokerEntity, Long> {

    /**
     * Pre-check lookup used to report the id of a conflicting broker
     */
    Optional<BrokerEntity> findByBrokerName(String brokerName);
}
