package com.mlregistry.dataset.service;

import com.mlregistry.dataset.entity.BrokerEntity;
import com.mlregistry.dataset.entity.TopicEntity;
import com.mlregistry.dataset.repository.BrokerRepository;
import com.mlregistry.dataset.repository.TopicRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Finds the row that won a unique-key race.
 * Runs in its own transaction because the caller's persistence context is unusable after a constraint violation.
 */
@Component
@RequiredArgsConstructor
public class ExistingRowLookup {

    private final BrokerRepository brokerRepository;
    private final TopicRepository topicRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public Optional<Long> findBrokerId(String brokerName) {
        return brokerRepository.findByBrokerName(brokerName).map(BrokerEntity::getId);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public Optional<Long> findTopicId(String topicName, Long brokerId) {
        return topicRepository.findByTopicNameAndBrokerId(topicName, brokerId).map(TopicEntity::getId);
    }
}
