package com.mlregistry.dataset.repository;

import com.mlregistry.dataset.entity.TopicEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for Topic entities
 */
@Repository
public interface TopicRepository extends JpaRepository<TopicEntity, Long> {

    Optional<TopicEntity> findByTopicNameAndBrokerId(String topicName, Long brokerId);

    List<TopicEntity> findByBrokerId(Long brokerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM TopicEntity t WHERE t.brokerId = :brokerId")
    int deleteByBrokerId(@Param("brokerId") Long brokerId);
}
