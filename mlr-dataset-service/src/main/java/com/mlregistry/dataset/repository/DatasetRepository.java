package com.mlregistry.dataset.repository;

import com.mlregistry.dataset.entity.DatasetEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for Dataset entities
 */
@Repository
public interface DatasetRepository extends JpaRepository<DatasetEntity, Long> {

    Optional<DatasetEntity> findByIdAndDataSourceType(Long id, Integer dataSourceType);
}
