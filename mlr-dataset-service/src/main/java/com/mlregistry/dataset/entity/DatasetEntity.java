package com.mlregistry.dataset.entity;

import com.mlregistry.dataset.dto.DatasetInfoDetails;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.persistence.*;
import java.time.LocalDateTime;

/**
 * JPA Entity for the dataset_info slice used by broker-sourced datasets
 */
@Entity
@Table(name = "dataset_info")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "dataset_name", nullable = false)
    private String datasetName;

    @Column(name = "description", length = 1024)
    private String description;

    @Column(name = "train_and_inference_type", nullable = false)
    private Integer trainAndInferenceType;

    @Column(name = "data_source_type", nullable = false)
    private Integer dataSourceType; // 0 file, 1 table, 2 broker

    @Column(name = "register_date_time", nullable = false)
    private LocalDateTime registerDateTime;

    @Column(name = "last_modified_time", nullable = false)
    private LocalDateTime lastModifiedTime;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (registerDateTime == null) {
            registerDateTime = now;
        }
        lastModifiedTime = now;
    }

    @PreUpdate
    protected void onUpdate() {
        lastModifiedTime = LocalDateTime.now();
    }

    public DatasetInfoDetails toDetails() {
        return DatasetInfoDetails.builder()
                .id(id)
                .datasetName(datasetName)
                .description(description)
                .datasetType(trainAndInferenceType)
                .dataSourceType(dataSourceType)
                .build();
    }
}
