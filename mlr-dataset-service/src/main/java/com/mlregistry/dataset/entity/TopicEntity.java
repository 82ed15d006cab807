package com.mlregistry.dataset.entity;

import com.mlregistry.common.util.JsonUtils;
import com.mlregistry.dataset.dto.TopicResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.persistence.*;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * JPA Entity for a topic hosted on a registered broker
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "topic_details",
        uniqueConstraints = @UniqueConstraint(name = "unique_topic_per_broker",
                columnNames = {"topic_name", "broker_id"}))
public class TopicEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "topic_name", nullable = false)
    private String topicName;

    // Message schema stored as JSON, opaque to this service
    @Column(name = "topic_schema", columnDefinition = "TEXT")
    private String topicSchemaJson;

    @Column(name = "broker_id", nullable = false)
    private Long brokerId;

    @Column(name = "creation_date", nullable = false)
    private LocalDateTime creationDate;

    @PrePersist
    protected void onCreate() {
        if (creationDate == null) {
            creationDate = LocalDateTime.now();
        }
    }

    public Map<String, Object> getTopicSchema() {
        return JsonUtils.toMap(topicSchemaJson);
    }

    public void setTopicSchema(Map<String, Object> schema) {
        this.topicSchemaJson = JsonUtils.toJson(schema);
    }

    public TopicResponse toResponse() {
        return TopicResponse.builder()
                .id(id)
                .topicName(topicName)
                .topicSchema(getTopicSchema())
                .brokerId(brokerId)
                .creationDate(creationDate)
                .build();
    }
}
