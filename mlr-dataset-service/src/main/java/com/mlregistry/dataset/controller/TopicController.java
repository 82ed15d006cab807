package com.mlregistry.dataset.controller;

import com.mlregistry.dataset.dto.RegisterTopicRequest;
import com.mlregistry.dataset.dto.StandardResponse;
import com.mlregistry.dataset.dto.TopicResponse;
import com.mlregistry.dataset.dto.UpdateTopicRequest;
import com.mlregistry.dataset.service.TopicRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import javax.validation.constraints.Positive;
import java.util.List;

/**
 * REST controller for topics hosted on registered brokers.
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/datasets")
@RequiredArgsConstructor
public class TopicController {

    private final TopicRegistryService topicRegistryService;

    /**
     * Register a topic under a broker.
     * POST /api/v1/datasets/broker/{id}/topic
     */
    @PostMapping("/broker/{id}/topic")
    public ResponseEntity<StandardResponse<TopicResponse>> registerTopic(
            @PathVariable("id") @Positive Long brokerId,
            @Valid @RequestBody RegisterTopicRequest request) {
        log.info("REST: Register topic - broker={}, name={}", brokerId, request.getName());

        TopicResponse topic = topicRegistryService.register(brokerId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(StandardResponse.of(HttpStatus.CREATED.value(), "Topic registered", topic));
    }

    /**
     * PATCH /api/v1/datasets/broker/topic/{id}
     */
    @PatchMapping("/broker/topic/{id}")
    public ResponseEntity<StandardResponse<TopicResponse>> updateTopic(
            @PathVariable("id") @Positive Long id,
            @RequestBody UpdateTopicRequest request) {
        log.info("REST: Update topic={}", id);

        TopicResponse topic = topicRegistryService.update(id, request);
        return ResponseEntity.ok(StandardResponse.of(HttpStatus.OK.value(), "Topic updated", topic));
    }

    /**
     * GET /api/v1/datasets/topic/details
     */
    @GetMapping("/topic/details")
    public ResponseEntity<StandardResponse<List<TopicResponse>>> listTopics() {
        log.debug("REST: List topics");

        return ResponseEntity.ok(StandardResponse.of(HttpStatus.OK.value(), "Topic details",
                topicRegistryService.list()));
    }

    /**
     * Delete a topic and the dataset links that reference it.
     * DELETE /api/v1/datasets/topic/{id}
     */
    @DeleteMapping("/topic/{id}")
    public ResponseEntity<Void> deleteTopic(@PathVariable("id") @Positive Long id) {
        log.info("REST: Delete topic={}", id);

        topicRegistryService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
