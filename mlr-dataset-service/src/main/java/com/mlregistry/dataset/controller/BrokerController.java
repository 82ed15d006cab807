package com.mlregistry.dataset.controller;

import com.mlregistry.dataset.dto.BrokerResponse;
import com.mlregistry.dataset.dto.RegisterBrokerRequest;
import com.mlregistry.dataset.dto.StandardResponse;
import com.mlregistry.dataset.dto.UpdateBrokerRequest;
import com.mlregistry.dataset.service.BrokerRegistryService;
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
 * REST controller for message broker registration.
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/datasets/broker")
@RequiredArgsConstructor
public class BrokerController {

    private final BrokerRegistryService brokerRegistryService;

    /**
     * Register a broker.
     * POST /api/v1/datasets/broker
     */
    @PostMapping
    public ResponseEntity<StandardResponse<BrokerResponse>> registerBroker(
            @Valid @RequestBody RegisterBrokerRequest request) {
        log.info("REST: Register broker - name={}, ip={}, port={}",
                request.getName(), request.getIp(), request.getPort());

        BrokerResponse broker = brokerRegistryService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(StandardResponse.of(HttpStatus.CREATED.value(), "Broker registered", broker));
    }

    /**
     * Partially update a broker.
     * PATCH /api/v1/datasets/broker/{id}
     */
    @PatchMapping("/{id}")
    public ResponseEntity<StandardResponse<BrokerResponse>> updateBroker(
            @PathVariable("id") @Positive Long id,
            @Valid @RequestBody UpdateBrokerRequest request) {
        log.info("REST: Update broker={}", id);

        BrokerResponse broker = brokerRegistryService.update(id, request);
        return ResponseEntity.ok(StandardResponse.of(HttpStatus.OK.value(), "Broker updated", broker));
    }

    /**
     * List all brokers.
     * GET /api/v1/datasets/broker/details
     */
    @GetMapping("/details")
    public ResponseEntity<StandardResponse<List<BrokerResponse>>> listBrokers() {
        log.debug("REST: List brokers");

        return ResponseEntity.ok(StandardResponse.of(HttpStatus.OK.value(), "Broker details",
                brokerRegistryService.list()));
    }

    /**
     * Delete a broker with its topics and their dataset links.
     * DELETE /api/v1/datasets/broker/{id}
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteBroker(@PathVariable("id") @Positive Long id) {
        log.info("REST: Delete broker={}", id);

        brokerRegistryService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
