package com.mlregistry.dataset.controller;

import com.mlregistry.dataset.dto.DatasetMessageDetailsResponse;
import com.mlregistry.dataset.dto.DatasetTopicDataResponse;
import com.mlregistry.dataset.dto.RegisterDatasetMessageRequest;
import com.mlregistry.dataset.dto.StandardResponse;
import com.mlregistry.dataset.service.DatasetTopicLinkService;
import com.mlregistry.dataset.service.StreamReaderService;
import com.mlregistry.dataset.stream.OffsetPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import javax.validation.constraints.Positive;

/**
 * REST controller for broker-sourced datasets and their live topic data.
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/datasets")
@RequiredArgsConstructor
public class DatasetMessageController {

    private final DatasetTopicLinkService datasetTopicLinkService;
    private final StreamReaderService streamReaderService;

    /**
     * Register a dataset linked to a broker topic.
     * POST /api/v1/datasets/message
     */
    @PostMapping("/message")
    public ResponseEntity<StandardResponse<DatasetMessageDetailsResponse>> registerDatasetMessage(
            @Valid @RequestBody RegisterDatasetMessageRequest request) {
        log.info("REST: Register dataset message - name={}, broker={}, topic={}",
                request.getName(), request.getBrokerId(), request.getTopicId());

        DatasetMessageDetailsResponse details = datasetTopicLinkService.registerDatasetMessageDetails(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(StandardResponse.of(HttpStatus.CREATED.value(), "Dataset registered", details));
    }

    /**
     * GET /api/v1/datasets/{id}/message/details
     */
    @GetMapping("/{id}/message/details")
    public ResponseEntity<StandardResponse<DatasetMessageDetailsResponse>> getDatasetMessageDetails(
            @PathVariable("id") @Positive Long datasetId) {
        log.debug("REST: Get dataset message details - dataset={}", datasetId);

        return ResponseEntity.ok(StandardResponse.of(HttpStatus.OK.value(), "Dataset message details",
                datasetTopicLinkService.fetchDatasetMessageDetails(datasetId)));
    }

    /**
     * DELETE /api/v1/datasets/message/{id}
     */
    @DeleteMapping("/message/{id}")
    public ResponseEntity<Void> deregisterDatasetMessage(@PathVariable("id") @Positive Long datasetId) {
        log.info("REST: Deregister dataset message - dataset={}", datasetId);

        datasetTopicLinkService.deregister(datasetId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Read a window of live records from the dataset's topic.
     * GET /api/v1/datasets/{id}/topic/data?maxRecords={n}&offsetPolicy={earliest|latest}
     */
    @GetMapping("/{id}/topic/data")
    public ResponseEntity<StandardResponse<DatasetTopicDataResponse>> getDatasetTopicData(
            @PathVariable("id") @Positive Long datasetId,
            @RequestParam(value = "maxRecords", required = false) Integer maxRecords,
            @RequestParam(value = "offsetPolicy", required = false) OffsetPolicy offsetPolicy) {
        log.debug("REST: Get topic data - dataset={}, maxRecords={}, offsetPolicy={}",
                datasetId, maxRecords, offsetPolicy);

        DatasetTopicDataResponse data = streamReaderService.fetchStreamWindow(datasetId, maxRecords, offsetPolicy);
        return ResponseEntity.ok(StandardResponse.of(HttpStatus.OK.value(), "Topic data", data));
    }
}
