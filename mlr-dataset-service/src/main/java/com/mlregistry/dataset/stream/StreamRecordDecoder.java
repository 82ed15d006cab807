package com.mlregistry.dataset.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.mlregistry.common.exception.MessageDecodeException;
import com.mlregistry.common.util.JsonUtils;
import com.mlregistry.dataset.config.StreamReaderProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

/**
 * Decodes JSON message payloads into structured records, applying the
 * configured {@link DecodeFailurePolicy} to payloads that do not parse.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StreamRecordDecoder {

    private final StreamReaderProperties properties;

    /**
     * @return the decoded record, or empty when the message was skipped
     * @throws MessageDecodeException when the payload is invalid and the policy is FAIL_FAST
     */
    public Optional<JsonNode> decode(ConsumerRecord<byte[], byte[]> record) {
        try {
            return Optional.of(parse(record.value()));
        } catch (IOException e) {
            String position = record.topic() + "-" + record.partition() + "@" + record.offset();
            if (properties.getDecodeFailurePolicy() == DecodeFailurePolicy.SKIP) {
                log.warn("Skipping undecodable message at {}: {}", position, e.getMessage());
                return Optional.empty();
            }
            throw new MessageDecodeException("Failed to decode message at " + position + ": " + e.getMessage(), e);
        }
    }

    private JsonNode parse(byte[] payload) throws IOException {
        if (payload == null || payload.length == 0) {
            throw new IOException("empty payload");
        }
        JsonNode node = JsonUtils.getObjectMapper().readTree(payload);
        if (node == null || node.isMissingNode()) {
            throw new IOException("no JSON content");
        }
        return node;
    }
}
