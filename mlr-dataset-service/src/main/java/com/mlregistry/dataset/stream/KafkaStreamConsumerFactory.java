package com.mlregistry.dataset.stream;

import com.mlregistry.dataset.config.StreamReaderProperties;
import com.mlregistry.dataset.dto.StreamCoordinates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.springframework.stereotype.Component;

import java.util.Properties;
import java.util.UUID;

/**
 * Builds a {@link KafkaConsumer} per request.
 * Each session gets a throwaway group id and never commits offsets.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaStreamConsumerFactory implements StreamConsumerFactory {

    private final StreamReaderProperties properties;

    @Override
    public Consumer<byte[], byte[]> createConsumer(StreamCoordinates coordinates, OffsetPolicy offsetPolicy,
                                                   int maxRecords) {
        Properties props = buildProperties(coordinates, offsetPolicy, maxRecords);
        log.debug("Opening consumer session: bootstrap={}, topic={}, offsetPolicy={}, group={}",
                coordinates.getBootstrapServers(), coordinates.getTopicName(), offsetPolicy.getValue(),
                props.get(ConsumerConfig.GROUP_ID_CONFIG));
        return new KafkaConsumer<>(props);
    }

    Properties buildProperties(StreamCoordinates coordinates, OffsetPolicy offsetPolicy, int maxRecords) {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, coordinates.getBootstrapServers());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, properties.getConsumerGroupPrefix() + UUID.randomUUID());
        props.put(ConsumerConfig.CLIENT_ID_CONFIG, properties.getClientId());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, offsetPolicy.getValue());
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.ALLOW_AUTO_CREATE_TOPICS_CONFIG, "false");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, maxRecords);
        props.put(ConsumerConfig.REQUEST_TIMEOUT_MS_CONFIG, properties.getRequestTimeoutMs());
        props.put(ConsumerConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, properties.getRequestTimeoutMs());
        return props;
    }
}
