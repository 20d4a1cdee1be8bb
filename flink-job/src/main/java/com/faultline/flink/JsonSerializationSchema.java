package com.faultline.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes outbound records (aggregation results, notifications) to
 * snake_case JSON for the Kafka sinks.
 *
 * @param <T> record type
 */
public class JsonSerializationSchema<T> implements SerializationSchema<T> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(JsonSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(T element) {
        try {
            return objectMapper().writeValueAsBytes(element);
        } catch (Exception e) {
            LOG.error("Failed to serialize {}: {}", element, e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = JsonMappers.create();
        }
        return mapper;
    }
}
