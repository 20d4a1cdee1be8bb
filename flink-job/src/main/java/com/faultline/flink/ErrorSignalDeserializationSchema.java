package com.faultline.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.faultline.core.model.ErrorSignal;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;

/**
 * Converts raw Kafka bytes into an {@link ErrorSignal}.
 *
 * <p>
 * Malformed messages are logged and dropped (returns {@code null}) so a
 * single bad record cannot fail the job. A missing {@code occurred_at} is
 * filled with the ingestion time.
 * </p>
 */
public class ErrorSignalDeserializationSchema implements DeserializationSchema<ErrorSignal> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ErrorSignalDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public ErrorSignal deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            ErrorSignal signal = objectMapper().readValue(message, ErrorSignal.class);
            if (signal.getOccurredAt() == null) {
                signal.setOccurredAt(Instant.now());
            }
            return signal;
        } catch (Exception e) {
            LOG.warn("Failed to deserialize error signal, skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(ErrorSignal nextElement) {
        return false;
    }

    @Override
    public TypeInformation<ErrorSignal> getProducedType() {
        return TypeInformation.of(ErrorSignal.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = JsonMappers.create();
        }
        return mapper;
    }
}
