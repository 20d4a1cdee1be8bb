package com.faultline.flink;

import com.faultline.core.model.ErrorSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ErrorSignalDeserializationSchema}.
 */
class ErrorSignalDeserializationSchemaTest {

    private ErrorSignalDeserializationSchema schema;

    @BeforeEach
    void setUp() {
        schema = new ErrorSignalDeserializationSchema();
    }

    @Test
    @DisplayName("Should map snake_case fields")
    void shouldMapSnakeCaseFields() throws Exception {
        String json = "{\"type\":\"NoMethodError\",\"message\":\"undefined method\","
                + "\"stack_frames\":[\"/app/models/order.rb:12\"],\"tenant_id\":\"acme\","
                + "\"user_agent\":\"Mozilla/5.0 (iPhone)\",\"occurred_at\":\"2024-03-01T10:00:00Z\","
                + "\"unexpected\":true}";

        ErrorSignal signal = schema.deserialize(bytes(json));

        assertThat(signal.getType()).isEqualTo("NoMethodError");
        assertThat(signal.getStackFrames()).containsExactly("/app/models/order.rb:12");
        assertThat(signal.getTenantId()).isEqualTo("acme");
        assertThat(signal.getUserAgent()).isEqualTo("Mozilla/5.0 (iPhone)");
        assertThat(signal.getOccurredAt()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
    }

    @Test
    @DisplayName("Should fill a missing occurred_at with the ingestion time")
    void shouldFillMissingTimestamp() throws Exception {
        Instant before = Instant.now();

        ErrorSignal signal = schema.deserialize(bytes("{\"type\":\"TypeError\",\"message\":\"x\"}"));

        assertThat(signal.getOccurredAt()).isAfterOrEqualTo(before);
    }

    @Test
    @DisplayName("Should return null for malformed or empty input")
    void shouldDropMalformedInput() throws Exception {
        assertThat(schema.deserialize(bytes("{not json"))).isNull();
        assertThat(schema.deserialize(new byte[0])).isNull();
        assertThat(schema.deserialize(null)).isNull();
    }

    @Test
    @DisplayName("Should never signal end of stream")
    void shouldNotEndStream() {
        assertThat(schema.isEndOfStream(ErrorSignal.builder().type("X").message("y").build())).isFalse();
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
