package com.faultline.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.faultline.core.model.AggregatedError;
import com.faultline.core.model.AnomalyInfo;
import com.faultline.core.model.AnomalyLevel;
import com.faultline.core.model.ErrorSignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JsonSerializationSchema}.
 */
class JsonSerializationSchemaTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final ObjectMapper reader = new ObjectMapper();

    @Test
    @DisplayName("Should write notifications as snake_case JSON with ISO timestamps")
    void shouldWriteNotification() throws Exception {
        AggregatedError error = AggregatedError.firstOccurrence("abc123",
                ErrorSignal.builder().type("TypeError").message("x is undefined").tenantId("acme").build(),
                "API", T0);
        error.setId(7);
        AnomalyInfo anomaly = AnomalyInfo.evaluated(true, AnomalyLevel.HIGH, 60, 10.0, 2.0, 14.0, 25.0, 6.0);

        byte[] bytes = new JsonSerializationSchema<ErrorNotification>()
                .serialize(new ErrorNotification(error, anomaly, T0));
        JsonNode json = reader.readTree(bytes);

        assertThat(json.get("created_at").asText()).isEqualTo("2024-03-01T10:00:00Z");
        assertThat(json.get("error").get("error_type").asText()).isEqualTo("TypeError");
        assertThat(json.get("error").get("occurrence_count").asLong()).isEqualTo(1);
        assertThat(json.get("error").get("tenant_id").asText()).isEqualTo("acme");
        assertThat(json.get("error").has("key")).isFalse();
        assertThat(json.get("anomaly").get("level").asText()).isEqualTo("HIGH");
    }

    @Test
    @DisplayName("Should write a null anomaly as JSON null")
    void shouldWriteNullAnomaly() throws Exception {
        AggregatedError error = AggregatedError.firstOccurrence("abc123",
                ErrorSignal.builder().type("TypeError").message("x").build(), "API", T0);

        JsonNode json = reader.readTree(new JsonSerializationSchema<ErrorNotification>()
                .serialize(new ErrorNotification(error, null, T0)));

        assertThat(json.get("anomaly").isNull()).isTrue();
    }
}
