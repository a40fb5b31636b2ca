package com.alertsentinel.flink;

import com.alertsentinel.core.model.TriggerEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TriggerBatchSerializationSchema} and {@link TriggerBatch}.
 */
class TriggerBatchSerializationSchemaTest {

    private static final Instant AT = Instant.parse("2026-03-02T10:00:00Z");

    @Test
    @DisplayName("Should write the batch with ISO instants and without absent fields")
    void shouldWriteBatchAsJson() throws IOException {
        TriggerEvent event = TriggerEvent.builder()
                .alertId("sber-breakout")
                .ticker("SBER")
                .triggeredAt(AT)
                .triggerReason("Conditions met: Price > 300")
                .conditionsMet(List.of("Price > 300"))
                .priceAtTrigger(301.5)
                .build();
        TriggerBatch batch = TriggerBatch.of("SBER", List.of(event), AT.plusSeconds(900));

        byte[] bytes = new TriggerBatchSerializationSchema().serialize(batch);
        JsonNode json = new ObjectMapper().readTree(bytes);

        assertThat(json.get("ticker").asText()).isEqualTo("SBER");
        assertThat(json.get("size").asInt()).isEqualTo(1);
        assertThat(json.get("flushedAt").asText()).isEqualTo("2026-03-02T10:15:00Z");

        JsonNode first = json.get("events").get(0);
        assertThat(first.get("alertId").asText()).isEqualTo("sber-breakout");
        assertThat(first.get("triggeredAt").asText()).isEqualTo("2026-03-02T10:00:00Z");
        assertThat(first.get("userAction").asText()).isEqualTo("PENDING");
        assertThat(first.get("conditionsMet").get(0).asText()).isEqualTo("Price > 300");
        assertThat(first.has("newsCount")).isFalse();
        assertThat(first.has("sentiment")).isFalse();
    }

    @Test
    @DisplayName("An empty batch should be rejected")
    void shouldRejectEmptyBatch() {
        assertThatThrownBy(() -> TriggerBatch.of("SBER", List.of(), AT))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
