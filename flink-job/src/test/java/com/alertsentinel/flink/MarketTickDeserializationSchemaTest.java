package com.alertsentinel.flink;

import com.alertsentinel.core.model.MarketObservation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MarketTickDeserializationSchema}.
 */
class MarketTickDeserializationSchemaTest {

    private final MarketTickDeserializationSchema schema = new MarketTickDeserializationSchema();

    @Test
    @DisplayName("Should read a full tick including news")
    void shouldReadFullTick() throws IOException {
        String json = "{\"ticker\":\"SBER\",\"price\":301.5,\"previousClose\":290,\"volume\":1200000,"
                + "\"averageVolume\":800000,\"rsi\":71.2,\"timestamp\":\"2026-03-02T10:00:00Z\","
                + "\"exchange\":\"MOEX\","
                + "\"news\":[{\"title\":\"Dividend raised\",\"publishedAt\":\"2026-03-02T09:50:00Z\"}]}";

        MarketTick tick = schema.deserialize(bytes(json));

        assertThat(tick).isNotNull();
        assertThat(tick.getTicker()).isEqualTo("SBER");
        assertThat(tick.getPrice()).isEqualTo(301.5);
        assertThat(tick.getPeRatio()).isNull();
        assertThat(tick.getNews()).hasSize(1);
        assertThat(tick.getNews().get(0).getPublishedAt()).isEqualTo(Instant.parse("2026-03-02T09:50:00Z"));

        MarketObservation observation = tick.toObservation();
        assertThat(observation.getRsi()).contains(71.2);
        assertThat(observation.getTimestamp()).isEqualTo(Instant.parse("2026-03-02T10:00:00Z"));
    }

    @Test
    @DisplayName("Null entries in the news array should be dropped")
    void shouldDropNullNewsEntries() throws IOException {
        String json = "{\"ticker\":\"SBER\",\"price\":301.5,"
                + "\"news\":[null,{\"title\":\"Dividend raised\"},null]}";

        MarketTick tick = schema.deserialize(bytes(json));

        assertThat(tick).isNotNull();
        assertThat(tick.getNews()).hasSize(1);
        assertThat(tick.getNews().get(0).getTitle()).isEqualTo("Dividend raised");
    }

    @Test
    @DisplayName("A tick without timestamp should be stamped on arrival")
    void shouldStampMissingTimestamp() throws IOException {
        Instant before = Instant.now();

        MarketTick tick = schema.deserialize(bytes("{\"ticker\":\"GAZP\",\"price\":150}"));

        assertThat(tick.getTimestamp()).isAfterOrEqualTo(before);
    }

    @Test
    @DisplayName("Malformed, empty and ticker-less messages should be dropped")
    void shouldDropBadMessages() throws IOException {
        assertThat(schema.deserialize(bytes("{not json"))).isNull();
        assertThat(schema.deserialize(new byte[0])).isNull();
        assertThat(schema.deserialize(null)).isNull();
        assertThat(schema.deserialize(bytes("{\"price\":150}"))).isNull();
        assertThat(schema.isEndOfStream(null)).isFalse();
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
