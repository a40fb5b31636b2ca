package com.alertsentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes into a
 * {@link MarketTick}.
 * <p>
 * Malformed messages, and ticks without a ticker, are logged and dropped
 * (returns {@code null}) so one bad record cannot crash the pipeline. A tick
 * without a timestamp is stamped with the ingestion time.
 * </p>
 */
public class MarketTickDeserializationSchema implements DeserializationSchema<MarketTick> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MarketTickDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public MarketTick deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            MarketTick tick = objectMapper().readValue(message, MarketTick.class);
            if (tick.getTicker() == null || tick.getTicker().isBlank()) {
                LOG.warn("Dropping market tick without ticker");
                return null;
            }
            if (tick.getTimestamp() == null) {
                tick.setTimestamp(Instant.now());
            }
            return tick;
        } catch (Exception e) {
            LOG.warn("Failed to deserialize market tick, skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(MarketTick nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<MarketTick> getProducedType() {
        return TypeInformation.of(MarketTick.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
