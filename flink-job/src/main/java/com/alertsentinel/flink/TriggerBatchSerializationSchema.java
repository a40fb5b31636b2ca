package com.alertsentinel.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that converts a {@link TriggerBatch} into
 * JSON bytes for the trigger topic. Instants are written as ISO-8601 strings.
 */
public class TriggerBatchSerializationSchema implements SerializationSchema<TriggerBatch> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TriggerBatchSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(TriggerBatch batch) {
        try {
            return objectMapper().writeValueAsBytes(batch);
        } catch (Exception e) {
            LOG.error("Failed to serialize trigger batch for {}: {}",
                    batch != null ? batch.getTicker() : null, e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
