package com.driftguard.flink;

import com.driftguard.core.model.EnrichedRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts {@link EnrichedRecord}s to flat JSON objects for the output topic.
 */
public class EnrichedRecordSerializationSchema implements SerializationSchema<EnrichedRecord> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(EnrichedRecordSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(EnrichedRecord record) {
        try {
            return objectMapper().writeValueAsBytes(record);
        } catch (Exception e) {
            LOG.error("Failed to serialize enriched record: {}", e.getMessage(), e);
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
