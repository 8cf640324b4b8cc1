package com.driftguard.flink;

import com.driftguard.core.model.LlmEvent;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts raw Kafka bytes into {@link LlmEvent}s.
 * <p>
 * Bytes that are not a JSON object are logged and dropped (returns
 * {@code null}). Well-formed JSON with bad field values is passed through;
 * the pipeline flags it as rejected input so it still reaches the output
 * topic.
 * </p>
 */
public class LlmEventDeserializationSchema implements DeserializationSchema<LlmEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(LlmEventDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public LlmEvent deserialize(byte[] message) {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return objectMapper().readValue(message, LlmEvent.class);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize LLM event, skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(LlmEvent nextElement) {
        return false;
    }

    @Override
    public TypeInformation<LlmEvent> getProducedType() {
        return TypeInformation.of(LlmEvent.class);
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
