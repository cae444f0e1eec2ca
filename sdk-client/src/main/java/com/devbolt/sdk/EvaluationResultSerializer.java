package com.devbolt.sdk;

import com.devbolt.core.model.EvaluationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts {@link EvaluationResult} to a single-line JSON document with
 * ISO-8601 timestamps.
 */
public class EvaluationResultSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(EvaluationResultSerializer.class);

    private final ObjectMapper mapper;

    public EvaluationResultSerializer() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * @param result the result to serialize
     * @return JSON text, or {@code "{}"} if serialization fails
     */
    public String toJson(EvaluationResult result) {
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize evaluation result: {}", e.getMessage(), e);
            return "{}";
        }
    }
}
