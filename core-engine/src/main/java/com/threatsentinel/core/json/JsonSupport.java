package com.threatsentinel.core.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for the Jackson {@link ObjectMapper} shared by the engine and the
 * HTTP transport: ISO-8601 dates and lenient reading of unknown properties.
 *
 * @since 1.0.0
 */
public final class JsonSupport {

    private JsonSupport() {
        // utility class
    }

    /**
     * @return a newly configured mapper; mappers are thread-safe once
     *         configured, so callers keep one per component
     */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
