package com.botcore.toolgate.infrastructure.json;

import com.botcore.toolgate.application.ports.ParamsCanonicalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.Map;

/**
 * Compact JSON with object keys sorted at every level.
 */
public final class JacksonParamsCanonicalizer implements ParamsCanonicalizer {

    private final ObjectMapper om = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .build();

    @Override
    public String canonicalize(Map<String, Object> parameters) {
        try {
            return om.writeValueAsString(parameters == null ? Map.of() : parameters);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Parameters are not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }
}
