package com.mediaflow.mediaflow_backend.registry.schema;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Validated, typed options for one model. Implementations are records whose JSON names are the
 * provider's own field names.
 */
public interface ModelOptions {

    String HTTP_URL = "https?://\\S+";

    TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    /** Request body fields sent to the provider. */
    default Map<String, Object> toPayload(ObjectMapper mapper) {
        return mapper.convertValue(this, PAYLOAD_TYPE);
    }
}
