package com.mediaflow.mediaflow_backend.registry.mapping;

import java.util.List;
import java.util.Map;

/**
 * Provider-shaped options plus a human-readable note for every unified field that was changed or
 * dropped on the way.
 */
public record MappedOptions(Map<String, Object> options, List<String> coercions) {

    public MappedOptions {
        coercions = List.copyOf(coercions);
    }
}
