package com.mediaflow.mediaflow_backend.registry.mapping;

import com.mediaflow.mediaflow_backend.model.plan.UnifiedOptions;

import java.util.Map;
import java.util.Set;

/** Translation between {@link UnifiedOptions} and one model's native options. */
public interface ParameterMapping {

    MappedOptions toProviderOptions(UnifiedOptions unified);

    UnifiedOptions fromProviderOptions(Map<String, Object> providerOptions);

    /** Unified fields that may not survive {@code fromProviderOptions(toProviderOptions(u))}. */
    Set<String> lossyFields();
}
