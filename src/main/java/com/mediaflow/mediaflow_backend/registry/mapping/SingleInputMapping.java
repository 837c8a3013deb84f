package com.mediaflow.mediaflow_backend.registry.mapping;

import com.mediaflow.mediaflow_backend.model.plan.UnifiedOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Models that take exactly one media input and nothing else (background removers). */
public class SingleInputMapping extends AbstractParameterMapping {

    private final String unifiedField;
    private final String providerField;

    public SingleInputMapping(String modelId, String unifiedField, String providerField) {
        super(modelId, Set.of(unifiedField), Set.of(unifiedField));
        if (!"image".equals(unifiedField) && !"video".equals(unifiedField)) {
            throw new IllegalArgumentException("Unsupported input field: " + unifiedField);
        }
        this.unifiedField = unifiedField;
        this.providerField = providerField;
    }

    @Override
    public MappedOptions toProviderOptions(UnifiedOptions unified) {
        List<String> coercions = new ArrayList<>();
        Map<String, Object> options = newOptions();
        put(options, providerField, "image".equals(unifiedField) ? unified.image() : unified.video());
        noteUnsupported(unified, coercions);
        return new MappedOptions(options, coercions);
    }

    @Override
    public UnifiedOptions fromProviderOptions(Map<String, Object> options) {
        String value = string(options, providerField);
        return "image".equals(unifiedField)
                ? UnifiedOptions.builder().image(value).build()
                : UnifiedOptions.builder().video(value).build();
    }
}
