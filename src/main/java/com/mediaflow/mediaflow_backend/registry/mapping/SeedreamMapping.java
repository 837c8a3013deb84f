package com.mediaflow.mediaflow_backend.registry.mapping;

import com.mediaflow.mediaflow_backend.model.plan.UnifiedOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** bytedance/seedream-4. A single reference image becomes the {@code image_input} list. */
public class SeedreamMapping extends AbstractParameterMapping {

    public SeedreamMapping(String modelId) {
        super(modelId, Set.of("prompt", "aspectRatio", "image"), Set.of("prompt", "aspectRatio", "image"));
    }

    @Override
    public MappedOptions toProviderOptions(UnifiedOptions unified) {
        List<String> coercions = new ArrayList<>();
        Map<String, Object> options = newOptions();
        put(options, "prompt", unified.prompt());
        put(options, "aspect_ratio", unified.aspectRatio());
        if (unified.image() != null) {
            options.put("image_input", List.of(unified.image()));
        }
        noteUnsupported(unified, coercions);
        return new MappedOptions(options, coercions);
    }

    @Override
    public UnifiedOptions fromProviderOptions(Map<String, Object> options) {
        return UnifiedOptions.builder()
                .prompt(string(options, "prompt"))
                .aspectRatio(string(options, "aspect_ratio"))
                .image(firstString(options, "image_input"))
                .build();
    }
}
