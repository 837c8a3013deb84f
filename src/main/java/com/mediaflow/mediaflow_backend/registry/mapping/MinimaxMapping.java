package com.mediaflow.mediaflow_backend.registry.mapping;

import com.mediaflow.mediaflow_backend.model.plan.UnifiedOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** minimax/video-01. Always turns on the provider's prompt optimizer. */
public class MinimaxMapping extends AbstractParameterMapping {

    public MinimaxMapping(String modelId) {
        super(modelId, Set.of("prompt", "image", "startImage"), Set.of("prompt", "startImage"));
    }

    @Override
    public MappedOptions toProviderOptions(UnifiedOptions unified) {
        List<String> coercions = new ArrayList<>();
        Map<String, Object> options = newOptions();
        put(options, "prompt", unified.prompt());
        put(options, "first_frame_image", unified.startImage() != null ? unified.startImage() : unified.image());
        options.put("prompt_optimizer", true);
        noteUnsupported(unified, coercions);
        return new MappedOptions(options, coercions);
    }

    @Override
    public UnifiedOptions fromProviderOptions(Map<String, Object> options) {
        return UnifiedOptions.builder()
                .prompt(string(options, "prompt"))
                .startImage(string(options, "first_frame_image"))
                .build();
    }
}
