package com.mediaflow.mediaflow_backend.registry.mapping;

import com.mediaflow.mediaflow_backend.model.plan.UnifiedOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * veed/fabric-1.0. Fabric renders 480p or 720p only: 1080p requests are downgraded to 720p and a
 * missing resolution becomes 720p.
 */
public class FabricMapping extends AbstractParameterMapping {

    static final String MAX_RESOLUTION = "720p";

    public FabricMapping(String modelId) {
        super(modelId, Set.of("image", "startImage", "audio", "resolution"), Set.of("image", "audio"));
    }

    @Override
    public MappedOptions toProviderOptions(UnifiedOptions unified) {
        List<String> coercions = new ArrayList<>();
        Map<String, Object> options = newOptions();
        put(options, "image_url", unified.image() != null ? unified.image() : unified.startImage());
        put(options, "audio_url", unified.audio());
        String resolution = unified.resolution();
        if (resolution == null) {
            resolution = MAX_RESOLUTION;
        } else if ("1080p".equals(resolution)) {
            coercions.add("resolution 1080p is not supported by " + modelId + " and was downgraded to " + MAX_RESOLUTION);
            resolution = MAX_RESOLUTION;
        }
        options.put("resolution", resolution);
        noteUnsupported(unified, coercions);
        return new MappedOptions(options, coercions);
    }

    @Override
    public UnifiedOptions fromProviderOptions(Map<String, Object> options) {
        return UnifiedOptions.builder()
                .image(string(options, "image_url"))
                .audio(string(options, "audio_url"))
                .resolution(string(options, "resolution"))
                .build();
    }
}
