package com.mediaflow.mediaflow_backend.registry.mapping;

import com.mediaflow.mediaflow_backend.model.plan.UnifiedOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * bytedance/seedance-1-pro. {@code image} and {@code startImage} both become the first frame;
 * {@code cameraMotion} becomes the boolean {@code camera_fixed}.
 */
public class SeedanceMapping extends AbstractParameterMapping {

    public SeedanceMapping(String modelId) {
        super(modelId,
                Set.of("prompt", "duration", "resolution", "aspectRatio", "seed", "image", "startImage", "endImage", "cameraMotion"),
                Set.of("prompt", "duration", "resolution", "aspectRatio", "seed", "startImage", "endImage", "cameraMotion"));
    }

    @Override
    public MappedOptions toProviderOptions(UnifiedOptions unified) {
        List<String> coercions = new ArrayList<>();
        Map<String, Object> options = newOptions();
        put(options, "prompt", unified.prompt());
        put(options, "duration", unified.duration());
        put(options, "resolution", unified.resolution());
        put(options, "aspect_ratio", unified.aspectRatio());
        put(options, "seed", unified.seed());
        if (unified.startImage() != null) {
            put(options, "image", unified.startImage());
            if (unified.image() != null && !unified.image().equals(unified.startImage())) {
                coercions.add("image was ignored because startImage is set");
            }
        } else {
            put(options, "image", unified.image());
        }
        put(options, "last_frame_image", unified.endImage());
        if (unified.cameraMotion() != null) {
            options.put("camera_fixed", "fixed".equals(unified.cameraMotion()));
        }
        noteUnsupported(unified, coercions);
        return new MappedOptions(options, coercions);
    }

    @Override
    public UnifiedOptions fromProviderOptions(Map<String, Object> options) {
        Object cameraFixed = options.get("camera_fixed");
        return UnifiedOptions.builder()
                .prompt(string(options, "prompt"))
                .duration(integer(options, "duration"))
                .resolution(string(options, "resolution"))
                .aspectRatio(string(options, "aspect_ratio"))
                .seed(integer(options, "seed"))
                .startImage(string(options, "image"))
                .endImage(string(options, "last_frame_image"))
                .cameraMotion(cameraFixed == null ? null : (Boolean.TRUE.equals(cameraFixed) ? "fixed" : "dynamic"))
                .build();
    }
}
