package com.mediaflow.mediaflow_backend.registry.mapping;

import com.mediaflow.mediaflow_backend.model.plan.UnifiedOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** fal-ai/nano-banana family. fal says {@code jpeg}, callers usually say {@code jpg}. */
public class NanoBananaMapping extends AbstractParameterMapping {

    public NanoBananaMapping(String modelId) {
        super(modelId, Set.of("prompt", "aspectRatio", "outputFormat", "image"), Set.of("prompt", "aspectRatio", "image"));
    }

    @Override
    public MappedOptions toProviderOptions(UnifiedOptions unified) {
        List<String> coercions = new ArrayList<>();
        Map<String, Object> options = newOptions();
        put(options, "prompt", unified.prompt());
        put(options, "aspect_ratio", unified.aspectRatio());
        String format = unified.outputFormat();
        if ("jpg".equals(format)) {
            coercions.add("outputFormat jpg was normalized to jpeg");
            format = "jpeg";
        }
        put(options, "output_format", format);
        if (unified.image() != null) {
            options.put("image_urls", List.of(unified.image()));
        }
        noteUnsupported(unified, coercions);
        return new MappedOptions(options, coercions);
    }

    @Override
    public UnifiedOptions fromProviderOptions(Map<String, Object> options) {
        String format = string(options, "output_format");
        return UnifiedOptions.builder()
                .prompt(string(options, "prompt"))
                .aspectRatio(string(options, "aspect_ratio"))
                .outputFormat("jpeg".equals(format) ? "jpg" : format)
                .image(firstString(options, "image_urls"))
                .build();
    }
}
