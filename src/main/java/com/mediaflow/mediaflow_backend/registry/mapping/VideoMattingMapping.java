package com.mediaflow.mediaflow_backend.registry.mapping;

import com.mediaflow.mediaflow_backend.model.plan.UnifiedOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** arielreplicate/robust_video_matting. Output type defaults to a green screen. */
public class VideoMattingMapping extends AbstractParameterMapping {

    static final String DEFAULT_OUTPUT_TYPE = "green-screen";

    public VideoMattingMapping(String modelId) {
        super(modelId, Set.of("video", "outputType"), Set.of("video"));
    }

    @Override
    public MappedOptions toProviderOptions(UnifiedOptions unified) {
        List<String> coercions = new ArrayList<>();
        Map<String, Object> options = newOptions();
        put(options, "input_video", unified.video());
        options.put("output_type", unified.outputType() != null ? unified.outputType() : DEFAULT_OUTPUT_TYPE);
        noteUnsupported(unified, coercions);
        return new MappedOptions(options, coercions);
    }

    @Override
    public UnifiedOptions fromProviderOptions(Map<String, Object> options) {
        return UnifiedOptions.builder()
                .video(string(options, "input_video"))
                .outputType(string(options, "output_type"))
                .build();
    }
}
