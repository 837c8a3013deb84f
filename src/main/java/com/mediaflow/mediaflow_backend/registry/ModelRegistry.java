package com.mediaflow.mediaflow_backend.registry;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;
import com.mediaflow.mediaflow_backend.model.job.MediaType;
import com.mediaflow.mediaflow_backend.model.job.ParseResult;
import com.mediaflow.mediaflow_backend.model.job.ProviderCapabilities;
import com.mediaflow.mediaflow_backend.model.plan.UnifiedOptions;
import com.mediaflow.mediaflow_backend.registry.mapping.FabricMapping;
import com.mediaflow.mediaflow_backend.registry.mapping.MappedOptions;
import com.mediaflow.mediaflow_backend.registry.mapping.MinimaxMapping;
import com.mediaflow.mediaflow_backend.registry.mapping.NanoBananaMapping;
import com.mediaflow.mediaflow_backend.registry.mapping.ParameterMapping;
import com.mediaflow.mediaflow_backend.registry.mapping.SeedanceMapping;
import com.mediaflow.mediaflow_backend.registry.mapping.SeedreamMapping;
import com.mediaflow.mediaflow_backend.registry.mapping.SingleInputMapping;
import com.mediaflow.mediaflow_backend.registry.mapping.VideoMattingMapping;
import com.mediaflow.mediaflow_backend.registry.schema.ElevenLabsTurboOptions;
import com.mediaflow.mediaflow_backend.registry.schema.FabricOptions;
import com.mediaflow.mediaflow_backend.registry.schema.ImageBackgroundRemoverOptions;
import com.mediaflow.mediaflow_backend.registry.schema.IncrediblyFastWhisperOptions;
import com.mediaflow.mediaflow_backend.registry.schema.MinimaxVideo01Options;
import com.mediaflow.mediaflow_backend.registry.schema.ModelOptions;
import com.mediaflow.mediaflow_backend.registry.schema.NanoBananaOptions;
import com.mediaflow.mediaflow_backend.registry.schema.Seedance1ProOptions;
import com.mediaflow.mediaflow_backend.registry.schema.Seedream4Options;
import com.mediaflow.mediaflow_backend.registry.schema.VideoBackgroundRemoverOptions;
import com.mediaflow.mediaflow_backend.registry.schema.VideoMattingOptions;
import com.mediaflow.mediaflow_backend.registry.schema.WhisperOptions;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Per-model schemas, parameter mappings and response parsers. Models not listed here cannot run.
 */
@Slf4j
@Component
public class ModelRegistry {

    static final String ROBUST_VIDEO_MATTING_VERSION = "73d2128a371922d5d1abf0712a1d974be0e4e2358cc1218e4e34714767232bac";
    static final String VIDEO_BACKGROUND_REMOVER_VERSION = "ac5c138171b04413a69222c304f67c135e259d46089fc70ef12da685b3c604aa";
    static final String INCREDIBLY_FAST_WHISPER_VERSION = "3ab86df6c8f54c11309d4d1f930ac292bad43ace52d10c80d87eb258b3c9f79c";
    static final String WHISPER_VERSION = "8099696689d249cf8b122d833c36ac3f75505c666a395ca40ef26f68e7d3d16e";

    private final Map<String, ModelRegistryEntry> entries = new LinkedHashMap<>();
    private final ObjectMapper optionsMapper;
    private final Validator validator;

    public ModelRegistry(ObjectMapper objectMapper, Validator validator) {
        // unknown keys are stripped rather than rejected; providers ignore them anyway
        this.optionsMapper = objectMapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.validator = validator;
        registerDefaults();
    }

    private void registerDefaults() {
        // Replicate video
        register("bytedance/seedance-1-pro", MediaProvider.REPLICATE, MediaType.VIDEO, Seedance1ProOptions.class,
                ReplicateResponseParsers.video(), ProviderCapabilities.webhookFirst(), null,
                new SeedanceMapping("bytedance/seedance-1-pro"));
        register("minimax/video-01", MediaProvider.REPLICATE, MediaType.VIDEO, MinimaxVideo01Options.class,
                ReplicateResponseParsers.video(), ProviderCapabilities.webhookFirst(), null,
                new MinimaxMapping("minimax/video-01"));
        register("arielreplicate/robust_video_matting", MediaProvider.REPLICATE, MediaType.VIDEO, VideoMattingOptions.class,
                ReplicateResponseParsers.video(), ProviderCapabilities.webhookFirst(), ROBUST_VIDEO_MATTING_VERSION,
                new VideoMattingMapping("arielreplicate/robust_video_matting"));
        register("nateraw/video-background-remover", MediaProvider.REPLICATE, MediaType.VIDEO, VideoBackgroundRemoverOptions.class,
                ReplicateResponseParsers.video(), ProviderCapabilities.webhookFirst(), VIDEO_BACKGROUND_REMOVER_VERSION,
                new SingleInputMapping("nateraw/video-background-remover", "video", "video"));

        // Replicate image
        register("bytedance/seedream-4", MediaProvider.REPLICATE, MediaType.IMAGE, Seedream4Options.class,
                ReplicateResponseParsers.image(), ProviderCapabilities.pollingFirst(), null,
                new SeedreamMapping("bytedance/seedream-4"));
        register("codeplugtech/background_remover", MediaProvider.REPLICATE, MediaType.IMAGE, ImageBackgroundRemoverOptions.class,
                ReplicateResponseParsers.image(), ProviderCapabilities.pollingFirst(), null,
                new SingleInputMapping("codeplugtech/background_remover", "image", "image"));

        // Replicate speech to text, always polled: the transcript is post-processed by the job
        register("vaibhavs10/incredibly-fast-whisper", MediaProvider.REPLICATE, MediaType.TEXT, IncrediblyFastWhisperOptions.class,
                ReplicateResponseParsers.transcript(), ProviderCapabilities.pollingFirst(), INCREDIBLY_FAST_WHISPER_VERSION, null);
        register("openai/whisper", MediaProvider.REPLICATE, MediaType.TEXT, WhisperOptions.class,
                ReplicateResponseParsers.transcript(), ProviderCapabilities.pollingFirst(), WHISPER_VERSION, null);

        // ElevenLabs audio
        register("elevenlabs/turbo-v2.5", MediaProvider.ELEVENLABS, MediaType.AUDIO, ElevenLabsTurboOptions.class,
                ElevenLabsResponseParsers.audio(), ProviderCapabilities.synchronous(), null, null);

        // fal video
        for (String id : List.of("veed/fabric-1.0", "veed/fabric-1.0/fast")) {
            register(id, MediaProvider.FAL, MediaType.VIDEO, FabricOptions.class,
                    FalResponseParsers.video(), ProviderCapabilities.pollingFirst(), null, new FabricMapping(id));
        }

        // fal image
        for (String id : List.of("fal-ai/nano-banana", "fal-ai/nano-banana-pro", "fal-ai/nano-banana-pro/edit")) {
            register(id, MediaProvider.FAL, MediaType.IMAGE, NanoBananaOptions.class,
                    FalResponseParsers.image(), ProviderCapabilities.pollingFirst(), null, new NanoBananaMapping(id));
        }
    }

    private void register(String modelId, MediaProvider provider, MediaType mediaType,
                          Class<? extends ModelOptions> schema, ResponseParser parser,
                          ProviderCapabilities capabilities, String providerModelId, ParameterMapping mapping) {
        entries.put(modelId, new ModelRegistryEntry(modelId, provider, mediaType, schema, parser, parser,
                capabilities, providerModelId, mapping));
    }

    public Optional<ModelRegistryEntry> getModelInfo(String modelId) {
        return Optional.ofNullable(modelId).map(entries::get);
    }

    public Collection<ModelRegistryEntry> listModels() {
        return entries.values();
    }

    public ProviderCapabilities getModelCapabilities(String modelId) {
        return require(modelId).capabilities();
    }

    /**
     * Reads {@code raw} into the model's options record and validates it.
     *
     * @throws ParameterValidationException naming every offending field
     */
    public ModelOptions parseModelOptions(String modelId, Map<String, Object> raw) {
        ModelRegistryEntry entry = require(modelId);
        ModelOptions options;
        try {
            options = optionsMapper.convertValue(raw != null ? raw : Map.of(), entry.schema());
        } catch (IllegalArgumentException e) {
            String problem = e.getCause() instanceof JsonMappingException jme ? describe(jme) : "params: " + e.getMessage();
            throw new ParameterValidationException(modelId, List.of(problem));
        }
        Set<ConstraintViolation<ModelOptions>> violations = validator.validate(options);
        if (!violations.isEmpty()) {
            Set<String> messages = new TreeSet<>();
            for (ConstraintViolation<ModelOptions> v : violations) {
                messages.add(fieldName(entry.schema(), v.getPropertyPath().toString()) + ": " + v.getMessage());
            }
            throw new ParameterValidationException(modelId, new ArrayList<>(messages));
        }
        return options;
    }

    public MappedOptions mapUnifiedToProviderOptions(MediaProvider provider, String modelId, UnifiedOptions unified) {
        ModelRegistryEntry entry = requireForProvider(provider, modelId);
        ParameterMapping mapping = entry.parameterMapping()
                .orElseThrow(() -> new IllegalArgumentException("Model " + modelId + " does not accept unified options"));
        MappedOptions mapped = mapping.toProviderOptions(unified);
        mapped.coercions().forEach(c -> log.info("[Registry] {}: {}", modelId, c));
        return mapped;
    }

    public UnifiedOptions mapProviderToUnifiedOptions(MediaProvider provider, String modelId, Map<String, Object> providerOptions) {
        ModelRegistryEntry entry = requireForProvider(provider, modelId);
        return entry.parameterMapping()
                .map(m -> m.fromProviderOptions(providerOptions))
                .orElseThrow(() -> new IllegalArgumentException("Model " + modelId + " does not accept unified options"));
    }

    public ParseResult parseModelWebhook(String modelId, JsonNode payload) {
        return require(modelId).webhookParser().parse(payload);
    }

    public ParseResult parseModelPolling(String modelId, JsonNode payload) {
        return require(modelId).pollingParser().parse(payload);
    }

    private ModelRegistryEntry require(String modelId) {
        return getModelInfo(modelId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown model: " + modelId));
    }

    private ModelRegistryEntry requireForProvider(MediaProvider provider, String modelId) {
        ModelRegistryEntry entry = require(modelId);
        if (entry.provider() != provider) {
            throw new IllegalArgumentException("Model " + modelId + " is served by " + entry.provider().getId()
                    + ", not " + provider.getId());
        }
        return entry;
    }

    private static String describe(JsonMappingException e) {
        String path = e.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
                .collect(Collectors.joining("."));
        String problem = e.getOriginalMessage();
        int cut = problem.indexOf('\n');
        if (cut > 0) problem = problem.substring(0, cut);
        return (path.isEmpty() ? "params" : path) + ": " + problem;
    }

    // Reports the provider's field name (aspect_ratio) instead of the record component (aspectRatio).
    private String fieldName(Class<?> schema, String propertyPath) {
        String head = propertyPath;
        String tail = "";
        int dot = propertyPath.indexOf('.');
        int bracket = propertyPath.indexOf('[');
        int cut = dot < 0 ? bracket : (bracket < 0 ? dot : Math.min(dot, bracket));
        if (cut > 0) {
            head = propertyPath.substring(0, cut);
            tail = propertyPath.substring(cut);
        }
        BeanDescription description = optionsMapper.getSerializationConfig()
                .introspect(optionsMapper.constructType(schema));
        for (BeanPropertyDefinition property : description.findProperties()) {
            if (property.getInternalName().equals(head)) {
                return property.getName() + tail;
            }
        }
        // class-level checks such as customSizeComplete have no property
        return head + tail;
    }
}
