package com.mediaflow.mediaflow_backend.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;
import com.mediaflow.mediaflow_backend.model.job.ProviderCapabilities;
import com.mediaflow.mediaflow_backend.model.job.WaitingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * ElevenLabs text to speech. The API answers synchronously with audio bytes, so each call gets a
 * locally minted job id and its result is held as a {@code data:} URI until the follow-up status
 * read hands it over.
 */
public class ElevenLabsClient extends HttpProviderSupport implements MediaProviderClient {

    private static final Logger log = LoggerFactory.getLogger(ElevenLabsClient.class);

    static final String DEFAULT_VOICE_ID = "21m00Tcm4TlvDq8ikWAM";
    static final String OUTPUT_FORMAT = "mp3_44100_128";
    static final String AUDIO_MIME_TYPE = "audio/mpeg";
    // bounds results that are never collected, e.g. when the job was failed in between
    private static final int MAX_CACHED_RESULTS = 256;
    private static final Map<String, String> MODEL_IDS = Map.of(
            "elevenlabs/turbo-v2.5", "eleven_turbo_v2_5",
            "elevenlabs/multilingual-v2", "eleven_multilingual_v2");

    private final Map<String, String> completedJobs = Collections.synchronizedMap(
            new LinkedHashMap<>(16, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                    return size() > MAX_CACHED_RESULTS;
                }
            });

    public ElevenLabsClient(HttpClient httpClient, ObjectMapper mapper, String baseUrl, String apiKey) {
        super(MediaProvider.ELEVENLABS, httpClient, mapper, baseUrl, apiKey);
    }

    @Override
    public MediaProvider getProvider() { return MediaProvider.ELEVENLABS; }

    @Override
    public ProviderCapabilities getCapabilities() { return ProviderCapabilities.synchronous(); }

    @Override
    public GenerationStart startGeneration(String model, Map<String, Object> params, String webhookUrl) {
        Object voice = params.get("voice_id");
        String voiceId = voice != null ? voice.toString() : DEFAULT_VOICE_ID;

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", params.get("text"));
        body.put("model_id", MODEL_IDS.getOrDefault(model, model.substring(model.indexOf('/') + 1)));
        Map<String, Object> voiceSettings = new LinkedHashMap<>();
        for (String key : new String[]{"stability", "similarity_boost", "style", "speed"}) {
            if (params.get(key) != null) voiceSettings.put(key, params.get(key));
        }
        if (!voiceSettings.isEmpty()) body.put("voice_settings", voiceSettings);
        if (params.get("language_code") != null) body.put("language_code", params.get("language_code"));

        byte[] audio = synthesize(voiceId, body);
        String jobId = "elevenlabs-" + UUID.randomUUID();
        completedJobs.put(jobId, "data:" + AUDIO_MIME_TYPE + ";base64," + Base64.getEncoder().encodeToString(audio));
        log.info("[ElevenLabs] Synthesized {} bytes for job {}", audio.length, jobId);
        return new GenerationStart(jobId, WaitingStrategy.SYNCHRONOUS);
    }

    private byte[] synthesize(String voiceId, Map<String, Object> body) {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/text-to-speech/" + voiceId + "?output_format=" + OUTPUT_FORMAT))
                    .timeout(REQUEST_TIMEOUT)
                    .header("Content-Type", "application/json")
                    .header("Accept", AUDIO_MIME_TYPE)
                    .header("xi-api-key", apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() != 200) {
                String errorBody = new String(response.body(), StandardCharsets.UTF_8);
                throw new ProviderCallException("ElevenLabs API error " + response.statusCode() + ": " + extractErrorMessage(errorBody));
            }
            return response.body();
        } catch (IOException e) {
            throw new ProviderCallException("ElevenLabs request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderCallException("ElevenLabs request interrupted", e);
        }
    }

    @Override
    public ProviderJobStatus getJobStatus(String providerJobId) {
        String audio = completedJobs.remove(providerJobId);
        return audio != null
                ? ProviderJobStatus.completed(audio)
                : ProviderJobStatus.failed("Unknown ElevenLabs job " + providerJobId);
    }

    @Override
    public Optional<JsonNode> getRawJobResponse(String providerJobId) {
        ObjectNode node = mapper.createObjectNode();
        String audio = completedJobs.remove(providerJobId);
        if (audio == null) {
            node.put("error", "Unknown ElevenLabs job " + providerJobId);
        } else {
            node.put("status", "completed");
            node.put("url", audio);
            node.put("mimeType", AUDIO_MIME_TYPE);
        }
        return Optional.of(node);
    }

    @Override
    protected String authorizationHeader() { return apiKey; }

    @Override
    protected String providerName() { return "ElevenLabs"; }
}
