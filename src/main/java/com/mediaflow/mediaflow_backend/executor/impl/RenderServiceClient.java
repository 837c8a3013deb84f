package com.mediaflow.mediaflow_backend.executor.impl;

import com.mediaflow.mediaflow_backend.config.MediaflowProperties;
import com.mediaflow.mediaflow_backend.engine.JobFailureException;
import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the ffmpeg render service that merges clips, burns subtitles, keys out green screens
 * and extracts audio tracks. Responses of the render endpoints are the finished media bytes.
 */
@Slf4j
@Component
public class RenderServiceClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public RenderServiceClient(RestTemplateBuilder builder, MediaflowProperties properties) {
        this.restTemplate = builder
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(properties.getRender().getTimeout())
                .build();
        String url = properties.getRender().getUrl();
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public byte[] merge(List<String> videoUrls, String transition, double transitionDuration) {
        List<Map<String, Object>> videos = new ArrayList<>();
        videoUrls.forEach(url -> videos.add(Map.of("url", url)));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("videos", videos);
        body.put("transition", Map.of("type", transition, "duration", transitionDuration));
        return post("/merge", body, byte[].class);
    }

    public String generateSubtitles(List<?> words, Map<String, Object> style) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("words", words);
        if (style != null) {
            body.put("preset", style.get("preset"));
            body.put("overrides", style);
        }
        body.put("videoWidth", 1080);
        body.put("videoHeight", 1920);
        Map<?, ?> response = post("/generate-subtitles", body, Map.class);
        Object content = response != null ? response.get("subtitleContent") : null;
        if (!(content instanceof String s) || s.isBlank()) {
            throw new JobFailureException(JobErrorKind.PROVIDER, "Render service returned no subtitle content");
        }
        return s;
    }

    public byte[] burnSubtitles(String videoUrl, String subtitleContent) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("videoUrl", videoUrl);
        body.put("subtitleContent", subtitleContent);
        body.put("subtitleFormat", "ass");
        return post("/burn-subtitles", body, byte[].class);
    }

    /** mp3 soundtrack of the video at {@code videoUrl}. */
    public byte[] extractAudio(String videoUrl) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("videoUrl", videoUrl);
        body.put("outputFormat", "mp3");
        body.put("audioCodec", "libmp3lame");
        body.put("audioBitrate", "192k");
        return post("/convert", body, byte[].class);
    }

    /**
     * Keys {@code chromaKeyColor} out of the video and fills it with the backgrounds, which are used
     * in turn when more than one is given. Null tuning values are left to the render service.
     */
    public byte[] replaceGreenScreen(String videoUrl, List<String> backgroundUrls, String chromaKeyColor,
                                     Double similarity, Double blend) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("videoUrl", videoUrl);
        body.put("backgroundUrls", backgroundUrls);
        if (chromaKeyColor != null) body.put("chromaKeyColor", chromaKeyColor);
        if (similarity != null) body.put("similarity", similarity);
        if (blend != null) body.put("blend", blend);
        return post("/replace-green-screen", body, byte[].class);
    }

    /** Word-level transcript published as a JSON array at {@code url}. */
    public List<?> fetchTranscript(String url) {
        try {
            Object body = restTemplate.getForObject(url, Object.class);
            if (body instanceof List<?> words) {
                return words;
            }
            throw new JobFailureException(JobErrorKind.VALIDATION, "Transcript at " + url + " is not a JSON array");
        } catch (RestClientException e) {
            throw new JobFailureException(JobErrorKind.EXTRACTION, "Failed to fetch transcript: " + e.getMessage(), e);
        }
    }

    private <T> T post(String path, Map<String, Object> body, Class<T> responseType) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String url = baseUrl + path;
        log.debug("[Render] POST {}", url);
        try {
            T response = restTemplate.postForObject(url, new HttpEntity<>(body, headers), responseType);
            if (response == null) {
                throw new JobFailureException(JobErrorKind.PROVIDER, "Render service " + path + " returned an empty body");
            }
            return response;
        } catch (HttpStatusCodeException e) {
            throw new JobFailureException(JobErrorKind.PROVIDER, "Render service " + path + " failed: "
                    + e.getStatusCode().value() + " - " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new JobFailureException(JobErrorKind.PROVIDER, "Render service " + path + " unreachable: " + e.getMessage(), e);
        }
    }
}
