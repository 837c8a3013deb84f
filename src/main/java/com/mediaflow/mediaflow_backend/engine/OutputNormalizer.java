package com.mediaflow.mediaflow_backend.engine;

import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.MediaOutput;
import com.mediaflow.mediaflow_backend.storage.MediaStorage;
import com.mediaflow.mediaflow_backend.storage.StorageUploadException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Moves inline provider payloads ({@code data:} URIs) into storage so that every completed output
 * is addressable by URL. Remote {@code http(s)} URLs pass through untouched; anything else is
 * rejected.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutputNormalizer {

    static final Map<String, String> EXTENSIONS = Map.ofEntries(
            Map.entry("video/mp4", "mp4"),
            Map.entry("video/webm", "webm"),
            Map.entry("video/quicktime", "mov"),
            Map.entry("audio/mpeg", "mp3"),
            Map.entry("audio/mp3", "mp3"),
            Map.entry("audio/wav", "wav"),
            Map.entry("audio/x-wav", "wav"),
            Map.entry("audio/ogg", "ogg"),
            Map.entry("image/jpeg", "jpg"),
            Map.entry("image/jpg", "jpg"),
            Map.entry("image/png", "png"),
            Map.entry("image/webp", "webp"),
            Map.entry("image/gif", "gif"));

    private final MediaStorage storage;

    public List<MediaOutput> normalize(UUID executionId, String jobId, List<MediaOutput> outputs) {
        List<MediaOutput> normalized = new ArrayList<>(outputs.size());
        for (int i = 0; i < outputs.size(); i++) {
            MediaOutput output = outputs.get(i);
            if (isRemote(output.url())) {
                normalized.add(output);
                continue;
            }
            if (!isInline(output.url())) {
                throw new JobFailureException(JobErrorKind.EXTRACTION, "Output of job " + jobId
                        + " is neither an http(s) URL nor a data URI: " + abbreviate(output.url()));
            }
            String mimeType = output.mimeType() != null ? output.mimeType() : output.type().getDefaultMimeType();
            String data = output.url();
            int comma = data.indexOf(',');
            if (comma < 0) {
                throw new StorageUploadException("Malformed data URI in output of job " + jobId);
            }
            String header = data.substring(5, comma);
            int semicolon = header.indexOf(';');
            String declared = semicolon >= 0 ? header.substring(0, semicolon) : header;
            if (!declared.isBlank()) mimeType = declared;
            data = data.substring(comma + 1);
            byte[] bytes;
            try {
                bytes = Base64.getMimeDecoder().decode(data);
            } catch (IllegalArgumentException e) {
                throw new StorageUploadException("Output of job " + jobId + " is not valid base64", e);
            }
            String suffix = i == 0 ? "" : "-" + i;
            String path = "executions/" + executionId + "/" + jobId + suffix + "." + extensionFor(mimeType, output);
            String url = storage.upload(path, bytes, mimeType);
            log.info("[Outputs] Uploaded inline {} output of {} ({} bytes) to {}", output.type().getId(), jobId, bytes.length, url);
            normalized.add(output.withUrl(url, mimeType));
        }
        return normalized;
    }

    static boolean isRemote(String url) {
        return url != null && (url.startsWith("http://") || url.startsWith("https://"));
    }

    static boolean isInline(String url) {
        return url != null && url.startsWith("data:");
    }

    private static String abbreviate(String value) {
        if (value == null) return "null";
        return value.length() > 40 ? value.substring(0, 40) + "..." : value;
    }

    static String extensionFor(String mimeType, MediaOutput output) {
        String ext = mimeType != null ? EXTENSIONS.get(mimeType.toLowerCase()) : null;
        if (ext != null) return ext;
        return output.type() != null ? output.type().getDefaultExtension() : "bin";
    }
}
