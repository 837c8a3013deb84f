package com.mediaflow.mediaflow_backend.registry.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Pattern;

import java.util.LinkedHashMap;
import java.util.Map;

/** veed/fabric-1.0 and veed/fabric-1.0/fast (talking-head lip sync) */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FabricOptions(
        @Pattern(regexp = HTTP_URL, message = "must be an http(s) URL") String image,
        @JsonProperty("image_url") @Pattern(regexp = HTTP_URL, message = "must be an http(s) URL") String imageUrl,
        @Pattern(regexp = HTTP_URL, message = "must be an http(s) URL") String audio,
        @JsonProperty("audio_url") @Pattern(regexp = HTTP_URL, message = "must be an http(s) URL") String audioUrl,
        @Pattern(regexp = "720p|480p", message = "must be 720p or 480p") String resolution
) implements ModelOptions {

    @JsonIgnore
    @AssertTrue(message = "image or image_url is required")
    public boolean isImageProvided() {
        return image != null || imageUrl != null;
    }

    @JsonIgnore
    @AssertTrue(message = "audio or audio_url is required")
    public boolean isAudioProvided() {
        return audio != null || audioUrl != null;
    }

    // fal only understands the *_url names
    @Override
    public Map<String, Object> toPayload(ObjectMapper mapper) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("image_url", imageUrl != null ? imageUrl : image);
        payload.put("audio_url", audioUrl != null ? audioUrl : audio);
        payload.put("resolution", resolution != null ? resolution : "720p");
        return payload;
    }
}
