package com.mediaflow.mediaflow_backend.model.job;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MediaOutput(
        MediaType type,
        String url,
        String mimeType,
        Double duration,
        Integer width,
        Integer height
) {

    public static MediaOutput of(MediaType type, String url, String mimeType) {
        return new MediaOutput(type, url, mimeType, null, null, null);
    }

    public MediaOutput withUrl(String newUrl, String newMimeType) {
        return new MediaOutput(type, newUrl, newMimeType, duration, width, height);
    }
}
