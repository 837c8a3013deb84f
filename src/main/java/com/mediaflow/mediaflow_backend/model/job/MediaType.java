package com.mediaflow.mediaflow_backend.model.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MediaType {

    VIDEO("video", "video/mp4", "mp4"),
    IMAGE("image", "image/png", "png"),
    AUDIO("audio", "audio/mpeg", "mp3"),
    TEXT("text", "application/json", "json");

    private final String id;
    private final String defaultMimeType;
    private final String defaultExtension;

    MediaType(String id, String defaultMimeType, String defaultExtension) {
        this.id = id;
        this.defaultMimeType = defaultMimeType;
        this.defaultExtension = defaultExtension;
    }

    @JsonValue
    public String getId() { return id; }
    public String getDefaultMimeType() { return defaultMimeType; }
    public String getDefaultExtension() { return defaultExtension; }

    @JsonCreator
    public static MediaType fromId(String value) {
        for (MediaType type : values()) {
            if (type.id.equalsIgnoreCase(value)) return type;
        }
        throw new IllegalArgumentException("Unknown media type: " + value);
    }
}
