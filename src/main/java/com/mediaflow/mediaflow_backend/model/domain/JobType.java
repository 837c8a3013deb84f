package com.mediaflow.mediaflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/** Job kinds as they appear in the execution plan's {@code type} field. */
public enum JobType {

    GENERATE("generate"),
    GENERATE_IMAGE("generateImage"),
    GENERATE_AUDIO("generateAudio"),
    MERGE("merge"),
    ADD_SUBTITLES("addSubtitles"),
    REMOVE_BACKGROUND("removeBackground"),
    REMOVE_IMAGE_BACKGROUND("removeImageBackground"),
    TRANSCRIBE("transcribe"),
    REPLACE_GREEN_SCREEN("replaceGreenScreen");

    private final String wireName;

    JobType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() { return wireName; }

    @JsonCreator
    public static JobType fromWire(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown job type: " + value));
    }
}
