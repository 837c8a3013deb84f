package com.mediaflow.mediaflow_backend.model.job;

import java.util.List;
import java.util.Map;

/** Provider payload normalized by a model parser. */
public record ParseResult(
        ProviderJobState status,
        List<MediaOutput> outputs,
        String error,
        Map<String, Object> metadata
) {

    public static ParseResult completed(List<MediaOutput> outputs, Map<String, Object> metadata) {
        return new ParseResult(ProviderJobState.COMPLETED, List.copyOf(outputs), null, metadata);
    }

    public static ParseResult failed(String error) {
        return new ParseResult(ProviderJobState.FAILED, List.of(), error, Map.of());
    }

    public static ParseResult processing() {
        return new ParseResult(ProviderJobState.PROCESSING, List.of(), null, Map.of());
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
