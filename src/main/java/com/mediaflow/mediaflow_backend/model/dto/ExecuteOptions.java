package com.mediaflow.mediaflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecuteOptions(
        String webhook,
        String webhookSecret,
        String baseExecutionId,
        Map<String, String> providerApiKeys
) {

    public static ExecuteOptions none() {
        return new ExecuteOptions(null, null, null, null);
    }
}
