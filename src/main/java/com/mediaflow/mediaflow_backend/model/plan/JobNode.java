package com.mediaflow.mediaflow_backend.model.plan;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mediaflow.mediaflow_backend.model.domain.JobType;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobNode(
        String id,
        JobType type,
        Map<String, Object> params,
        List<String> dependsOn,
        String output
) {

    public JobNode {
        params = params != null ? params : Map.of();
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        output = output != null ? output : "$" + id;
    }
}
