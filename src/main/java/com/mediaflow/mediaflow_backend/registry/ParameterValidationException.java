package com.mediaflow.mediaflow_backend.registry;

import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.JobException;

import java.util.List;

/** Params rejected by a model schema. Never retried; the job fails without contacting the provider. */
public class ParameterValidationException extends JobException {

    private final String modelId;
    private final List<String> violations;

    public ParameterValidationException(String modelId, List<String> violations) {
        super("Parameter validation failed for model " + modelId + ": " + String.join("; ", violations));
        this.modelId = modelId;
        this.violations = List.copyOf(violations);
    }

    public String getModelId() { return modelId; }

    /** One entry per offending field, formatted {@code field: problem}. */
    public List<String> getViolations() { return violations; }

    @Override
    public JobErrorKind getKind() {
        return JobErrorKind.VALIDATION;
    }
}
