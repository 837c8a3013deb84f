package com.mediaflow.mediaflow_backend.executor.impl;

import com.mediaflow.mediaflow_backend.engine.JobFailureException;
import com.mediaflow.mediaflow_backend.executor.DependencyResolver;
import com.mediaflow.mediaflow_backend.executor.JobContext;
import com.mediaflow.mediaflow_backend.executor.ProviderJobExecutor;
import com.mediaflow.mediaflow_backend.executor.ProviderJobRunner;
import com.mediaflow.mediaflow_backend.model.domain.JobType;
import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.MediaType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Video background removal. The source video comes from {@code video} or, when absent, from the
 * first dependency; it is passed through the model's unified mapping.
 */
@Component
public class RemoveBackgroundExecutor extends ProviderJobExecutor {

    public RemoveBackgroundExecutor(ProviderJobRunner runner, DependencyResolver dependencyResolver) {
        super(runner, dependencyResolver);
    }

    @Override
    public JobType supportedType() {
        return JobType.REMOVE_BACKGROUND;
    }

    @Override
    protected MediaType expectedMediaType() {
        return MediaType.VIDEO;
    }

    @Override
    protected Map<String, Object> prepareParams(JobContext context, Map<String, Object> params) {
        return moveIntoUnified(context, params, "video", "outputType");
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> moveIntoUnified(JobContext context, Map<String, Object> params, String inputField, String... passThrough) {
        Map<String, Object> prepared = new LinkedHashMap<>(params);
        Map<String, Object> unified = prepared.get("unified") instanceof Map<?, ?> existing
                ? new LinkedHashMap<>((Map<String, Object>) existing)
                : new LinkedHashMap<>();

        Object input = prepared.remove(inputField);
        if (input == null) input = unified.get(inputField);
        if (input == null) {
            List<String> urls = context.dependencyUrls();
            input = urls.isEmpty() ? null : urls.get(0);
        }
        if (input == null) {
            throw new JobFailureException(JobErrorKind.VALIDATION,
                    inputField + " is required either in params or from dependencies");
        }
        unified.put(inputField, input);
        for (String field : passThrough) {
            Object value = prepared.remove(field);
            if (value != null) unified.put(field, value);
        }
        prepared.put("unified", unified);
        return prepared;
    }
}
