package com.mediaflow.mediaflow_backend.executor.impl;

import com.mediaflow.mediaflow_backend.executor.DependencyResolver;
import com.mediaflow.mediaflow_backend.executor.JobContext;
import com.mediaflow.mediaflow_backend.executor.ProviderJobExecutor;
import com.mediaflow.mediaflow_backend.executor.ProviderJobRunner;
import com.mediaflow.mediaflow_backend.model.domain.JobType;
import com.mediaflow.mediaflow_backend.model.job.MediaType;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class RemoveImageBackgroundExecutor extends ProviderJobExecutor {

    public RemoveImageBackgroundExecutor(ProviderJobRunner runner, DependencyResolver dependencyResolver) {
        super(runner, dependencyResolver);
    }

    @Override
    public JobType supportedType() {
        return JobType.REMOVE_IMAGE_BACKGROUND;
    }

    @Override
    protected MediaType expectedMediaType() {
        return MediaType.IMAGE;
    }

    @Override
    protected Map<String, Object> prepareParams(JobContext context, Map<String, Object> params) {
        return RemoveBackgroundExecutor.moveIntoUnified(context, params, "image");
    }
}
