package com.mediaflow.mediaflow_backend.executor.impl;

import com.mediaflow.mediaflow_backend.executor.DependencyResolver;
import com.mediaflow.mediaflow_backend.executor.ProviderJobExecutor;
import com.mediaflow.mediaflow_backend.executor.ProviderJobRunner;
import com.mediaflow.mediaflow_backend.model.domain.JobType;
import com.mediaflow.mediaflow_backend.model.job.MediaType;
import org.springframework.stereotype.Component;

/** Text/image to video generation (`generate` jobs). */
@Component
public class GenerateVideoExecutor extends ProviderJobExecutor {

    public GenerateVideoExecutor(ProviderJobRunner runner, DependencyResolver dependencyResolver) {
        super(runner, dependencyResolver);
    }

    @Override
    public JobType supportedType() {
        return JobType.GENERATE;
    }

    @Override
    protected MediaType expectedMediaType() {
        return MediaType.VIDEO;
    }
}
