package com.mediaflow.mediaflow_backend.executor;

import com.mediaflow.mediaflow_backend.model.job.MediaType;

import java.util.Map;

/** Base for job types that are served by a registered provider model. */
public abstract class ProviderJobExecutor implements JobExecutor {

    private final ProviderJobRunner runner;
    private final DependencyResolver dependencyResolver;

    protected ProviderJobExecutor(ProviderJobRunner runner, DependencyResolver dependencyResolver) {
        this.runner = runner;
        this.dependencyResolver = dependencyResolver;
    }

    protected abstract MediaType expectedMediaType();

    /** Hook for job types that rewrite their params before validation. */
    protected Map<String, Object> prepareParams(JobContext context, Map<String, Object> params) {
        return params;
    }

    @Override
    public JobOutcome execute(JobContext context) {
        Map<String, Object> params = dependencyResolver.resolve(context.job().getParams(), context.dependencyResults());
        return runner.run(context, prepareParams(context, params), expectedMediaType());
    }
}
