package com.mediaflow.mediaflow_backend.executor;

import com.mediaflow.mediaflow_backend.model.domain.Execution;
import com.mediaflow.mediaflow_backend.model.domain.ExecutionJob;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * What an executor sees of its job.
 *
 * @param dependencyResults results of completed jobs keyed by plan job id, including jobs of the
 *                          base execution
 */
public record JobContext(
        Execution execution,
        ExecutionJob job,
        Map<String, Map<String, Object>> dependencyResults,
        ProgressReporter progress
) {

    /** URLs of this job's declared dependencies, in declaration order; dependencies without a URL are skipped. */
    public List<String> dependencyUrls() {
        List<String> urls = new ArrayList<>();
        for (String dep : job.getDependsOn()) {
            String url = DependencyResolver.extractUrl(dependencyResults.get(dep));
            if (url != null) urls.add(url);
        }
        return urls;
    }
}
