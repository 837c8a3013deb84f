package com.mediaflow.mediaflow_backend.executor;

import com.mediaflow.mediaflow_backend.model.plan.DependencyToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Replaces {@code _<media>JobDependency:<jobId>} tokens anywhere in a job's params with the URL
 * produced by the referenced job. Nested maps and lists are walked; other values pass through.
 */
@Slf4j
@Component
public class DependencyResolver {

    // Tried in order when a dependency result is not a plain string
    static final List<String> URL_KEYS = List.of("image", "url", "output", "imageUrl");

    public Map<String, Object> resolve(Map<String, Object> params, Map<String, Map<String, Object>> dependencyResults) {
        if (params == null) return new LinkedHashMap<>();
        Map<String, Object> resolved = new LinkedHashMap<>();
        params.forEach((key, value) -> resolved.put(key, resolveValue(value, dependencyResults)));
        return resolved;
    }

    @SuppressWarnings("unchecked")
    private Object resolveValue(Object value, Map<String, Map<String, Object>> dependencyResults) {
        if (value instanceof Map<?, ?> map) {
            return resolve((Map<String, Object>) map, dependencyResults);
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            list.forEach(item -> out.add(resolveValue(item, dependencyResults)));
            return out;
        }
        Optional<DependencyToken> token = DependencyToken.parse(value);
        if (token.isEmpty()) {
            return value;
        }
        DependencyToken dep = token.get();
        if (!dependencyResults.containsKey(dep.jobId())) {
            throw new DependencyResolutionException("Dependency " + dep.jobId() + " has no result");
        }
        String url = extractUrl(dependencyResults.get(dep.jobId()));
        if (url == null) {
            throw new DependencyResolutionException("Could not extract " + dep.mediaKey()
                    + " URL from result of job " + dep.jobId());
        }
        log.debug("[Dependencies] {} -> {}", dep, url);
        return url;
    }

    /** URL carried by a job result, or null. */
    public static String extractUrl(Object result) {
        if (result == null) return null;
        if (result instanceof String s) {
            return s.isBlank() ? null : s;
        }
        if (result instanceof Map<?, ?> map) {
            for (String key : URL_KEYS) {
                if (map.get(key) instanceof String s && !s.isBlank()) {
                    return s;
                }
            }
        }
        return null;
    }
}
