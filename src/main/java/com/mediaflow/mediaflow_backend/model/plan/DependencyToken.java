package com.mediaflow.mediaflow_backend.model.plan;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Placeholder written into a job param where a nested operation used to be, e.g.
 * {@code _imageJobDependency:job1}. Replaced by the dependency's output URL when the job runs.
 */
public record DependencyToken(String mediaKey, String jobId) {

    private static final Pattern TOKEN = Pattern.compile("^_(image|audio|video)JobDependency:(\\S+)$");

    public static String format(String mediaKey, String jobId) {
        return "_" + mediaKey + "JobDependency:" + jobId;
    }

    public static Optional<DependencyToken> parse(Object value) {
        if (!(value instanceof String s)) return Optional.empty();
        Matcher m = TOKEN.matcher(s);
        return m.matches() ? Optional.of(new DependencyToken(m.group(1), m.group(2))) : Optional.empty();
    }

    @Override
    public String toString() {
        return format(mediaKey, jobId);
    }
}
