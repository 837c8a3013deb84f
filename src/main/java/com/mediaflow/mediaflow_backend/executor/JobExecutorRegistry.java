package com.mediaflow.mediaflow_backend.executor;

import com.mediaflow.mediaflow_backend.model.domain.JobType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class JobExecutorRegistry {

    private final List<JobExecutor> executors;
    private final Map<JobType, JobExecutor> registry = new EnumMap<>(JobType.class);

    @PostConstruct
    public void init() {
        executors.forEach(executor -> registry.put(executor.supportedType(), executor));
    }

    public JobExecutor get(JobType type) {
        JobExecutor executor = registry.get(type);
        if (executor == null) {
            throw new UnsupportedOperationException("No executor registered for job type: " + type.getWireName());
        }
        return executor;
    }

    public boolean isSupported(JobType type) {
        return registry.containsKey(type);
    }
}
