package com.mediaflow.mediaflow_backend.config;

import com.mediaflow.mediaflow_backend.engine.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool that runs claimed jobs. Poll loops block a worker thread, so the pool is kept
 * separate from the scheduler threads used by the reaper and webhook retries.
 */
@Slf4j
@EnableAsync
@EnableScheduling
@Configuration
public class WorkerPoolConfig {

    public static final String JOB_WORKER_EXECUTOR = "jobWorkerExecutor";

    @Bean(name = JOB_WORKER_EXECUTOR)
    public ThreadPoolTaskExecutor jobWorkerExecutor(MediaflowProperties properties) {
        MediaflowProperties.Worker worker = properties.getWorker();
        int coreSize = Math.max(worker.getCoreSize(), 1);
        int maxSize = Math.max(worker.getMaxSize(), coreSize);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(Math.max(worker.getQueueCapacity(), 0));
        executor.setThreadNamePrefix(worker.getThreadNamePrefix());
        // never run a job on the submitting request or webhook thread; the orchestrator fails rejected jobs
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        log.info("[Worker] Job worker pool ready: core={}, max={}, queue={}", coreSize, maxSize, worker.getQueueCapacity());
        return executor;
    }

    @Bean
    public Sleeper sleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
