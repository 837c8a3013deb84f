package com.mediaflow.mediaflow_backend.config;

import com.mediaflow.mediaflow_backend.engine.PollingPolicy;
import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;
import com.mediaflow.mediaflow_backend.model.job.MediaType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "mediaflow")
public class MediaflowProperties {

    /** Public base URL of this service; provider webhooks are disabled when empty. */
    private String apiBaseUrl = "";

    /** Keyed by provider id: replicate, fal, elevenlabs. */
    private Map<String, Provider> providers = new HashMap<>();

    private Worker worker = new Worker();
    private Polling polling = new Polling();
    private Jobs jobs = new Jobs();
    private Storage storage = new Storage();
    private Render render = new Render();
    private Webhook webhook = new Webhook();
    private Usage usage = new Usage();

    public Provider provider(MediaProvider provider) {
        return providers.getOrDefault(provider.getId(), new Provider());
    }

    public String baseUrlFor(MediaProvider provider) {
        String configured = provider(provider).getBaseUrl();
        return configured != null && !configured.isBlank() ? configured : provider.getDefaultBaseUrl();
    }

    @Data
    public static class Provider {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class Worker {
        private int coreSize = 8;
        private int maxSize = 32;
        private int queueCapacity = 500;
        private String threadNamePrefix = "job-worker-";
    }

    @Data
    public static class Polling {
        private PollingPolicy audio = new PollingPolicy(Duration.ofSeconds(1), 30);
        private PollingPolicy image = new PollingPolicy(Duration.ofSeconds(2), 60);
        private PollingPolicy video = new PollingPolicy(Duration.ofSeconds(2), 60);
        private PollingPolicy text = new PollingPolicy(Duration.ofSeconds(2), 60);

        public PollingPolicy forMediaType(MediaType type) {
            return switch (type) {
                case AUDIO -> audio;
                case IMAGE -> image;
                case VIDEO -> video;
                case TEXT -> text;
            };
        }
    }

    @Data
    public static class Jobs {
        /** How long a job may wait for a provider webhook before it is failed. */
        private Duration webhookTimeout = Duration.ofMinutes(30);
        private long reaperIntervalMs = 60_000;
    }

    @Data
    public static class Storage {
        private String root = "./media";
        private String publicBaseUrl = "http://localhost:8080/media";
    }

    @Data
    public static class Render {
        private String url = "http://localhost:8090";
        private Duration timeout = Duration.ofMinutes(10);
    }

    @Data
    public static class Webhook {
        private int maxAttempts = 5;
        private long retryIntervalMs = 30_000;
        private Duration timeout = Duration.ofSeconds(10);
        /** Per-job webhooks are retried in place, doubling the delay each time. */
        private int jobMaxAttempts = 3;
        private Duration jobRetryDelay = Duration.ofSeconds(5);
    }

    @Data
    public static class Usage {
        /** Completed jobs per organization per month; 0 disables the limit. */
        private long monthlyJobLimit = 0;
    }
}
