package com.mediaflow.mediaflow_backend.config;

import com.mediaflow.mediaflow_backend.engine.RedisWebSocketBridge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Logs at startup whether execution events fan out through Redis or stay on this instance.
 */
@Slf4j
@Component
public class RedisStartupLogger implements ApplicationRunner {

    private final Environment env;
    private final ObjectProvider<RedisWebSocketBridge> bridgeProvider;

    public RedisStartupLogger(Environment env, ObjectProvider<RedisWebSocketBridge> bridgeProvider) {
        this.env = env;
        this.bridgeProvider = bridgeProvider;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (bridgeProvider.getIfAvailable() != null) {
            log.info("[Events] Redis bridge active on channels {}*", RedisWebSocketBridge.CHANNEL_PREFIX);
            return;
        }
        String redisUrl = env.getProperty("spring.data.redis.url", "");
        String reason = redisUrl.isEmpty()
                ? "spring.data.redis.url (REDIS_URL) not set"
                : "Redis connection factory unavailable";
        log.warn("[Events] Execution events are delivered by this instance only. Reason: {}", reason);
    }
}
