package com.mediaflow.mediaflow_backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediaflow.mediaflow_backend.engine.RedisWebSocketBridge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Cross-instance event fan-out. Each execution publishes on its own Redis channel and every instance
 * subscribes to the whole pattern, forwarding to its locally connected STOMP clients.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "spring.data.redis", name = "url")
@ConditionalOnBean(RedisConnectionFactory.class)
public class RedisWebSocketConfig {

    @Bean
    public RedisWebSocketBridge redisWebSocketBridge(StringRedisTemplate redisTemplate,
                                                     SimpMessagingTemplate messagingTemplate,
                                                     ObjectMapper objectMapper) {
        return new RedisWebSocketBridge(redisTemplate, messagingTemplate, objectMapper);
    }

    @Bean
    public RedisMessageListenerContainer executionEventListenerContainer(RedisConnectionFactory connectionFactory,
                                                                         RedisWebSocketBridge bridge) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(bridge, new PatternTopic(RedisWebSocketBridge.CHANNEL_PREFIX + "*"));
        container.setErrorHandler(e -> log.warn("[Events] Redis listener error: {}", e.getMessage()));
        return container;
    }
}
