package com.mediaflow.mediaflow_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;

/**
 * Relays execution events between instances. An event for execution {@code X} travels on the Redis
 * channel {@code mediaflow:execution:X}; the receiving side maps the channel back to
 * {@code /topic/execution/X}.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisWebSocketBridge implements MessageListener {

    public static final String CHANNEL_PREFIX = "mediaflow:execution:";

    private static final TypeReference<Map<String, Object>> PAYLOAD = new TypeReference<>() {};

    private final StringRedisTemplate redisTemplate;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;

    public void publish(UUID executionId, Map<String, Object> payload) {
        try {
            redisTemplate.convertAndSend(CHANNEL_PREFIX + executionId, objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            log.error("[Events] Failed to serialize {} for execution {}", payload.get("event"), executionId, e);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String channel = new String(message.getChannel(), StandardCharsets.UTF_8);
        if (!channel.startsWith(CHANNEL_PREFIX)) {
            log.debug("[Events] Ignoring message on {}", channel);
            return;
        }
        String destination = ExecutionEventPublisher.TOPIC_PREFIX + channel.substring(CHANNEL_PREFIX.length());
        try {
            Map<String, Object> payload = objectMapper.readValue(message.getBody(), PAYLOAD);
            messagingTemplate.convertAndSend(destination, payload);
        } catch (IOException e) {
            log.error("[Events] Dropped unreadable event on {}", channel, e);
        }
    }
}
