package com.siat.siat_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Fans flow events out to every instance through one Redis Pub/Sub channel. Every instance,
 * the sender included, forwards what arrives to its own STOMP subscribers, so an event reaches a
 * client exactly once whichever instance it is connected to.
 */
@Slf4j
public class RedisWebSocketBridge implements MessageListener {

    public static final String DEFAULT_CHANNEL = "siat:flow-events";

    @Getter
    private final String channel;
    private final StringRedisTemplate redisTemplate;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;

    public RedisWebSocketBridge(String channel, StringRedisTemplate redisTemplate,
                                SimpMessagingTemplate messagingTemplate, ObjectMapper objectMapper) {
        this.channel = channel != null && !channel.isBlank() ? channel : DEFAULT_CHANNEL;
        this.redisTemplate = redisTemplate;
        this.messagingTemplate = messagingTemplate;
        this.objectMapper = objectMapper;
    }

    public void publish(String destination, Map<String, Object> payload) {
        String envelope;
        try {
            envelope = objectMapper.writeValueAsString(new FlowEventEnvelope(destination, payload));
        } catch (JsonProcessingException e) {
            log.error("[WS] Could not serialize {} event, delivering locally only", destination, e);
            messagingTemplate.convertAndSend(destination, payload);
            return;
        }
        redisTemplate.convertAndSend(channel, envelope);
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        FlowEventEnvelope envelope;
        try {
            envelope = objectMapper.readValue(new String(message.getBody(), StandardCharsets.UTF_8), FlowEventEnvelope.class);
        } catch (IOException e) {
            log.warn("[WS] Dropping malformed message on {}: {}", channel, e.getMessage());
            return;
        }
        if (envelope.destination() == null || !envelope.destination().startsWith(FlowEventPublisher.TOPIC)) {
            log.warn("[WS] Dropping message for unexpected destination {}", envelope.destination());
            return;
        }
        messagingTemplate.convertAndSend(envelope.destination(), envelope.payload());
    }

    record FlowEventEnvelope(String destination, Map<String, Object> payload) {}
}
