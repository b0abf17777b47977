package com.siat.siat_backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.siat.siat_backend.engine.RedisWebSocketBridge;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/** Wires the flow-event bridge only when Redis fan-out is switched on. */
@Configuration
@ConditionalOnProperty(name = "siat.websocket.redis-bridge", havingValue = "true")
public class RedisWebSocketConfig {

    @Bean
    public RedisWebSocketBridge redisWebSocketBridge(@Value("${siat.websocket.redis-channel:" + RedisWebSocketBridge.DEFAULT_CHANNEL + "}") String channel,
                                                     StringRedisTemplate redisTemplate,
                                                     SimpMessagingTemplate messagingTemplate,
                                                     ObjectMapper objectMapper) {
        return new RedisWebSocketBridge(channel, redisTemplate, messagingTemplate, objectMapper);
    }

    @Bean
    public RedisMessageListenerContainer siatEventListenerContainer(RedisConnectionFactory connectionFactory,
                                                                    RedisWebSocketBridge bridge) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(bridge, new ChannelTopic(bridge.getChannel()));
        return container;
    }
}
