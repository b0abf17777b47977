package com.siat.siat_backend.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.siat.siat_backend.FlowStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FlowEventPublisherTest {

    @Mock SimpMessagingTemplate messagingTemplate;
    @Mock StringRedisTemplate redisTemplate;
    @Mock ObjectProvider<RedisWebSocketBridge> bridgeProvider;

    private final ObjectMapper mapper = new ObjectMapper();
    private final UUID flowId = UUID.randomUUID();

    @Test
    @SuppressWarnings("unchecked")
    void withoutBridgeEventsGoToTheLocalBroker() {
        when(bridgeProvider.getIfAvailable()).thenReturn(null);
        FlowEventPublisher publisher = new FlowEventPublisher(messagingTemplate, bridgeProvider);

        publisher.statusChanged(flowId, FlowStatus.ERROR, "boom");

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq(FlowEventPublisher.TOPIC + flowId), payload.capture());
        assertThat((Map<String, Object>) payload.getValue())
                .containsEntry("event", "status")
                .containsEntry("status", "ERROR")
                .containsEntry("error", "boom")
                .containsKey("timestamp");
    }

    @Test
    void withBridgeEventsGoThroughRedis() {
        RedisWebSocketBridge bridge = new RedisWebSocketBridge("chan", redisTemplate, messagingTemplate, mapper);
        when(bridgeProvider.getIfAvailable()).thenReturn(bridge);
        FlowEventPublisher publisher = new FlowEventPublisher(messagingTemplate, bridgeProvider);

        publisher.executionFinished(flowId, UUID.randomUUID(), true, 12);

        ArgumentCaptor<String> envelope = ArgumentCaptor.forClass(String.class);
        verify(redisTemplate).convertAndSend(eq("chan"), envelope.capture());
        assertThat(envelope.getValue()).contains(FlowEventPublisher.TOPIC + flowId).contains("\"event\":\"execution\"");
        verify(messagingTemplate, never()).convertAndSend(anyString(), any(Object.class));
    }

    @Test
    void bridgeForwardsReceivedEventsAndDropsStrangers() {
        RedisWebSocketBridge bridge = new RedisWebSocketBridge(null, redisTemplate, messagingTemplate, mapper);
        String destination = FlowEventPublisher.TOPIC + flowId;

        bridge.onMessage(message("{\"destination\":\"" + destination + "\",\"payload\":{\"event\":\"status\"}}"), null);
        bridge.onMessage(message("{\"destination\":\"/topic/other\",\"payload\":{}}"), null);
        bridge.onMessage(message("not json"), null);

        assertThat(bridge.getChannel()).isEqualTo(RedisWebSocketBridge.DEFAULT_CHANNEL);
        verify(messagingTemplate).convertAndSend(destination, (Object) Map.of("event", "status"));
        verify(messagingTemplate, never()).convertAndSend(eq("/topic/other"), any(Object.class));
    }

    private static DefaultMessage message(String body) {
        return new DefaultMessage("chan".getBytes(StandardCharsets.UTF_8), body.getBytes(StandardCharsets.UTF_8));
    }
}
