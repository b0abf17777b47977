package com.siat.siat_backend.engine;

import com.siat.siat_backend.FlowStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Component
public class FlowEventPublisher {

    // Clients subscribe to /topic/siat/flows/{flowId} for status and execution updates
    public static final String TOPIC = "/topic/siat/flows/";

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectProvider<RedisWebSocketBridge> redisBridgeProvider;

    public FlowEventPublisher(SimpMessagingTemplate messagingTemplate,
                              ObjectProvider<RedisWebSocketBridge> redisBridgeProvider) {
        this.messagingTemplate = messagingTemplate;
        this.redisBridgeProvider = redisBridgeProvider;
    }

    public void statusChanged(UUID flowId, FlowStatus status, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", "status");
        payload.put("flowId", flowId.toString());
        payload.put("status", status.name());
        payload.put("error", error != null ? error : "");
        publish(flowId, payload);
    }

    public void executionFinished(UUID flowId, UUID executionId, boolean success, long duration) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", "execution");
        payload.put("flowId", flowId.toString());
        payload.put("executionId", executionId.toString());
        payload.put("success", success);
        payload.put("duration", duration);
        publish(flowId, payload);
    }

    private void publish(UUID flowId, Map<String, Object> payload) {
        payload.put("timestamp", Instant.now().toString());
        String destination = TOPIC + flowId;
        RedisWebSocketBridge bridge = redisBridgeProvider.getIfAvailable();
        log.debug("[WS] {} -> {} via {}", payload.get("event"), destination, bridge != null ? "Redis" : "Direct");
        if (bridge != null) {
            bridge.publish(destination, payload);
        } else {
            messagingTemplate.convertAndSend(destination, payload);
        }
    }
}
