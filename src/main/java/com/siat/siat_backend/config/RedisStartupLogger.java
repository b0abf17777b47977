package com.siat.siat_backend.config;

import com.siat.siat_backend.engine.RedisWebSocketBridge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Reports at startup which path flow events take: Redis fan-out or the local broker only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisStartupLogger implements ApplicationRunner {

    private final Environment env;
    private final ObjectProvider<RedisWebSocketBridge> bridgeProvider;

    @Override
    public void run(ApplicationArguments args) {
        RedisWebSocketBridge bridge = bridgeProvider.getIfAvailable();
        if (bridge != null) {
            log.info("[WS] Redis bridge active: flow events fan out on channel {}", bridge.getChannel());
            return;
        }
        String redisUrl = env.getProperty("spring.data.redis.url", "");
        String reason = redisUrl.isBlank()
                ? "spring.data.redis.url not set"
                : "siat.websocket.redis-bridge is off";
        log.warn("[WS] Flow events use the local broker only (single instance). Reason: {}", reason);
    }
}
