package com.siat.siat_backend.generator.llm;

import com.siat.siat_backend.model.domain.LlmProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Looks up the client bean for a provider. Providers without a client are simply skipped by callers. */
@Slf4j
@Component
public class LlmClientFactory {

    private final Map<LlmProvider, LlmClient> clients = new EnumMap<>(LlmProvider.class);

    public LlmClientFactory(List<LlmClient> clientBeans) {
        clientBeans.forEach(client -> {
            LlmClient previous = clients.put(client.getProvider(), client);
            if (previous != null) {
                log.warn("[LLM] {} registered twice, keeping {}", client.getProvider(), client.getClass().getSimpleName());
            }
        });
    }

    public Optional<LlmClient> find(LlmProvider provider) {
        return Optional.ofNullable(clients.get(provider));
    }
}
