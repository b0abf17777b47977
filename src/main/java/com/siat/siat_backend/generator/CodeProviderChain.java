package com.siat.siat_backend.generator;

import com.siat.siat_backend.generator.llm.LlmClient;
import com.siat.siat_backend.generator.llm.LlmClientFactory;
import com.siat.siat_backend.model.domain.LlmProvider;
import com.siat.siat_backend.model.domain.LlmProviderConfig;
import com.siat.siat_backend.model.generation.ScaffoldedModule;
import com.siat.siat_backend.model.llm.LlmRequest;
import com.siat.siat_backend.model.llm.LlmResponse;
import com.siat.siat_backend.repository.LlmProviderConfigRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Primary provider, then fallback provider, then local templates. A remote provider only takes
 * part when an enabled key is stored for it; failures and blank replies fall through.
 */
@Slf4j
@Component
public class CodeProviderChain {

    public static final String LOCAL = "LOCAL";

    private final LlmClientFactory clientFactory;
    private final LlmProviderConfigRepository providerConfigRepo;
    private final LocalCodeGenerator localGenerator;
    private final List<LlmProvider> remoteProviders = new ArrayList<>();
    private final long simulatedLatencyMs;

    public CodeProviderChain(LlmClientFactory clientFactory,
                             LlmProviderConfigRepository providerConfigRepo,
                             LocalCodeGenerator localGenerator,
                             @Value("${siat.generation.primary-provider:OPENAI}") String primary,
                             @Value("${siat.generation.fallback-provider:ANTHROPIC}") String fallback,
                             @Value("${siat.generation.simulated-latency-ms:0}") long simulatedLatencyMs) {
        this.clientFactory = clientFactory;
        this.providerConfigRepo = providerConfigRepo;
        this.localGenerator = localGenerator;
        this.simulatedLatencyMs = simulatedLatencyMs;
        addProvider(primary);
        addProvider(fallback);
    }

    public ProviderOutput produce(String enhancedPrompt, String prompt, String type) {
        for (LlmProvider provider : remoteProviders) {
            Optional<String> code = callRemote(provider, enhancedPrompt, type);
            if (code.isPresent()) {
                return new ProviderOutput(code.get(), null, provider.name());
            }
        }
        ScaffoldedModule local = localGenerator.generate(prompt, type);
        log.debug("[Generate] Using local templates for type {}", type);
        return new ProviderOutput(local.code(), local.config(), LOCAL);
    }

    private Optional<String> callRemote(LlmProvider provider, String enhancedPrompt, String type) {
        if (simulatedLatencyMs > 0) {
            try {
                Thread.sleep(simulatedLatencyMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }

        Optional<LlmProviderConfig> cfg = providerConfigRepo.findByProviderAndEnabledTrue(provider);
        Optional<LlmClient> client = clientFactory.find(provider);
        if (cfg.isEmpty() || client.isEmpty()) {
            return Optional.empty();
        }

        LlmRequest request = LlmRequest.of(systemPrompt(provider, type), enhancedPrompt).withModel(cfg.get().getModel());
        LlmResponse response = client.get().call(request, cfg.get().getApiKey(), cfg.get().getCustomEndpoint());
        if (!response.hasText()) {
            log.warn("[Generate] {} returned no code, trying next provider: {}",
                    provider.getDisplayName(), response.errorMessage());
            return Optional.empty();
        }
        log.info("[Generate] {} produced code with {} ({} in / {} out tokens)",
                provider.getDisplayName(), response.model(), response.inputTokens(), response.outputTokens());
        return Optional.of(response.text());
    }

    private static String systemPrompt(LlmProvider provider, String type) {
        if (provider == LlmProvider.ANTHROPIC) {
            return "As a senior software architect, write " + type + " code. "
                    + "Focus on clean architecture, SOLID design and maintainable structure. "
                    + "Return only the code without explanations.";
        }
        return "You are an expert " + type + " developer. Use TypeScript with strict typing, "
                + "follow NestJS conventions, include error handling and security checks. "
                + "Return only the code without explanations.";
    }

    private void addProvider(String name) {
        if (name == null || name.isBlank() || LOCAL.equalsIgnoreCase(name)) return;
        try {
            LlmProvider provider = LlmProvider.valueOf(name.trim().toUpperCase());
            if (!remoteProviders.contains(provider)) remoteProviders.add(provider);
        } catch (IllegalArgumentException e) {
            log.warn("[Generate] Ignoring unknown provider '{}' in generation chain", name);
        }
    }

    /** Code plus, for scaffolded flow modules, the module config that goes with it. */
    public record ProviderOutput(String code, Map<String, Object> moduleConfig, String source) {}
}
