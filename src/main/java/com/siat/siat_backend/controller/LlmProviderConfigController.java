package com.siat.siat_backend.controller;

import com.siat.siat_backend.generator.llm.LlmClient;
import com.siat.siat_backend.generator.llm.LlmClientFactory;
import com.siat.siat_backend.model.domain.LlmProvider;
import com.siat.siat_backend.model.domain.LlmProviderConfig;
import com.siat.siat_backend.model.dto.SaveLlmProviderDto;
import com.siat.siat_backend.model.llm.LlmRequest;
import com.siat.siat_backend.model.llm.LlmResponse;
import com.siat.siat_backend.repository.LlmProviderConfigRepository;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.*;

/**
 * Remote providers used by the generation chain. Keys are stored as given and only ever returned masked.
 */
@Slf4j
@RestController
@RequestMapping("/siat/llm-providers")
@RequiredArgsConstructor
public class LlmProviderConfigController {

    private static final String PING_SYSTEM = "You are a connectivity check. Reply with a single code comment.";
    private static final String PING_USER = "Respond with exactly: // ok";

    private final LlmProviderConfigRepository repo;
    private final LlmClientFactory clientFactory;

    /** Every known provider, configured or not, in enum order. */
    @GetMapping
    public List<Map<String, Object>> listProviders() {
        Map<LlmProvider, LlmProviderConfig> saved = new EnumMap<>(LlmProvider.class);
        repo.findAll().forEach(cfg -> saved.put(cfg.getProvider(), cfg));

        List<Map<String, Object>> providers = new ArrayList<>();
        for (LlmProvider provider : LlmProvider.values()) {
            Optional<LlmClient> client = clientFactory.find(provider);
            Optional<LlmProviderConfig> cfg = Optional.ofNullable(saved.get(provider));

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("provider", provider.name());
            entry.put("displayName", provider.getDisplayName());
            entry.put("knownModels", client.map(LlmClient::getKnownModels).orElse(List.of()));
            entry.put("defaultModel", client.map(LlmClient::getDefaultModel).orElse(""));
            entry.put("configured", cfg.isPresent());
            entry.put("enabled", cfg.map(LlmProviderConfig::isEnabled).orElse(false));
            entry.put("apiKeyMasked", cfg.map(c -> maskKey(c.getApiKey())).orElse(null));
            entry.put("customEndpoint", cfg.map(LlmProviderConfig::getCustomEndpoint).orElse(null));
            entry.put("model", cfg.map(LlmProviderConfig::getModel).orElse(null));
            entry.put("lastTestedAt", cfg.map(LlmProviderConfig::getLastTestedAt).orElse(null));
            entry.put("lastTestOk", cfg.map(LlmProviderConfig::getLastTestOk).orElse(null));
            providers.add(entry);
        }
        return providers;
    }

    // Saving (re)enables the provider and clears any previous test outcome
    @PostMapping
    public Map<String, Object> saveProvider(@Valid @RequestBody SaveLlmProviderDto body) {
        LlmProvider provider = parseProvider(body.provider());

        LlmProviderConfig cfg = repo.findByProvider(provider).orElseGet(LlmProviderConfig::new);
        cfg.setProvider(provider);
        cfg.setApiKey(body.apiKey());
        cfg.setCustomEndpoint(body.customEndpoint());
        cfg.setModel(body.model());
        cfg.setEnabled(true);
        cfg.setLastTestedAt(null);
        cfg.setLastTestOk(null);
        LlmProviderConfig saved = repo.save(cfg);
        log.info("[LLM] Saved configuration for {}", provider);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("provider", saved.getProvider().name());
        response.put("enabled", saved.isEnabled());
        response.put("apiKeyMasked", maskKey(saved.getApiKey()));
        return response;
    }

    @PatchMapping("/{provider}/toggle")
    public Map<String, Object> toggleProvider(@PathVariable String provider) {
        LlmProviderConfig cfg = requireConfig(parseProvider(provider));
        cfg.setEnabled(!cfg.isEnabled());
        repo.save(cfg);
        log.info("[LLM] {} is now {}", cfg.getProvider(), cfg.isEnabled() ? "enabled" : "disabled");
        return Map.of("provider", cfg.getProvider().name(), "enabled", cfg.isEnabled());
    }

    @DeleteMapping("/{provider}")
    public ResponseEntity<Void> deleteProvider(@PathVariable String provider) {
        repo.findByProvider(parseProvider(provider)).ifPresent(repo::delete);
        return ResponseEntity.noContent().build();
    }

    /** Round-trips a tiny prompt through the provider; failures are reported in the body, not as HTTP errors. */
    @PostMapping("/{provider}/test")
    public Map<String, Object> testProvider(@PathVariable String provider) {
        LlmProvider p = parseProvider(provider);
        LlmProviderConfig cfg = requireConfig(p);
        LlmClient client = clientFactory.find(p)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "No client available for " + p));

        LlmRequest ping = LlmRequest.of(PING_SYSTEM, PING_USER).withModel(cfg.getModel()).withLimits(50, 0.0);
        long start = System.currentTimeMillis();
        LlmResponse resp = client.call(ping, cfg.getApiKey(), cfg.getCustomEndpoint());
        long latency = System.currentTimeMillis() - start;

        cfg.setLastTestedAt(Instant.now());
        cfg.setLastTestOk(resp.success());
        repo.save(cfg);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", resp.success());
        result.put("latencyMs", latency);
        result.put("model", ping.model() != null ? ping.model() : client.getDefaultModel());
        result.put("message", resp.success() ? "Connected successfully" : resp.errorMessage());
        return result;
    }

    private LlmProviderConfig requireConfig(LlmProvider provider) {
        return repo.findByProvider(provider)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Provider not configured: " + provider));
    }

    private static LlmProvider parseProvider(String s) {
        try {
            return LlmProvider.valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown provider: " + s);
        }
    }

    static String maskKey(String key) {
        if (key == null || key.length() < 10) return "****";
        return key.substring(0, 4) + "••••••••" + key.substring(key.length() - 4);
    }
}
