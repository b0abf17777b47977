package com.siat.siat_backend.generator.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.siat.siat_backend.model.domain.LlmProvider;
import com.siat.siat_backend.model.llm.LlmRequest;
import com.siat.siat_backend.model.llm.LlmResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Chat completions API; also works against OpenAI-compatible gateways through a custom endpoint. */
@Component
public class OpenAiLlmClient extends JsonHttpLlmClient {

    @Autowired
    public OpenAiLlmClient(ObjectMapper mapper) {
        super(mapper);
    }

    OpenAiLlmClient(ObjectMapper mapper, HttpClient httpClient) {
        super(mapper, httpClient);
    }

    @Override
    public LlmProvider getProvider() { return LlmProvider.OPENAI; }

    @Override
    public String getDefaultModel() { return "gpt-4o-mini"; }

    @Override
    public List<String> getKnownModels() { return List.of("gpt-4o-mini", "gpt-4o", "gpt-4-turbo"); }

    @Override
    protected Map<String, Object> requestBody(LlmRequest request, String model) {
        List<Map<String, String>> messages = new ArrayList<>();
        if (request.hasSystemPrompt()) {
            messages.add(Map.of("role", "system", "content", request.systemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", request.userPrompt()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("max_tokens", request.maxTokens());
        body.put("temperature", request.temperature());
        return body;
    }

    @Override
    protected Map<String, String> headers(String apiKey) {
        return Map.of("Authorization", "Bearer " + apiKey);
    }

    @Override
    protected LlmResponse parse(JsonNode reply, String model) {
        String text = reply.path("choices").path(0).path("message").path("content").asText(null);
        JsonNode usage = reply.path("usage");
        return LlmResponse.ok(text, reply.path("model").asText(model),
                usage.path("prompt_tokens").asInt(0), usage.path("completion_tokens").asInt(0));
    }
}
