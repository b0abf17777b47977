package com.siat.siat_backend.generator.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.siat.siat_backend.model.domain.LlmProvider;
import com.siat.siat_backend.model.llm.LlmRequest;
import com.siat.siat_backend.model.llm.LlmResponse;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class AnthropicLlmClient extends JsonHttpLlmClient {

    private static final String API_VERSION = "2023-06-01";

    public AnthropicLlmClient(ObjectMapper mapper) {
        super(mapper);
    }

    @Override
    public LlmProvider getProvider() { return LlmProvider.ANTHROPIC; }

    @Override
    public String getDefaultModel() { return "claude-3-5-haiku-latest"; }

    @Override
    public List<String> getKnownModels() { return List.of("claude-3-5-haiku-latest", "claude-3-5-sonnet-latest"); }

    // The system prompt is a top-level field here, not a message
    @Override
    protected Map<String, Object> requestBody(LlmRequest request, String model) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("max_tokens", request.maxTokens());
        body.put("temperature", request.temperature());
        if (request.hasSystemPrompt()) {
            body.put("system", request.systemPrompt());
        }
        body.put("messages", List.of(Map.of("role", "user", "content", request.userPrompt())));
        return body;
    }

    @Override
    protected Map<String, String> headers(String apiKey) {
        return Map.of("x-api-key", apiKey, "anthropic-version", API_VERSION);
    }

    @Override
    protected LlmResponse parse(JsonNode reply, String model) {
        StringBuilder text = new StringBuilder();
        for (JsonNode block : reply.path("content")) {
            if ("text".equals(block.path("type").asText("text"))) {
                text.append(block.path("text").asText(""));
            }
        }
        JsonNode usage = reply.path("usage");
        return LlmResponse.ok(text.toString(), reply.path("model").asText(model),
                usage.path("input_tokens").asInt(0), usage.path("output_tokens").asInt(0));
    }
}
