package com.siat.siat_backend.generator.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.siat.siat_backend.model.llm.LlmRequest;
import com.siat.siat_backend.model.llm.LlmResponse;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Shared POST-JSON-and-parse plumbing for the remote providers. Subclasses only describe their
 * request body, auth headers and reply shape.
 */
@Slf4j
public abstract class JsonHttpLlmClient implements LlmClient {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);
    private static final int MAX_ERROR_BODY = 200;

    protected final ObjectMapper mapper;
    private final HttpClient httpClient;

    protected JsonHttpLlmClient(ObjectMapper mapper) {
        this(mapper, HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build());
    }

    JsonHttpLlmClient(ObjectMapper mapper, HttpClient httpClient) {
        this.mapper = mapper;
        this.httpClient = httpClient;
    }

    protected abstract Map<String, Object> requestBody(LlmRequest request, String model);

    protected abstract Map<String, String> headers(String apiKey);

    protected abstract LlmResponse parse(JsonNode reply, String model);

    @Override
    public LlmResponse call(LlmRequest request, String apiKey, String endpoint) {
        String name = getProvider().getDisplayName();
        String url = endpoint != null && !endpoint.isBlank() ? endpoint : getProvider().getDefaultEndpoint();
        String model = request.model() != null ? request.model() : getDefaultModel();
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(REQUEST_TIMEOUT)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(requestBody(request, model))));
            headers(apiKey).forEach(builder::header);

            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.warn("[LLM] {} answered HTTP {}", name, response.statusCode());
                return LlmResponse.error(name + " API error " + response.statusCode() + ": " + errorMessage(response.body()));
            }
            return parse(mapper.readTree(response.body()), model);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmResponse.error(name + " call interrupted");
        } catch (Exception e) {
            log.error("[LLM] {} call failed", name, e);
            return LlmResponse.error(name + " client exception: " + e.getMessage());
        }
    }

    // Both providers report {"error": {"message": "..."}}; anything else is the truncated raw body
    String errorMessage(String body) {
        if (body == null) return "";
        try {
            JsonNode message = mapper.readTree(body).path("error").path("message");
            if (message.isTextual()) return message.asText();
        } catch (JsonProcessingException e) {
            log.debug("[LLM] Error body is not JSON: {}", e.getOriginalMessage());
        }
        return body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) : body;
    }
}
