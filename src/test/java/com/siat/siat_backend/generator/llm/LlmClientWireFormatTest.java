package com.siat.siat_backend.generator.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.siat.siat_backend.model.llm.LlmRequest;
import com.siat.siat_backend.model.llm.LlmResponse;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LlmClientWireFormatTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final OpenAiLlmClient openAi = new OpenAiLlmClient(mapper);
    private final AnthropicLlmClient anthropic = new AnthropicLlmClient(mapper);

    @Test
    void openAiPutsTheSystemPromptFirst() {
        Map<String, Object> body = openAi.requestBody(LlmRequest.of("sys", "user"), "gpt-4o");

        assertThat(body).containsEntry("model", "gpt-4o").containsEntry("max_tokens", LlmRequest.DEFAULT_MAX_TOKENS);
        assertThat(body.get("messages"))
                .asInstanceOf(InstanceOfAssertFactories.list(Object.class))
                .containsExactly(
                Map.of("role", "system", "content", "sys"),
                Map.of("role", "user", "content", "user"));
    }

    @Test
    void anthropicKeepsTheSystemPromptTopLevel() {
        Map<String, Object> body = anthropic.requestBody(LlmRequest.of(" ", "user"), "claude");

        assertThat(body).doesNotContainKey("system");
        assertThat(body.get("messages")).asInstanceOf(InstanceOfAssertFactories.LIST).hasSize(1);
    }

    @Test
    void parsesOpenAiReplies() throws Exception {
        LlmResponse response = openAi.parse(mapper.readTree("""
                {"model":"gpt-4o","choices":[{"message":{"content":"export {}"}}],
                 "usage":{"prompt_tokens":12,"completion_tokens":3}}
                """), "fallback");

        assertThat(response.hasText()).isTrue();
        assertThat(response.text()).isEqualTo("export {}");
        assertThat(response.inputTokens()).isEqualTo(12);
    }

    @Test
    void joinsAnthropicTextBlocks() throws Exception {
        LlmResponse response = anthropic.parse(mapper.readTree("""
                {"content":[{"type":"text","text":"a"},{"type":"tool_use"},{"type":"text","text":"b"}]}
                """), "claude");

        assertThat(response.text()).isEqualTo("ab");
        assertThat(response.model()).isEqualTo("claude");
    }

    @Test
    void emptyReplyHasNoText() throws Exception {
        assertThat(openAi.parse(mapper.readTree("{\"choices\":[]}"), "m").hasText()).isFalse();
    }

    @Test
    void errorMessagesPreferTheProviderMessage() {
        assertThat(openAi.errorMessage("{\"error\":{\"message\":\"bad key\"}}")).isEqualTo("bad key");
        assertThat(openAi.errorMessage("x".repeat(300))).hasSize(200);
        assertThat(openAi.errorMessage(null)).isEmpty();
    }

    @Test
    void blankModelMeansClientDefault() {
        assertThat(LlmRequest.of("s", "u").withModel("  ").model()).isNull();
    }
}
