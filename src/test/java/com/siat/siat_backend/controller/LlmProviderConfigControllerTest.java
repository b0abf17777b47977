package com.siat.siat_backend.controller;

import com.siat.siat_backend.generator.llm.LlmClient;
import com.siat.siat_backend.generator.llm.LlmClientFactory;
import com.siat.siat_backend.model.domain.LlmProvider;
import com.siat.siat_backend.model.domain.LlmProviderConfig;
import com.siat.siat_backend.model.llm.LlmResponse;
import com.siat.siat_backend.repository.LlmProviderConfigRepository;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LlmProviderConfigController.class)
class LlmProviderConfigControllerTest {

    private static final String API_KEY = "sk-test-123456";

    @Autowired MockMvc mockMvc;
    @MockBean LlmProviderConfigRepository repo;
    @MockBean LlmClientFactory clientFactory;

    private LlmProviderConfig config(LlmProvider provider, boolean enabled) {
        LlmProviderConfig cfg = new LlmProviderConfig();
        cfg.setProvider(provider);
        cfg.setApiKey(API_KEY);
        cfg.setEnabled(enabled);
        return cfg;
    }

    @Test
    void saveReturnsOnlyTheMaskedKey() throws Exception {
        when(repo.findByProvider(LlmProvider.OPENAI)).thenReturn(Optional.empty());
        when(repo.save(any())).thenAnswer(inv -> inv.getArgument(0));

        mockMvc.perform(post("/siat/llm-providers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"openai\",\"apiKey\":\"" + API_KEY + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.provider").value("OPENAI"))
                .andExpect(jsonPath("$.enabled").value(true))
                .andExpect(jsonPath("$.apiKeyMasked").value(startsWith("sk-t")))
                .andExpect(jsonPath("$.apiKeyMasked").value(endsWith("3456")))
                .andExpect(content().string(not(containsString(API_KEY))));
    }

    @Test
    void saveWithoutApiKeyIs400() throws Exception {
        mockMvc.perform(post("/siat/llm-providers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"OPENAI\"}"))
                .andExpect(status().isBadRequest());

        verify(repo, never()).save(any());
    }

    @Test
    void listNeverExposesStoredKeys() throws Exception {
        when(repo.findAll()).thenReturn(List.of(config(LlmProvider.ANTHROPIC, false)));
        when(clientFactory.find(any())).thenReturn(Optional.empty());

        mockMvc.perform(get("/siat/llm-providers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(LlmProvider.values().length))
                .andExpect(jsonPath("$[0].provider").value("OPENAI"))
                .andExpect(jsonPath("$[0].configured").value(false))
                .andExpect(jsonPath("$[1].provider").value("ANTHROPIC"))
                .andExpect(jsonPath("$[1].configured").value(true))
                .andExpect(jsonPath("$[1].enabled").value(false))
                .andExpect(content().string(not(containsString(API_KEY))));
    }

    @Test
    void toggleFlipsEnabled() throws Exception {
        LlmProviderConfig cfg = config(LlmProvider.OPENAI, true);
        when(repo.findByProvider(LlmProvider.OPENAI)).thenReturn(Optional.of(cfg));

        mockMvc.perform(patch("/siat/llm-providers/openai/toggle"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false));
        mockMvc.perform(patch("/siat/llm-providers/openai/toggle"))
                .andExpect(jsonPath("$.enabled").value(true));

        assertThat(cfg.isEnabled()).isTrue();
    }

    @Test
    void toggleOfUnconfiguredProviderIs404() throws Exception {
        when(repo.findByProvider(LlmProvider.ANTHROPIC)).thenReturn(Optional.empty());

        mockMvc.perform(patch("/siat/llm-providers/anthropic/toggle"))
                .andExpect(status().isNotFound());
    }

    @Test
    void unknownProviderIs400() throws Exception {
        mockMvc.perform(patch("/siat/llm-providers/gemini/toggle"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void deleteIs204() throws Exception {
        LlmProviderConfig cfg = config(LlmProvider.OPENAI, true);
        when(repo.findByProvider(LlmProvider.OPENAI)).thenReturn(Optional.of(cfg));

        mockMvc.perform(delete("/siat/llm-providers/OPENAI"))
                .andExpect(status().isNoContent());

        verify(repo).delete(cfg);
    }

    @Test
    void failedConnectionTestIsReportedInTheBody() throws Exception {
        LlmProviderConfig cfg = config(LlmProvider.OPENAI, true);
        LlmClient client = mock(LlmClient.class);
        when(client.getDefaultModel()).thenReturn("gpt-4o-mini");
        when(client.call(any(), any(), isNull())).thenReturn(LlmResponse.error("OpenAI GPT API error 401: bad key"));
        when(repo.findByProvider(LlmProvider.OPENAI)).thenReturn(Optional.of(cfg));
        when(clientFactory.find(LlmProvider.OPENAI)).thenReturn(Optional.of(client));

        mockMvc.perform(post("/siat/llm-providers/openai/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
                .andExpect(jsonPath("$.message").value("OpenAI GPT API error 401: bad key"));

        ArgumentCaptor<LlmProviderConfig> saved = ArgumentCaptor.forClass(LlmProviderConfig.class);
        verify(repo).save(saved.capture());
        assertThat(saved.getValue().getLastTestOk()).isFalse();
        assertThat(saved.getValue().getLastTestedAt()).isNotNull();
    }

    @Test
    void shortKeysAreFullyMasked() {
        assertThat(LlmProviderConfigController.maskKey("abc")).isEqualTo("****");
        assertThat(LlmProviderConfigController.maskKey(null)).isEqualTo("****");
        assertThat(LlmProviderConfigController.maskKey(API_KEY)).isEqualTo("sk-t••••••••3456");
    }
}
