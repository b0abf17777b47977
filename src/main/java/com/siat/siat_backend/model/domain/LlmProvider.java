package com.siat.siat_backend.model.domain;

/**
 * Remote code-generation providers tried before local template generation.
 */
public enum LlmProvider {

    OPENAI("OpenAI GPT",          "https://api.openai.com/v1/chat/completions"),
    ANTHROPIC("Anthropic Claude", "https://api.anthropic.com/v1/messages");

    private final String displayName;
    private final String defaultEndpoint;

    LlmProvider(String displayName, String defaultEndpoint) {
        this.displayName     = displayName;
        this.defaultEndpoint = defaultEndpoint;
    }

    public String getDisplayName()     { return displayName; }
    public String getDefaultEndpoint() { return defaultEndpoint; }
}
