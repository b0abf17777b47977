package com.siat.siat_backend.model.llm;

/**
 * Provider-agnostic code generation request built by the provider chain.
 * Each LlmClient translates it into its provider's wire format; a null model means the client default.
 */
public record LlmRequest(String systemPrompt, String userPrompt, String model, int maxTokens, double temperature) {

    public static final int DEFAULT_MAX_TOKENS = 4000;
    public static final double DEFAULT_TEMPERATURE = 0.2;

    public static LlmRequest of(String systemPrompt, String userPrompt) {
        return new LlmRequest(systemPrompt, userPrompt, null, DEFAULT_MAX_TOKENS, DEFAULT_TEMPERATURE);
    }

    public LlmRequest withModel(String model) {
        return new LlmRequest(systemPrompt, userPrompt, blankToNull(model), maxTokens, temperature);
    }

    public LlmRequest withLimits(int maxTokens, double temperature) {
        return new LlmRequest(systemPrompt, userPrompt, model, maxTokens, temperature);
    }

    public boolean hasSystemPrompt() {
        return systemPrompt != null && !systemPrompt.isBlank();
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
