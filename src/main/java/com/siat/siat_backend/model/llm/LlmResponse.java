package com.siat.siat_backend.model.llm;

/**
 * What a provider answered. {@code text} is the model's reply, still wrapped in whatever fences the
 * model chose; the generator strips them later.
 */
public record LlmResponse(boolean success, String text, String errorMessage, String model,
                          int inputTokens, int outputTokens) {

    public static LlmResponse ok(String text, String model, int inputTokens, int outputTokens) {
        return new LlmResponse(true, text, null, model, inputTokens, outputTokens);
    }

    public static LlmResponse error(String message) {
        return new LlmResponse(false, null, message, null, 0, 0);
    }

    // A successful call with an empty reply is useless to the chain
    public boolean hasText() {
        return success && text != null && !text.isBlank();
    }
}
