package com.siat.siat_backend.exception;

import java.util.List;

/** Prompt rejected by the length gate. Carries every failed rule, not just the first. */
public class InvalidPromptException extends RuntimeException {

    private final List<String> errors;

    public InvalidPromptException(List<String> errors) {
        super("Invalid prompt: " + String.join(", ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
