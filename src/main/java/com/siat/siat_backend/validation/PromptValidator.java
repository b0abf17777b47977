package com.siat.siat_backend.validation;

import com.siat.siat_backend.model.validation.PromptValidationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class PromptValidator {

    public static final int MIN_LENGTH = 10;
    public static final int MAX_LENGTH = 2000;

    public PromptValidationResult validate(String prompt) {
        List<String> errors = new ArrayList<>();

        if (prompt == null || prompt.trim().length() < MIN_LENGTH) {
            errors.add("Prompt must be at least " + MIN_LENGTH + " characters long");
        }
        if (prompt != null && prompt.length() > MAX_LENGTH) {
            errors.add("Prompt must be less than " + MAX_LENGTH + " characters");
        }
        return new PromptValidationResult(errors.isEmpty(), errors);
    }
}
