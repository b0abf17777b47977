package com.siat.siat_backend.validation;

import com.siat.siat_backend.model.validation.PromptValidationResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PromptValidatorTest {

    private final PromptValidator validator = new PromptValidator();

    @Test
    void acceptsPromptWithinBounds() {
        PromptValidationResult result = validator.validate("Create a user management API");
        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    void rejectsShortPromptAfterTrimming() {
        PromptValidationResult result = validator.validate("   short    ");
        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).containsExactly("Prompt must be at least 10 characters long");
    }

    @Test
    void rejectsNullPrompt() {
        assertThat(validator.validate(null).isValid()).isFalse();
    }

    @Test
    void rejectsPromptOverMaximum() {
        PromptValidationResult result = validator.validate("a".repeat(2001));
        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).containsExactly("Prompt must be less than 2000 characters");
    }

    @Test
    void acceptsPromptAtExactBounds() {
        assertThat(validator.validate("a".repeat(10)).isValid()).isTrue();
        assertThat(validator.validate("a".repeat(2000)).isValid()).isTrue();
    }
}
