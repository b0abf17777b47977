package com.siat.siat_backend.generator;

import com.siat.siat_backend.model.generation.ModuleRequirements;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RequirementsParserTest {

    private final RequirementsParser parser = new RequirementsParser();

    @Test
    void extractsKeywordsInFirstSeenOrder() {
        ModuleRequirements req = parser.parse(
                "Create a users table with name, email and status fields; email is required");

        assertThat(req.getEntities()).containsExactly("users");
        assertThat(req.getOperations()).containsExactly("create");
        assertThat(req.getFields()).containsExactly("name", "email", "status");
        assertThat(req.getUiComponents()).containsExactly("table");
        assertThat(req.getValidations()).containsExactly("required", "email");
    }

    @Test
    void validationKeywordsAreCaseSensitive() {
        ModuleRequirements req = parser.parse("Build a form where every field is REQUIRED and UNIQUE");

        assertThat(req.getValidations()).isEmpty();
        assertThat(req.getUiComponents()).containsExactly("form");
    }

    @Test
    void nullPromptYieldsEmptyRequirements() {
        ModuleRequirements req = parser.parse(null);

        assertThat(req.getEntities()).isEmpty();
        assertThat(req.getOperations()).isEmpty();
        assertThat(req.getFields()).isEmpty();
    }
}
