package com.siat.siat_backend.model.generation;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Keywords pulled out of a prompt. Every list is de-duplicated and keeps first-seen order.
 */
@Data
@Builder
public class ModuleRequirements {
    @Builder.Default private List<String> entities = new ArrayList<>();
    @Builder.Default private List<String> fields = new ArrayList<>();
    @Builder.Default private List<String> operations = new ArrayList<>();
    @Builder.Default private List<String> validations = new ArrayList<>();
    @Builder.Default private List<String> relationships = new ArrayList<>();
    @Builder.Default private List<String> uiComponents = new ArrayList<>();
    @Builder.Default private List<String> businessRules = new ArrayList<>();
}
