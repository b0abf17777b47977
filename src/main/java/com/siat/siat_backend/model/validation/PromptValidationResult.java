package com.siat.siat_backend.model.validation;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class PromptValidationResult {
    private boolean valid;
    private List<String> errors;
}
