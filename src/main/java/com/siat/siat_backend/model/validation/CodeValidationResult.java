package com.siat.siat_backend.model.validation;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Outcome of the structural checks. Errors make the code invalid, warnings and suggestions never do.
 */
@Data
@AllArgsConstructor
public class CodeValidationResult {
    private boolean valid;
    private List<String> errors;
    private List<String> warnings;
    private List<String> suggestions;
}
