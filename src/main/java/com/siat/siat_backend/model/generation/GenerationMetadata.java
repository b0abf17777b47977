package com.siat.siat_backend.model.generation;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class GenerationMetadata {
    private String language;
    private String framework;
    private List<String> dependencies;
    private int estimatedComplexity;
}
