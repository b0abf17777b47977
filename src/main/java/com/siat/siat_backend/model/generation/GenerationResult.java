package com.siat.siat_backend.model.generation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerationResult {

    private boolean success;
    private String code;
    private String error;
    private GenerationMetadata metadata;

    // Set only when the code came from a module scaffold (entity, fields, operations, ...)
    private Map<String, Object> moduleConfig;

    public GenerationResult() {}

    public static GenerationResult ok(String code, GenerationMetadata metadata, Map<String, Object> moduleConfig) {
        GenerationResult r = new GenerationResult();
        r.success      = true;
        r.code         = code;
        r.metadata     = metadata;
        r.moduleConfig = moduleConfig;
        return r;
    }

    public static GenerationResult failure(String error) {
        GenerationResult r = new GenerationResult();
        r.success = false;
        r.error   = error;
        return r;
    }

    public boolean isSuccess()                    { return success; }
    public String getCode()                       { return code; }
    public String getError()                      { return error; }
    public GenerationMetadata getMetadata()       { return metadata; }
    public Map<String, Object> getModuleConfig()  { return moduleConfig; }
}
