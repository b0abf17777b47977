package com.siat.siat_backend.model.generation;

import java.util.Map;

public record ScaffoldedModule(String code, Map<String, Object> config) {}
