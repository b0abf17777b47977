package com.siat.siat_backend.generator;

import java.util.Locale;
import java.util.Optional;

public enum ModuleKind {
    CONTROLLER,
    SERVICE,
    ENTITY,
    DTO,
    MODULE,
    COMPONENT,
    PAGE,
    HOOK,
    UTIL;

    public static Optional<ModuleKind> parse(String type) {
        if (type == null) return Optional.empty();
        try {
            return Optional.of(ModuleKind.valueOf(type.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
