package com.siat.siat_backend.generator;

import java.util.Locale;

/**
 * Coarse language bucket used by post-processing, the syntax gate and the optimizer.
 * Module and flow types (CONTROLLER, CRUD, ...) all land in OTHER.
 */
public enum LanguageFamily {
    SCRIPT,
    PYTHON,
    SQL,
    OTHER;

    public static LanguageFamily of(String type) {
        if (type == null) return OTHER;
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "javascript", "typescript" -> SCRIPT;
            case "python" -> PYTHON;
            case "sql" -> SQL;
            default -> OTHER;
        };
    }
}
