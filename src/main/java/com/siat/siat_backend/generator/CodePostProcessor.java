package com.siat.siat_backend.generator;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Cleans provider output before it is gated: strips markdown fences, then reformats per language family. */
@Component
public class CodePostProcessor {

    private static final Pattern FENCE_OPEN = Pattern.compile("```\\w*\\n?");
    private static final Pattern MISSING_SEMICOLON = Pattern.compile("([^;{}\\s])\\s*\\n");
    private static final Pattern ASSIGNMENT = Pattern.compile("([^=!<>])=([^=])");
    private static final Pattern EQUALITY = Pattern.compile("([^=!<>])==([^=])");
    private static final Pattern SQL_TERMINATOR = Pattern.compile(";?\\s*$");

    public String process(String response, String type) {
        String processed = FENCE_OPEN.matcher(response).replaceAll("").replace("```", "").trim();

        return switch (LanguageFamily.of(type)) {
            case SCRIPT -> formatScript(processed);
            case PYTHON -> formatPython(processed);
            case SQL -> SQL_TERMINATOR.matcher(processed).replaceFirst(";");
            case OTHER -> processed;
        };
    }

    private String formatScript(String code) {
        String formatted = MISSING_SEMICOLON.matcher(code).replaceAll("$1;\n");
        formatted = ASSIGNMENT.matcher(formatted).replaceAll("$1 = $2");
        formatted = EQUALITY.matcher(formatted).replaceAll("$1 == $2");
        return formatted;
    }

    private String formatPython(String code) {
        List<String> fixed = new ArrayList<>();
        int indent = 0;
        for (String line : code.split("\n", -1)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                fixed.add("");
                continue;
            }
            if (trimmed.startsWith("except") || trimmed.startsWith("finally")
                    || trimmed.startsWith("elif") || trimmed.startsWith("else")) {
                indent = Math.max(0, indent - 4);
            }
            fixed.add(" ".repeat(indent) + trimmed);
            if (trimmed.endsWith(":")) {
                indent += 4;
            }
        }
        return String.join("\n", fixed);
    }
}
