package com.siat.siat_backend.executor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {{path}} references against the data a step receives. Paths are dotted keys into
 * nested maps; a leading "input." is optional. Missing paths resolve to null (or "" inside text).
 */
@Slf4j
@Component
public class StepReferenceResolver {

    private static final Pattern REF_PATTERN = Pattern.compile("\\{\\{([^}]+)}}");

    // Whole-value references keep their type, references embedded in text are stringified
    public Map<String, Object> resolveMap(Map<String, Object> template, Map<String, Object> input) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        if (template == null) return resolved;

        template.forEach((key, value) -> {
            if (value instanceof String s) {
                String trimmed = s.trim();
                if (trimmed.length() >= 5 && trimmed.startsWith("{{") && trimmed.endsWith("}}")
                        && trimmed.indexOf("{{", 2) < 0) {
                    resolved.put(key, resolvePath(trimmed.substring(2, trimmed.length() - 2).trim(), input));
                } else {
                    resolved.put(key, resolve(s, input));
                }
            } else {
                resolved.put(key, value);
            }
        });
        return resolved;
    }

    public String resolve(String text, Map<String, Object> input) {
        if (text == null || !text.contains("{{")) return text;

        Matcher matcher = REF_PATTERN.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Object value = resolvePath(matcher.group(1).trim(), input);
            matcher.appendReplacement(result, Matcher.quoteReplacement(value != null ? value.toString() : ""));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    @SuppressWarnings("unchecked")
    public Object resolvePath(String path, Map<String, Object> input) {
        if (path == null || input == null) return null;
        String normalized = path.startsWith("input.") ? path.substring(6) : path;
        if (normalized.isBlank() || "input".equals(normalized)) return input;

        Object current = input;
        for (String part : normalized.split("\\.")) {
            if (!(current instanceof Map)) {
                log.debug("[Runner] Reference {{{}}} stops at non-object before '{}'", path, part);
                return null;
            }
            current = ((Map<String, Object>) current).get(part);
        }
        return current;
    }
}
