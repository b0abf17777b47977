package com.siat.siat_backend.validation;

import com.siat.siat_backend.generator.LanguageFamily;
import com.siat.siat_backend.model.validation.CodeValidationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Substring heuristics over generated code. Neither check parses anything: a pass means the
 * expected markers are present, not that the code compiles.
 */
@Component
public class CodeValidator {

    public CodeValidationResult validateCode(String code, String type) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();

        if (code == null || code.trim().isEmpty()) {
            errors.add("Generated code is empty");
            return new CodeValidationResult(false, errors, warnings, suggestions);
        }

        String kind = type != null ? type.toUpperCase(Locale.ROOT) : "";
        switch (kind) {
            case "CONTROLLER" -> validateController(code, errors, warnings);
            case "SERVICE" -> validateService(code, errors);
            case "ENTITY" -> validateEntity(code, errors);
            case "DTO" -> validateDto(code, errors, warnings);
            default -> validateGeneric(code, warnings);
        }

        return new CodeValidationResult(errors.isEmpty(), errors, warnings, suggestions);
    }

    /**
     * Language-family sanity gate shared by generation and optimization.
     * Scripts need balanced brackets, a SELECT needs a FROM, python always passes,
     * anything else must be non-empty and free of the words "undefined" and "null".
     */
    public boolean passesSyntaxCheck(String code, String type) {
        if (code == null) return false;
        return switch (LanguageFamily.of(type)) {
            case SCRIPT -> bracketsBalanced(code);
            case PYTHON -> true;
            case SQL -> {
                String upper = code.toUpperCase(Locale.ROOT);
                yield !(upper.contains("SELECT") && !upper.contains("FROM"));
            }
            case OTHER -> !code.isEmpty() && !code.contains("undefined") && !code.contains("null");
        };
    }

    private void validateController(String code, List<String> errors, List<String> warnings) {
        if (!code.contains("@Controller")) {
            errors.add("Controller must have @Controller decorator");
        }
        if (!code.contains("export class")) {
            errors.add("Controller must export a class");
        }
        if (!code.contains("@Get") && !code.contains("@Post") && !code.contains("@Put") && !code.contains("@Delete")) {
            warnings.add("Controller should have at least one HTTP method decorator");
        }
    }

    private void validateService(String code, List<String> errors) {
        if (!code.contains("@Injectable")) {
            errors.add("Service must have @Injectable decorator");
        }
        if (!code.contains("export class")) {
            errors.add("Service must export a class");
        }
    }

    private void validateEntity(String code, List<String> errors) {
        if (!code.contains("export interface") && !code.contains("export class")) {
            errors.add("Entity must export an interface or class");
        }
    }

    private void validateDto(String code, List<String> errors, List<String> warnings) {
        if (!code.contains("export class")) {
            errors.add("DTO must export a class");
        }
        if (!code.contains("@IsString") && !code.contains("@IsNumber") && !code.contains("@IsBoolean")) {
            warnings.add("DTO should use validation decorators");
        }
    }

    private void validateGeneric(String code, List<String> warnings) {
        if (code.contains("TODO") || code.contains("FIXME")) {
            warnings.add("Code contains TODO or FIXME comments");
        }
    }

    private static boolean bracketsBalanced(String code) {
        Deque<Character> expected = new ArrayDeque<>();
        for (char c : code.toCharArray()) {
            switch (c) {
                case '(' -> expected.push(')');
                case '[' -> expected.push(']');
                case '{' -> expected.push('}');
                case ')', ']', '}' -> {
                    if (expected.isEmpty() || expected.pop() != c) return false;
                }
                default -> { }
            }
        }
        return expected.isEmpty();
    }
}
