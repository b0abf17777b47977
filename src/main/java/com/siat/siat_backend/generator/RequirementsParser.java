package com.siat.siat_backend.generator;

import com.siat.siat_backend.model.generation.ModuleRequirements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword heuristics over the prompt text. Each match is the whole word that starts with
 * one of the known stems ("users" matches "user").
 */
@Component
public class RequirementsParser {

    private static final Pattern ENTITIES = Pattern.compile(
            "\\b(user|customer|product|order|invoice|payment|account|transaction|report|dashboard)\\w*\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern OPERATIONS = Pattern.compile(
            "\\b(create|add|update|edit|delete|remove|list|show|display|search|filter|sort|export|import|calculate|validate)\\w*\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern FIELDS = Pattern.compile(
            "\\b(name|email|phone|address|date|time|number|amount|price|quantity|status|type|category)\\w*\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern UI_COMPONENTS = Pattern.compile(
            "\\b(form|table|chart|graph|button|input|dropdown|checkbox|radio|modal|dialog|tab|accordion)\\w*\\b",
            Pattern.CASE_INSENSITIVE);

    public ModuleRequirements parse(String prompt) {
        String text = prompt != null ? prompt : "";

        // Validation keywords are matched case-sensitively
        List<String> validations = new ArrayList<>();
        if (text.contains("required") || text.contains("mandatory")) validations.add("required");
        if (text.contains("unique")) validations.add("unique");
        if (text.contains("email")) validations.add("email");

        return ModuleRequirements.builder()
                .entities(matches(ENTITIES, text))
                .operations(matches(OPERATIONS, text))
                .fields(matches(FIELDS, text))
                .uiComponents(matches(UI_COMPONENTS, text))
                .validations(validations)
                .build();
    }

    private static List<String> matches(Pattern pattern, String text) {
        Set<String> found = new LinkedHashSet<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            found.add(m.group().toLowerCase(Locale.ROOT));
        }
        return new ArrayList<>(found);
    }
}
