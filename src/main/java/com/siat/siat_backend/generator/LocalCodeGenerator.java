package com.siat.siat_backend.generator;

import com.siat.siat_backend.model.domain.FlowType;
import com.siat.siat_backend.model.generation.ModuleRequirements;
import com.siat.siat_backend.model.generation.ScaffoldedModule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last link of the provider chain. Output is always derived from the fixed template library:
 * flow types get a module scaffold, module kinds with a base template get that template,
 * everything else gets the canned snippet of its language family with prompt keywords spliced in.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocalCodeGenerator {

    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "for", "with", "that", "this", "from", "they", "have", "will", "code", "function");

    private static final Pattern GENERIC = Pattern.compile("Generic");
    private static final Pattern ADVANCED = Pattern.compile("Advanced");
    private static final Pattern DATA = Pattern.compile("data", Pattern.CASE_INSENSITIVE);
    private static final Pattern ITEM = Pattern.compile("item", Pattern.CASE_INSENSITIVE);

    private final CodeTemplates templates;
    private final RequirementsParser requirementsParser;
    private final ModuleScaffolder scaffolder;

    public ScaffoldedModule generate(String prompt, String type) {
        var flowType = FlowType.parse(type);
        if (flowType.isPresent()) {
            ModuleRequirements req = requirementsParser.parse(prompt);
            log.debug("[Local] Scaffolding {} module (entities={}, operations={})",
                    flowType.get(), req.getEntities(), req.getOperations());
            return scaffolder.scaffold(flowType.get(), req);
        }
        if (templates.hasBaseTemplate(type)) {
            return new ScaffoldedModule(renderBaseTemplate(prompt, type, ""), null);
        }
        String canned = templates.canned(LanguageFamily.of(type));
        return new ScaffoldedModule(customize(canned, prompt), null);
    }

    /** Base template of the module type with names derived from the first entity found in the prompt. */
    public String renderBaseTemplate(String prompt, String type, String context) {
        List<String> entities = requirementsParser.parse(prompt).getEntities();
        String entity = entities.isEmpty() ? "item" : entities.get(0);
        String entityClass = ModuleScaffolder.capitalize(entity);

        Map<String, String> vars = new HashMap<>();
        vars.put("prompt", prompt);
        vars.put("type", type);
        vars.put("context", context != null ? context : "");
        vars.put("timestamp", Instant.now().toString());
        vars.put("name", entityClass);
        vars.put("path", entity + "s");
        vars.put("className", entityClass);
        vars.put("serviceName", entity + "Service");
        vars.put("ServiceClass", entityClass + "Service");
        vars.put("entities", entity + "s");
        vars.put("entity", entity);
        vars.put("EntityClass", entityClass);
        vars.put("modelName", entity);
        vars.put("entityName", entity);
        vars.put("description", entityClass + " name");
        return templates.renderBase(type, vars);
    }

    String customize(String template, String prompt) {
        String customized = template;
        for (String keyword : extractKeywords(prompt)) {
            String cap = ModuleScaffolder.capitalize(keyword);
            customized = replace(GENERIC, customized, cap);
            customized = replace(ADVANCED, customized, "Enhanced" + cap);
            customized = replace(DATA, customized, keyword);
            customized = replace(ITEM, customized, keyword + "Item");
        }
        return customized;
    }

    static List<String> extractKeywords(String prompt) {
        if (prompt == null) return List.of();
        return Arrays.stream(prompt.toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(w -> w.length() > 3 && !STOPWORDS.contains(w))
                .limit(2)
                .toList();
    }

    private static String replace(Pattern pattern, String text, String replacement) {
        return pattern.matcher(text).replaceAll(Matcher.quoteReplacement(replacement));
    }
}
