package com.siat.siat_backend.optimizer;

import com.siat.siat_backend.generator.LanguageFamily;
import com.siat.siat_backend.validation.CodeValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex rewrites over generated code: a language pass, general rewrites, then a security pass.
 * The rewritten code must pass both the syntax check and the structural check for its type,
 * otherwise the input is returned untouched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CodeOptimizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Script
    private static final Pattern CONSOLE_LOG = Pattern.compile("console\\.log\\([^)]*\\);?\\s*");
    private static final Pattern VAR_DECL = Pattern.compile("var\\s+");
    private static final Pattern REPEATED_SEMICOLONS = Pattern.compile(";+");
    private static final Pattern ANONYMOUS_FUNCTION = Pattern.compile("function\\s*\\(([^)]*)\\)\\s*\\{");

    // Python
    private static final Pattern PRINT_CALL = Pattern.compile("print\\([^)]*\\)\\s*");
    private static final Pattern TRIPLE_BLANK = Pattern.compile("\\n\\s*\\n\\s*\\n");
    private static final Pattern APPEND_LOOP = Pattern.compile("for\\s+(\\w+)\\s+in\\s+([^:]+):\\s*\\n\\s*(\\w+)\\.append\\(([^)]+)\\)");

    // SQL
    private static final List<String> SQL_KEYWORDS = List.of(
            "SELECT", "FROM", "WHERE", "JOIN", "INNER", "LEFT", "RIGHT", "ON", "GROUP BY", "ORDER BY", "HAVING");
    private static final Pattern WHERE_TAUTOLOGY = Pattern.compile("WHERE\\s+1\\s*=\\s*1\\s+AND", Pattern.CASE_INSENSITIVE);

    // General
    private static final Pattern DEAD_CODE = Pattern.compile("(return[^;]*;)[\\s\\S]*?(?=\\n\\s*\\}|\\n\\s*$)");
    private static final Pattern INDEX_LOOP = Pattern.compile(
            "for\\s*\\(\\s*let\\s+(\\w+)\\s*=\\s*0\\s*;\\s*\\1\\s*<\\s*(\\w+)\\.length\\s*;\\s*\\1\\+\\+\\s*\\)\\s*\\{([^}]*)\\}");
    private static final Pattern SIMPLE_FUNCTION = Pattern.compile(
            "function\\s+(\\w+)\\s*\\([^)]*\\)\\s*\\{\\s*return\\s+([^;]+);\\s*\\}");
    private static final Pattern INCLUDES = Pattern.compile("(\\w+)\\.includes\\(");

    // Security
    private static final Pattern EVAL = Pattern.compile("eval\\s*\\(");
    private static final Pattern INNER_HTML = Pattern.compile("innerHTML\\s*=");
    private static final Pattern DOCUMENT_WRITE = Pattern.compile("document\\.write\\s*\\(");
    private static final Pattern BODY_PARAM = Pattern.compile("@Body\\(\\)\\s+(\\w+):");

    private final CodeValidator codeValidator;

    public String optimize(String code, String type) {
        if (code == null) return null;
        try {
            String optimized = switch (LanguageFamily.of(type)) {
                case SCRIPT -> optimizeScript(code);
                case PYTHON -> optimizePython(code);
                case SQL -> optimizeSql(code);
                case OTHER -> collapseWhitespace(code);
            };
            optimized = applyGeneralRewrites(optimized);
            optimized = applySecurityRewrites(optimized, type);

            if (!codeValidator.passesSyntaxCheck(optimized, type)
                    || !codeValidator.validateCode(optimized, type).isValid()) {
                log.warn("[Optimize] Optimization produced invalid {} code, returning original", type);
                return code;
            }
            log.info("[Optimize] Code optimization completed for {}: {} -> {} chars", type, code.length(), optimized.length());
            return optimized;
        } catch (RuntimeException e) {
            log.error("[Optimize] Error optimizing {} code, returning original", type, e);
            return code;
        }
    }

    private String optimizeScript(String code) {
        String optimized = CONSOLE_LOG.matcher(code).replaceAll("");
        optimized = VAR_DECL.matcher(optimized).replaceAll("const ");
        optimized = REPEATED_SEMICOLONS.matcher(optimized).replaceAll(";");
        optimized = ANONYMOUS_FUNCTION.matcher(optimized).replaceAll("($1) => {");
        return collapseWhitespace(optimized);
    }

    private String optimizePython(String code) {
        String optimized = PRINT_CALL.matcher(code).replaceAll("");
        optimized = TRIPLE_BLANK.matcher(optimized).replaceAll("\n\n");
        return APPEND_LOOP.matcher(optimized).replaceAll("$3 = [$4 for $1 in $2]");
    }

    private String optimizeSql(String code) {
        String optimized = code;
        for (String keyword : SQL_KEYWORDS) {
            Pattern p = Pattern.compile("\\b" + keyword.toLowerCase(Locale.ROOT) + "\\b", Pattern.CASE_INSENSITIVE);
            optimized = p.matcher(optimized).replaceAll(keyword);
        }
        optimized = collapseWhitespace(optimized);
        return WHERE_TAUTOLOGY.matcher(optimized).replaceAll("WHERE");
    }

    private String applyGeneralRewrites(String code) {
        String optimized = DEAD_CODE.matcher(code).replaceAll("$1");
        optimized = INDEX_LOOP.matcher(optimized).replaceAll("for(const item of $2) {$3}");
        optimized = inlineSimpleFunctions(optimized);
        return INCLUDES.matcher(optimized).replaceAll("new Set($1).has(");
    }

    private String inlineSimpleFunctions(String code) {
        Map<String, String> bodies = new LinkedHashMap<>();
        Matcher m = SIMPLE_FUNCTION.matcher(code);
        while (m.find()) {
            bodies.put(m.group(1), m.group(2));
        }
        if (bodies.isEmpty()) return code;

        String optimized = SIMPLE_FUNCTION.matcher(code).replaceAll("");
        for (Map.Entry<String, String> fn : bodies.entrySet()) {
            Pattern call = Pattern.compile("\\b" + Pattern.quote(fn.getKey()) + "\\s*\\([^)]*\\)");
            optimized = call.matcher(optimized).replaceAll(Matcher.quoteReplacement("(" + fn.getValue() + ")"));
        }
        return optimized;
    }

    private String applySecurityRewrites(String code, String type) {
        String secured = EVAL.matcher(code).replaceAll("// SECURITY: eval() removed - ");
        secured = INNER_HTML.matcher(secured).replaceAll("textContent =");
        secured = DOCUMENT_WRITE.matcher(secured).replaceAll("// SECURITY: document.write() removed - ");

        if (type != null && type.toLowerCase(Locale.ROOT).contains("controller") && !secured.contains("validate")) {
            secured = BODY_PARAM.matcher(secured).replaceAll("@Body(ValidationPipe) $1:");
        }
        return secured.replace("http://", "https://");
    }

    private static String collapseWhitespace(String code) {
        return WHITESPACE.matcher(code).replaceAll(" ").trim();
    }
}
