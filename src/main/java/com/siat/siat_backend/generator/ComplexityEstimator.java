package com.siat.siat_backend.generator;

import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Weighted token count used as the "estimatedComplexity" of generated code.
 * Patterns match substrings, so "format" counts as a loop and "notify" as a condition.
 */
@Component
public class ComplexityEstimator {

    private static final Pattern FUNCTIONS = Pattern.compile("function|=>");
    private static final Pattern CONDITIONS = Pattern.compile("if|switch|for|while|catch");
    private static final Pattern LOOPS = Pattern.compile("for|while|forEach|map|filter|reduce");
    private static final Pattern DEPENDENCIES = Pattern.compile("import|require");
    private static final Pattern ASYNC = Pattern.compile("async|await|Promise|then|catch");

    public int estimate(String code) {
        if (code == null || code.isEmpty()) return 0;

        long lines = code.lines().filter(l -> !l.trim().isEmpty()).count();
        double score = lines * 0.1
                + count(FUNCTIONS, code) * 2
                + count(CONDITIONS, code) * 3
                + count(LOOPS, code) * 2.5
                + maxNesting(code) * 4
                + count(DEPENDENCIES, code) * 1.5
                + count(ASYNC, code) * 2;
        return (int) Math.round(score);
    }

    static int maxNesting(String code) {
        int max = 0;
        int depth = 0;
        for (char c : code.toCharArray()) {
            if (c == '{') {
                depth++;
                max = Math.max(max, depth);
            } else if (c == '}') {
                depth--;
            }
        }
        return max;
    }

    private static int count(Pattern pattern, String code) {
        Matcher m = pattern.matcher(code);
        int n = 0;
        while (m.find()) n++;
        return n;
    }
}
