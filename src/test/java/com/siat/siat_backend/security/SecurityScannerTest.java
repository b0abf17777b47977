package com.siat.siat_backend.security;

import com.siat.siat_backend.model.validation.RiskLevel;
import com.siat.siat_backend.model.validation.SecurityReport;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SecurityScannerTest {

    private static List<SecurityDetector> allDetectors() {
        return List.of(
                new SqlInjectionDetector(),
                new XssDetector(),
                new HardcodedSecretDetector(),
                new WeakRandomnessDetector(),
                new UnsafeEvalDetector(),
                new MissingValidationDetector(),
                new InsecureHttpDetector(),
                new WeakCryptoDetector());
    }

    private final SecurityScanner scanner = new SecurityScanner(allDetectors());

    @Test
    void cleanSnippetScoresFullMarks() {
        SecurityReport report = scanner.analyze("function add(a, b) { return a + b; }", "javascript");

        assertThat(report.getSecurityScore()).isEqualTo(100);
        assertThat(report.getRiskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(report.getVulnerabilities()).isEmpty();
        assertThat(report.getRecommendations()).isEmpty();
    }

    @Test
    void hardcodedPasswordDropsToMedium() {
        SecurityReport report = scanner.analyze("const password = \"x\";", "javascript");

        assertThat(report.getSecurityScore()).isEqualTo(70);
        assertThat(report.getRiskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(report.getVulnerabilities()).containsExactly("Hardcoded secrets detected in code");
        assertThat(report.getRecommendations())
                .containsExactly("Use environment variables or secure configuration management");
    }

    @Test
    void severitiesAccumulate() {
        String code = "el.innerHTML = input;\neval(input);\nconst password = \"p\";";

        SecurityReport report = scanner.analyze(code, "javascript");

        assertThat(report.getSecurityScore()).isEqualTo(15);
        assertThat(report.getRiskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(report.getVulnerabilities()).hasSize(3);
    }

    @Test
    void scoreNeverGoesBelowZero() {
        String code = String.join("\n",
                "db.query(\"SELECT * FROM t WHERE a = ${x}\");",
                "el.innerHTML = x;",
                "const apiKey = 'k';",
                "const token = Math.random();",
                "new Function('return 1')();",
                "handle(@Body() body) {}",
                "fetch('http://example.com');",
                "hash('md5');");

        SecurityReport report = scanner.analyze(code, "typescript");

        assertThat(report.getSecurityScore()).isZero();
        assertThat(report.getVulnerabilities()).hasSize(8);
    }

    @Test
    void detectorOrderDoesNotChangeResult() {
        List<SecurityDetector> reversed = new ArrayList<>(allDetectors());
        Collections.reverse(reversed);
        String code = "el.innerHTML = x;\nfetch('http://example.com');";

        SecurityReport forward = scanner.analyze(code, "javascript");
        SecurityReport backward = new SecurityScanner(reversed).analyze(code, "javascript");

        assertThat(backward.getSecurityScore()).isEqualTo(forward.getSecurityScore()).isEqualTo(70);
        assertThat(backward.getVulnerabilities()).containsExactlyInAnyOrderElementsOf(forward.getVulnerabilities());
    }

    @Test
    void weakRandomnessNeedsSensitiveContext() {
        assertThat(new WeakRandomnessDetector().inspect("const n = Math.random();")).isEmpty();
        assertThat(new WeakRandomnessDetector().inspect("const n = Math.random();\nconst secretValue = n;")).isPresent();
    }

    @Test
    void validatedInputsAreNotFlagged() {
        MissingValidationDetector detector = new MissingValidationDetector();
        assertThat(detector.inspect("create(@Body() dto) {}")).isPresent();
        assertThat(detector.inspect("create(@Body() dto) {}\n@IsString() name;")).isEmpty();
    }
}
