package com.siat.siat_backend.security;

import com.siat.siat_backend.model.validation.SecurityFinding;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/** Flags the code when any of its patterns is found anywhere in it. */
abstract class PatternDetector implements SecurityDetector {

    private final List<Pattern> patterns;
    private final SecurityFinding finding;

    protected PatternDetector(SecurityFinding finding, Pattern... patterns) {
        this.finding = finding;
        this.patterns = List.of(patterns);
    }

    @Override
    public Optional<SecurityFinding> inspect(String code) {
        if (code == null) return Optional.empty();
        return matches(code) ? Optional.of(finding) : Optional.empty();
    }

    protected boolean matches(String code) {
        return patterns.stream().anyMatch(p -> p.matcher(code).find());
    }
}

@Component
class SqlInjectionDetector extends PatternDetector {
    SqlInjectionDetector() {
        super(new SecurityFinding(
                        "Potential SQL injection vulnerability detected",
                        "Use parameterized queries or ORM methods instead of string concatenation",
                        25),
                Pattern.compile("query\\s*\\(\\s*[`'\"]\\s*SELECT.*\\$\\{"),
                Pattern.compile("SELECT.*\\+.*\\+"));
    }
}

@Component
class XssDetector extends PatternDetector {
    XssDetector() {
        super(new SecurityFinding(
                        "Potential XSS vulnerability detected",
                        "Use textContent or sanitize HTML content before rendering",
                        20),
                Pattern.compile("innerHTML\\s*="),
                Pattern.compile("document\\.write\\s*\\("));
    }
}

@Component
class HardcodedSecretDetector extends PatternDetector {
    HardcodedSecretDetector() {
        super(new SecurityFinding(
                        "Hardcoded secrets detected in code",
                        "Use environment variables or secure configuration management",
                        30),
                Pattern.compile("password\\s*[:=]\\s*['\"][^'\"]+['\"]", Pattern.CASE_INSENSITIVE),
                Pattern.compile("api[_-]?key\\s*[:=]\\s*['\"][^'\"]+['\"]", Pattern.CASE_INSENSITIVE),
                Pattern.compile("secret\\s*[:=]\\s*['\"][^'\"]+['\"]", Pattern.CASE_INSENSITIVE),
                Pattern.compile("token\\s*[:=]\\s*['\"][^'\"]+['\"]", Pattern.CASE_INSENSITIVE));
    }
}

@Component
class WeakRandomnessDetector extends PatternDetector {

    private static final Pattern MATH_RANDOM = Pattern.compile("Math\\.random\\(\\)");
    private static final Pattern SENSITIVE = Pattern.compile("password|token|key|secret", Pattern.CASE_INSENSITIVE);

    WeakRandomnessDetector() {
        super(new SecurityFinding(
                "Weak randomness used for security-sensitive operations",
                "Use crypto.randomBytes() or crypto.getRandomValues() for cryptographic randomness",
                15));
    }

    // Both must appear, not necessarily on the same line
    @Override
    protected boolean matches(String code) {
        return MATH_RANDOM.matcher(code).find() && SENSITIVE.matcher(code).find();
    }
}

@Component
class UnsafeEvalDetector extends PatternDetector {
    UnsafeEvalDetector() {
        super(new SecurityFinding(
                        "Unsafe code execution detected (eval or Function constructor)",
                        "Avoid eval() and Function constructor. Use safer alternatives like JSON.parse()",
                        35),
                Pattern.compile("eval\\s*\\("),
                Pattern.compile("new\\s+Function\\s*\\("));
    }
}

@Component
class MissingValidationDetector extends PatternDetector {

    private static final Pattern INPUTS = Pattern.compile("@Body|@Query|@Param");
    private static final Pattern VALIDATION = Pattern.compile("@IsString|@IsNumber|@IsEmail|validate");

    MissingValidationDetector() {
        super(new SecurityFinding(
                "Missing input validation on API endpoints",
                "Add validation decorators (@IsString, @IsEmail, etc.) to DTOs",
                20));
    }

    @Override
    protected boolean matches(String code) {
        return INPUTS.matcher(code).find() && !VALIDATION.matcher(code).find();
    }
}

@Component
class InsecureHttpDetector extends PatternDetector {
    InsecureHttpDetector() {
        super(new SecurityFinding(
                        "Insecure HTTP URLs detected",
                        "Use HTTPS URLs for all external communications",
                        10),
                Pattern.compile("http://"));
    }
}

@Component
class WeakCryptoDetector extends PatternDetector {
    WeakCryptoDetector() {
        super(new SecurityFinding(
                        "Weak cryptographic algorithms detected",
                        "Use strong algorithms like SHA-256, AES-256, or bcrypt for hashing",
                        25),
                Pattern.compile("md5|sha1|des|rc4", Pattern.CASE_INSENSITIVE));
    }
}
