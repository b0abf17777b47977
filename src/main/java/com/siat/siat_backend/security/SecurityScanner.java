package com.siat.siat_backend.security;

import com.siat.siat_backend.model.validation.RiskLevel;
import com.siat.siat_backend.model.validation.SecurityFinding;
import com.siat.siat_backend.model.validation.SecurityReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs every registered detector over the code. The score starts at 100 and loses each hit's
 * severity, floored at 0. Detector order does not change the result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SecurityScanner {

    private final List<SecurityDetector> detectors;

    public SecurityReport analyze(String code, String type) {
        int score = 100;
        List<String> vulnerabilities = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        for (SecurityDetector detector : detectors) {
            Optional<SecurityFinding> finding = detector.inspect(code);
            if (finding.isPresent()) {
                vulnerabilities.add(finding.get().description());
                recommendations.add(finding.get().recommendation());
                score -= finding.get().severity();
            }
        }

        score = Math.max(0, score);
        RiskLevel risk = RiskLevel.fromScore(score);
        if (!vulnerabilities.isEmpty()) {
            log.info("[Security] {} code scored {} ({}): {}", type, score, risk, vulnerabilities);
        }
        return new SecurityReport(score, vulnerabilities, recommendations, risk);
    }
}
