package com.siat.siat_backend.model.validation;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class SecurityReport {
    private int securityScore;
    private List<String> vulnerabilities;
    private List<String> recommendations;
    private RiskLevel riskLevel;
}
