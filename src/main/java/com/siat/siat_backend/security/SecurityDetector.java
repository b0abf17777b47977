package com.siat.siat_backend.security;

import com.siat.siat_backend.model.validation.SecurityFinding;

import java.util.Optional;

public interface SecurityDetector {

    // Empty when the code shows none of the patterns this detector looks for
    Optional<SecurityFinding> inspect(String code);
}
