package com.siat.siat_backend.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    boolean success;
    int status;
    String error;
    String message;
    // Field -> message for bean validation, index -> message for prompt rules
    Map<String, String> errors;
    Instant timestamp;
}
