package com.siat.siat_backend.controller;

import com.siat.siat_backend.exception.InvalidPromptException;
import com.siat.siat_backend.generator.CodeGenerationService;
import com.siat.siat_backend.generator.ModuleKind;
import com.siat.siat_backend.model.domain.FlowType;
import com.siat.siat_backend.model.dto.CodeRequestDto;
import com.siat.siat_backend.model.dto.GenerateCodeDto;
import com.siat.siat_backend.model.generation.GenerationContext;
import com.siat.siat_backend.model.generation.GenerationResult;
import com.siat.siat_backend.model.validation.PromptValidationResult;
import com.siat.siat_backend.optimizer.CodeOptimizer;
import com.siat.siat_backend.security.SecurityScanner;
import com.siat.siat_backend.validation.CodeValidator;
import com.siat.siat_backend.validation.PromptValidator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Stateless generation tools: generate, validate, optimize. */
@RestController
@RequestMapping("/siat")
@RequiredArgsConstructor
public class SiatController {

    private static final List<String> LANGUAGES = List.of("typescript", "javascript", "python", "sql");

    private final PromptValidator promptValidator;
    private final CodeGenerationService generationService;
    private final CodeValidator codeValidator;
    private final SecurityScanner securityScanner;
    private final CodeOptimizer codeOptimizer;

    @PostMapping("/generate")
    public GenerationResult generate(@Valid @RequestBody GenerateCodeDto dto,
                                     @RequestHeader(SiatFlowController.TENANT_HEADER) String tenantId,
                                     @RequestHeader(value = SiatFlowController.USER_HEADER, defaultValue = "system") String userId) {
        PromptValidationResult validation = promptValidator.validate(dto.prompt());
        if (!validation.isValid()) {
            throw new InvalidPromptException(validation.getErrors());
        }
        // Identity always comes from the headers, never from the body
        GenerationContext context = dto.context() != null ? dto.context() : new GenerationContext();
        context.setTenantId(tenantId);
        context.setUserId(userId);
        return generationService.generate(dto.prompt(), dto.type(), context);
    }

    @PostMapping("/validate")
    public Map<String, Object> validate(@Valid @RequestBody CodeRequestDto dto) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("validation", codeValidator.validateCode(dto.code(), dto.type()));
        response.put("security", securityScanner.analyze(dto.code(), dto.type()));
        return response;
    }

    @PostMapping("/optimize")
    public Map<String, Object> optimize(@Valid @RequestBody CodeRequestDto dto) {
        String optimized = codeOptimizer.optimize(dto.code(), dto.type());
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("original", dto.code());
        response.put("optimized", optimized);
        response.put("changed", !optimized.equals(dto.code()));
        return response;
    }

    @GetMapping("/capabilities")
    public Map<String, Object> capabilities() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("flowTypes", Arrays.stream(FlowType.values()).map(Enum::name).toList());
        response.put("moduleTypes", Arrays.stream(ModuleKind.values()).map(Enum::name).toList());
        response.put("languages", LANGUAGES);
        response.put("promptLength", Map.of("min", PromptValidator.MIN_LENGTH, "max", PromptValidator.MAX_LENGTH));
        return response;
    }
}
