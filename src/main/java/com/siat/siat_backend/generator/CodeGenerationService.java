package com.siat.siat_backend.generator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.siat.siat_backend.model.domain.PromptRecord;
import com.siat.siat_backend.model.generation.GenerationContext;
import com.siat.siat_backend.model.generation.GenerationMetadata;
import com.siat.siat_backend.model.generation.GenerationResult;
import com.siat.siat_backend.model.validation.CodeValidationResult;
import com.siat.siat_backend.repository.PromptRecordRepository;
import com.siat.siat_backend.service.TemplateService;
import com.siat.siat_backend.validation.CodeValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Prompt in, validated code out.
 * <p>
 * The enhanced prompt (requirement + stored template + caller context) goes through the provider
 * chain, the reply is post-processed and syntax-gated (falling back to the base template of the
 * module type), then structurally validated. Attempts made for a known tenant and user are audited.
 * Failures are returned as {@link GenerationResult#failure(String)}, never thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CodeGenerationService {

    private final TemplateService templateService;
    private final CodeProviderChain providerChain;
    private final CodePostProcessor postProcessor;
    private final LocalCodeGenerator localGenerator;
    private final CodeValidator codeValidator;
    private final ComplexityEstimator complexityEstimator;
    private final PromptRecordRepository promptRecordRepo;
    private final ObjectMapper mapper;

    public GenerationResult generate(String prompt, String type, GenerationContext context) {
        log.info("[Generate] Generating code for type: {}", type);
        try {
            Map<String, Object> template = templateService.resolveTemplate(type,
                    context != null ? context.getTenantId() : null);
            String enhancedPrompt = buildEnhancedPrompt(prompt, type, context, template);

            String code;
            Map<String, Object> moduleConfig = null;
            try {
                CodeProviderChain.ProviderOutput output = providerChain.produce(enhancedPrompt, prompt, type);
                code = postProcessor.process(output.code(), type);
                if (codeValidator.passesSyntaxCheck(code, type)) {
                    moduleConfig = output.moduleConfig();
                    log.info("[Generate] Code generation completed for {} via {}", type, output.source());
                } else {
                    log.warn("[Generate] {} output failed the syntax check, falling back to base template", output.source());
                    code = fallbackCode(prompt, type, context);
                }
            } catch (RuntimeException e) {
                log.error("[Generate] Provider chain failed, falling back to base template", e);
                code = fallbackCode(prompt, type, context);
            }

            CodeValidationResult validation = codeValidator.validateCode(code, type);
            if (!validation.isValid()) {
                String error = "Generated code validation failed: " + String.join(", ", validation.getErrors());
                audit(prompt, type, null, false, context, error);
                return GenerationResult.failure(error);
            }

            audit(prompt, type, code, true, context, null);
            GenerationMetadata metadata = new GenerationMetadata(
                    "typescript",
                    frameworkFor(type),
                    dependenciesFor(type),
                    complexityEstimator.estimate(code));
            return GenerationResult.ok(code, metadata, moduleConfig);
        } catch (Exception e) {
            log.error("[Generate] Code generation failed for type {}", type, e);
            audit(prompt, type, null, false, context, e.getMessage());
            return GenerationResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    String buildEnhancedPrompt(String prompt, String type, GenerationContext context, Map<String, Object> template)
            throws JsonProcessingException {
        StringBuilder sb = new StringBuilder();
        sb.append("Generate ").append(type).append(" code for the following requirement:\n\n")
          .append(prompt).append("\n\n");

        if (template != null && !template.isEmpty()) {
            sb.append("Base template structure:\n")
              .append(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(template))
              .append("\n\n");
        }

        if (context != null) {
            sb.append("Context:\n");
            if (context.getVariables() != null) {
                sb.append("Variables: ").append(mapper.writeValueAsString(context.getVariables())).append('\n');
            }
            if (context.getFunctions() != null) {
                sb.append("Available functions: ").append(String.join(", ", context.getFunctions())).append('\n');
            }
            if (context.getLibraries() != null) {
                sb.append("Libraries: ").append(String.join(", ", context.getLibraries())).append('\n');
            }
            if (context.getConstraints() != null) {
                sb.append("Constraints: ").append(String.join(", ", context.getConstraints())).append('\n');
            }
        }

        sb.append("\nRequirements:\n")
          .append("- Write clean, efficient, and well-documented code\n")
          .append("- Follow best practices for ").append(type).append('\n')
          .append("- Include error handling where appropriate\n")
          .append("- Make the code production-ready\n")
          .append("- Return only the code without explanations\n");
        return sb.toString();
    }

    private String fallbackCode(String prompt, String type, GenerationContext context) {
        String contextJson = "";
        if (context != null) {
            try {
                contextJson = mapper.writeValueAsString(context);
            } catch (JsonProcessingException e) {
                log.warn("[Generate] Could not serialise generation context for template substitution", e);
            }
        }
        return localGenerator.renderBaseTemplate(prompt, type, contextJson);
    }

    private void audit(String prompt, String type, String code, boolean success,
                       GenerationContext context, String errorMessage) {
        if (context == null || !context.isAuditable()) return;
        try {
            PromptRecord record = new PromptRecord();
            record.setPrompt(prompt);
            record.setType(type);
            record.setGeneratedCode(code);
            record.setSuccess(success);
            record.setErrorMessage(errorMessage);
            record.setTenantId(context.getTenantId());
            record.setUserId(context.getUserId());
            promptRecordRepo.save(record);
        } catch (DataAccessException e) {
            log.warn("[Generate] Could not store prompt audit record for tenant {}", context.getTenantId(), e);
        }
    }

    static String frameworkFor(String type) {
        String upper = type != null ? type.toUpperCase(Locale.ROOT) : "";
        if (upper.contains("CONTROLLER") || upper.contains("SERVICE")) return "nestjs";
        if (upper.contains("COMPONENT") || upper.contains("PAGE")) return "react";
        return "generic";
    }

    static List<String> dependenciesFor(String type) {
        String upper = type != null ? type.toUpperCase(Locale.ROOT) : "";
        return switch (upper) {
            case "CONTROLLER" -> List.of("@nestjs/common", "@nestjs/swagger", "class-validator");
            case "SERVICE" -> List.of("@nestjs/common", "@prisma/client");
            case "DTO" -> List.of("class-validator", "class-transformer", "@nestjs/swagger");
            default -> List.of("@nestjs/common");
        };
    }
}
