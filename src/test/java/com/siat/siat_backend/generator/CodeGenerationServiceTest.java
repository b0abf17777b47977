package com.siat.siat_backend.generator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.siat.siat_backend.model.domain.PromptRecord;
import com.siat.siat_backend.model.generation.GenerationContext;
import com.siat.siat_backend.model.generation.GenerationResult;
import com.siat.siat_backend.repository.PromptRecordRepository;
import com.siat.siat_backend.service.TemplateService;
import com.siat.siat_backend.validation.CodeValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CodeGenerationServiceTest {

    private static final String VALID_CONTROLLER = """
            @Controller('users')
            export class UsersController {
              @Get()
              findAll() { return []; }
            }""";

    @Mock TemplateService templateService;
    @Mock CodeProviderChain providerChain;
    @Mock PromptRecordRepository promptRecordRepo;

    private CodeGenerationService service;
    private final GenerationContext auditable = GenerationContext.builder().tenantId("t1").userId("u1").build();

    @BeforeEach
    void setUp() {
        LocalCodeGenerator local = new LocalCodeGenerator(new CodeTemplates(), new RequirementsParser(), new ModuleScaffolder());
        service = new CodeGenerationService(templateService, providerChain, new CodePostProcessor(), local,
                new CodeValidator(), new ComplexityEstimator(), promptRecordRepo, new ObjectMapper());
        lenient().when(templateService.resolveTemplate(anyString(), any())).thenReturn(new HashMap<>());
    }

    @Test
    void providerCodeIsReturnedWithMetadataAndAudited() {
        when(providerChain.produce(anyString(), anyString(), eq("CONTROLLER")))
                .thenReturn(new CodeProviderChain.ProviderOutput("```ts\n" + VALID_CONTROLLER + "\n```", null, "OPENAI"));

        GenerationResult result = service.generate("Create a users controller", "CONTROLLER", auditable);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCode()).isEqualTo(VALID_CONTROLLER);
        assertThat(result.getMetadata().getLanguage()).isEqualTo("typescript");
        assertThat(result.getMetadata().getFramework()).isEqualTo("nestjs");
        assertThat(result.getMetadata().getDependencies()).contains("@nestjs/common");

        ArgumentCaptor<PromptRecord> audit = ArgumentCaptor.forClass(PromptRecord.class);
        verify(promptRecordRepo).save(audit.capture());
        assertThat(audit.getValue().isSuccess()).isTrue();
        assertThat(audit.getValue().getTenantId()).isEqualTo("t1");
        assertThat(audit.getValue().getUserId()).isEqualTo("u1");
    }

    @Test
    @DisplayName("output failing the syntax gate is replaced by the base template")
    void syntaxFailureFallsBackToBaseTemplate() {
        when(providerChain.produce(anyString(), anyString(), eq("CONTROLLER")))
                .thenReturn(new CodeProviderChain.ProviderOutput("return null;", null, "ANTHROPIC"));

        GenerationResult result = service.generate("Manage customer accounts", "CONTROLLER", auditable);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCode()).contains("@Controller('customers')");
    }

    @Test
    void chainExceptionFallsBackToBaseTemplate() {
        when(providerChain.produce(anyString(), anyString(), eq("SERVICE")))
                .thenThrow(new IllegalStateException("provider exploded"));

        GenerationResult result = service.generate("Manage product catalog", "SERVICE", auditable);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCode()).contains("@Injectable()", "export class ProductService");
    }

    @Test
    void structurallyInvalidCodeFailsAndIsAudited() {
        when(providerChain.produce(anyString(), anyString(), eq("SERVICE")))
                .thenReturn(new CodeProviderChain.ProviderOutput("export class Plain {}", null, "OPENAI"));

        GenerationResult result = service.generate("Manage product catalog", "SERVICE", auditable);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError())
                .isEqualTo("Generated code validation failed: Service must have @Injectable decorator");
        ArgumentCaptor<PromptRecord> audit = ArgumentCaptor.forClass(PromptRecord.class);
        verify(promptRecordRepo).save(audit.capture());
        assertThat(audit.getValue().isSuccess()).isFalse();
        assertThat(audit.getValue().getGeneratedCode()).isNull();
    }

    @Test
    void scaffoldConfigIsPassedThroughForFlowTypes() {
        Map<String, Object> moduleConfig = Map.of("entity", "users");
        when(providerChain.produce(anyString(), anyString(), eq("CRUD")))
                .thenReturn(new CodeProviderChain.ProviderOutput("export class UsersService {}", moduleConfig,
                        CodeProviderChain.LOCAL));

        GenerationResult result = service.generate("Create users", "CRUD", auditable);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getModuleConfig()).containsEntry("entity", "users");
    }

    @Test
    void anonymousCallsAreNotAudited() {
        when(providerChain.produce(anyString(), anyString(), eq("CONTROLLER")))
                .thenReturn(new CodeProviderChain.ProviderOutput(VALID_CONTROLLER, null, "OPENAI"));

        GenerationResult result = service.generate("Create a users controller", "CONTROLLER",
                GenerationContext.builder().tenantId("t1").build());

        assertThat(result.isSuccess()).isTrue();
        verify(promptRecordRepo, never()).save(any());
    }

    @Test
    void auditFailureDoesNotFailGeneration() {
        when(providerChain.produce(anyString(), anyString(), eq("CONTROLLER")))
                .thenReturn(new CodeProviderChain.ProviderOutput(VALID_CONTROLLER, null, "OPENAI"));
        when(promptRecordRepo.save(any())).thenThrow(new DataIntegrityViolationException("constraint"));

        GenerationResult result = service.generate("Create a users controller", "CONTROLLER", auditable);

        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void enhancedPromptCarriesTemplateAndContext() throws Exception {
        GenerationContext context = GenerationContext.builder()
                .tenantId("t1").userId("u1")
                .libraries(List.of("lodash"))
                .build();

        String enhanced = service.buildEnhancedPrompt("Create a users controller", "CONTROLLER", context,
                Map.of("structure", "nestjs-controller"));

        assertThat(enhanced)
                .contains("Create a users controller")
                .contains("nestjs-controller")
                .contains("Libraries: lodash")
                .contains("Follow best practices for CONTROLLER");
    }
}
