package com.siat.siat_backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.siat.siat_backend.FlowStatus;
import com.siat.siat_backend.engine.FlowEventPublisher;
import com.siat.siat_backend.generator.CodeGenerationService;
import com.siat.siat_backend.model.domain.Flow;
import com.siat.siat_backend.model.generation.GenerationMetadata;
import com.siat.siat_backend.model.generation.GenerationResult;
import com.siat.siat_backend.repository.FlowRepository;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.dao.DataIntegrityViolationException;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FlowGenerationWorkerTest {

    @Mock CodeGenerationService generationService;
    @Mock FlowRepository flowRepository;
    @Mock FlowEventPublisher eventPublisher;

    private FlowGenerationWorker worker;
    private Flow flow;

    @BeforeEach
    void setUp() {
        worker = new FlowGenerationWorker(generationService, flowRepository, eventPublisher, new ObjectMapper());
        flow = new Flow();
        flow.setId(UUID.randomUUID());
        flow.setStatus(FlowStatus.GENERATING);
        flow.setConfig(new HashMap<>(Map.of("owner", "ops")));
    }

    @Test
    void successStoresCodeAndMergesConfig() {
        GenerationMetadata metadata = new GenerationMetadata("typescript", "express", List.of("express"), 3);
        when(generationService.generate(eq("prompt text"), eq("API"), any()))
                .thenReturn(GenerationResult.ok("export {}", metadata, Map.of("entity", "user")));
        when(flowRepository.findById(flow.getId())).thenReturn(Optional.of(flow));

        worker.generate(flow.getId(), "prompt text", "API", "t1", "u1");

        assertThat(flow.getStatus()).isEqualTo(FlowStatus.GENERATED);
        assertThat(flow.getGeneratedCode()).isEqualTo("export {}");
        assertThat(flow.getConfig()).containsEntry("owner", "ops").containsEntry("entity", "user")
                .containsKeys("generatedAt", "metadata");
        assertThat(flow.getConfig().get("metadata"))
                .asInstanceOf(InstanceOfAssertFactories.map(String.class, Object.class))
                .containsEntry("language", "typescript");
        verify(flowRepository).save(flow);
        verify(eventPublisher).statusChanged(flow.getId(), FlowStatus.GENERATED, null);
    }

    @Test
    void failureMarksTheFlowErrored() {
        when(generationService.generate(any(), any(), any())).thenReturn(GenerationResult.failure("All providers failed"));
        when(flowRepository.findById(flow.getId())).thenReturn(Optional.of(flow));

        worker.generate(flow.getId(), "prompt text", "API", "t1", "u1");

        assertThat(flow.getStatus()).isEqualTo(FlowStatus.ERROR);
        assertThat(flow.getConfig()).containsEntry("error", "All providers failed").containsKey("errorAt")
                .doesNotContainKey("owner");
        verify(eventPublisher).statusChanged(flow.getId(), FlowStatus.ERROR, "All providers failed");
    }

    @Test
    void thrownExceptionIsRecordedAsError() {
        when(generationService.generate(any(), any(), any())).thenThrow(new IllegalStateException("disk full"));
        when(flowRepository.findById(flow.getId())).thenReturn(Optional.of(flow));

        worker.generate(flow.getId(), "prompt text", "API", "t1", "u1");

        assertThat(flow.getStatus()).isEqualTo(FlowStatus.ERROR);
        assertThat(flow.getConfig()).containsEntry("error", "disk full");
    }

    @Test
    void lostStatusEventKeepsTheGeneratedCode() {
        when(generationService.generate(any(), any(), any())).thenReturn(GenerationResult.ok("export {}", null, null));
        when(flowRepository.findById(flow.getId())).thenReturn(Optional.of(flow));
        doThrow(new IllegalStateException("redis down"))
                .when(eventPublisher).statusChanged(any(), eq(FlowStatus.GENERATED), any());

        worker.generate(flow.getId(), "prompt text", "API", "t1", "u1");

        assertThat(flow.getStatus()).isEqualTo(FlowStatus.GENERATED);
        assertThat(flow.getGeneratedCode()).isEqualTo("export {}");
        assertThat(flow.getConfig()).containsEntry("owner", "ops").doesNotContainKey("error");
        verify(flowRepository, times(1)).save(flow);
        verify(eventPublisher, never()).statusChanged(any(), eq(FlowStatus.ERROR), any());
    }

    @Test
    void storageFailureMarksTheFlowErrored() {
        when(generationService.generate(any(), any(), any())).thenReturn(GenerationResult.ok("export {}", null, null));
        when(flowRepository.findById(flow.getId())).thenReturn(Optional.of(flow));
        when(flowRepository.save(flow))
                .thenThrow(new DataIntegrityViolationException("value too long"))
                .thenReturn(flow);

        worker.generate(flow.getId(), "prompt text", "API", "t1", "u1");

        assertThat(flow.getStatus()).isEqualTo(FlowStatus.ERROR);
        assertThat((String) flow.getConfig().get("error")).startsWith("Could not store generated code");
        verify(eventPublisher, never()).statusChanged(any(), eq(FlowStatus.GENERATED), any());
        verify(eventPublisher).statusChanged(eq(flow.getId()), eq(FlowStatus.ERROR), any());
    }

    @Test
    void lostErrorEventDoesNotEscape() {
        when(generationService.generate(any(), any(), any())).thenReturn(GenerationResult.failure("no provider"));
        when(flowRepository.findById(flow.getId())).thenReturn(Optional.of(flow));
        doThrow(new IllegalStateException("redis down"))
                .when(eventPublisher).statusChanged(any(), eq(FlowStatus.ERROR), any());

        worker.generate(flow.getId(), "prompt text", "API", "t1", "u1");

        assertThat(flow.getStatus()).isEqualTo(FlowStatus.ERROR);
        assertThat(flow.getConfig()).containsEntry("error", "no provider");
    }

    @Test
    void vanishedFlowIsSkipped() {
        when(generationService.generate(any(), any(), any())).thenReturn(GenerationResult.ok("x", null, null));
        when(flowRepository.findById(flow.getId())).thenReturn(Optional.empty());

        worker.generate(flow.getId(), "prompt text", "API", "t1", "u1");

        verify(flowRepository, never()).save(any());
        verify(eventPublisher, never()).statusChanged(any(), any(), any());
    }
}
