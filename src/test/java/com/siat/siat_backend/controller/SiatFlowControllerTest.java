package com.siat.siat_backend.controller;

import com.siat.siat_backend.FlowStatus;
import com.siat.siat_backend.exception.FlowStateException;
import com.siat.siat_backend.exception.InvalidPromptException;
import com.siat.siat_backend.exception.SiatNotFoundException;
import com.siat.siat_backend.model.domain.Flow;
import com.siat.siat_backend.model.domain.FlowType;
import com.siat.siat_backend.model.dto.PagedResponse;
import com.siat.siat_backend.service.SiatFlowService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SiatFlowController.class)
class SiatFlowControllerTest {

    private static final String VALID_BODY = """
            {"name":"Users","type":"API","prompt":"Create a user management API with email field"}
            """;

    @Autowired MockMvc mockMvc;
    @MockBean SiatFlowService flowService;

    @Test
    void createReturns201() throws Exception {
        Flow flow = new Flow();
        flow.setId(UUID.randomUUID());
        flow.setName("Users");
        flow.setType(FlowType.API);
        flow.setStatus(FlowStatus.GENERATING);
        flow.setPublicFlow(true);
        when(flowService.create(any(), eq("t1"), eq("u1"))).thenReturn(flow);

        mockMvc.perform(post("/siat/flows")
                        .header("X-Tenant-Id", "t1").header("X-User-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON).content(VALID_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Users"))
                .andExpect(jsonPath("$.status").value("GENERATING"))
                .andExpect(jsonPath("$.isPublic").value(true))
                .andExpect(jsonPath("$.public").doesNotExist())
                .andExpect(jsonPath("$.publicFlow").doesNotExist());
    }

    @Test
    void missingTenantHeaderIs400() throws Exception {
        mockMvc.perform(post("/siat/flows")
                        .contentType(MediaType.APPLICATION_JSON).content(VALID_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.status").value(400));
        verifyNoInteractions(flowService);
    }

    @Test
    void invalidBodyListsFieldErrors() throws Exception {
        mockMvc.perform(post("/siat/flows").header("X-Tenant-Id", "t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"\",\"type\":\"API\",\"prompt\":\"short\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"))
                .andExpect(jsonPath("$.message").value("Invalid input parameters"))
                .andExpect(jsonPath("$.errors.name").exists())
                .andExpect(jsonPath("$.errors.prompt").exists());
    }

    @Test
    void rejectedPromptIs400WithIndexedErrors() throws Exception {
        when(flowService.create(any(), any(), any()))
                .thenThrow(new InvalidPromptException(List.of("Prompt must be at least 10 characters long")));

        mockMvc.perform(post("/siat/flows").header("X-Tenant-Id", "t1")
                        .contentType(MediaType.APPLICATION_JSON).content(VALID_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Prompt"))
                .andExpect(jsonPath("$.errors['0']").value("Prompt must be at least 10 characters long"));
    }

    @Test
    void unknownFlowIs404() throws Exception {
        UUID id = UUID.randomUUID();
        when(flowService.get(id, "t1")).thenThrow(new SiatNotFoundException("SIAT flow not found"));

        mockMvc.perform(get("/siat/flows/{id}", id).header("X-Tenant-Id", "t1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("SIAT flow not found"));
    }

    @Test
    void malformedIdIs400() throws Exception {
        mockMvc.perform(get("/siat/flows/not-a-uuid").header("X-Tenant-Id", "t1"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void manualDeployedStatusIs400() throws Exception {
        UUID id = UUID.randomUUID();
        when(flowService.update(eq(id), any(), eq("t1"), any()))
                .thenThrow(new FlowStateException("Status DEPLOYED can only be reached through deploy"));

        mockMvc.perform(patch("/siat/flows/{id}", id).header("X-Tenant-Id", "t1")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"status\":\"DEPLOYED\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Status DEPLOYED can only be reached through deploy"));
    }

    @Test
    void deployingAnUngeneratedFlowIs400() throws Exception {
        UUID id = UUID.randomUUID();
        when(flowService.deploy(eq(id), any(), eq("t1")))
                .thenThrow(new FlowStateException("Flow must be generated before deployment"));

        mockMvc.perform(post("/siat/flows/{id}/deploy", id).header("X-Tenant-Id", "t1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Flow must be generated before deployment"));
    }

    @Test
    void listUsesDefaultPaging() throws Exception {
        when(flowService.list("t1", 1, 10))
                .thenReturn(new PagedResponse<>(true, List.of(), new PagedResponse.Pagination(1, 10, 0, 0)));

        mockMvc.perform(get("/siat/flows").header("X-Tenant-Id", "t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.pagination.limit").value(10));
    }

    @Test
    void deleteConfirms() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(delete("/siat/flows/{id}", id).header("X-Tenant-Id", "t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("SIAT flow deleted successfully"));
        verify(flowService).delete(id, "t1");
    }
}
