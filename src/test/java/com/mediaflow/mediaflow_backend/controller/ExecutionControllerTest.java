package com.mediaflow.mediaflow_backend.controller;

import com.mediaflow.mediaflow_backend.config.MediaflowProperties;
import com.mediaflow.mediaflow_backend.engine.InvalidPlanException;
import com.mediaflow.mediaflow_backend.model.domain.Execution;
import com.mediaflow.mediaflow_backend.model.domain.JobType;
import com.mediaflow.mediaflow_backend.model.dto.ExecuteOptions;
import com.mediaflow.mediaflow_backend.model.dto.ExecutionStatusResponse;
import com.mediaflow.mediaflow_backend.model.job.ExecutionStatus;
import com.mediaflow.mediaflow_backend.model.plan.ExecutionPlan;
import com.mediaflow.mediaflow_backend.service.ExecutionService;
import com.mediaflow.mediaflow_backend.service.UsageLimitExceededException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ExecutionController.class)
class ExecutionControllerTest {

    private static final String PLAN = """
            {
              "executionPlan": {
                "jobs": [
                  {"id": "job1", "type": "generateImage", "params": {"modelId": "fal-ai/nano-banana", "prompt": "a fox"}, "dependsOn": []},
                  {"id": "job2", "type": "generate", "params": {"modelId": "minimax/video-01", "image": "_imageJobDependency:job1"}, "dependsOn": ["job1"]}
                ]
              },
              "options": {"webhook": "https://hooks.example.com/done", "providerApiKeys": {"fal": "fal-key"}}
            }
            """;

    @Autowired private MockMvc mockMvc;
    @Autowired private MediaflowProperties properties;
    @MockitoBean private ExecutionService executionService;

    @Test
    void storedMediaIsServedFromTheStorageRoot() throws Exception {
        String name = UUID.randomUUID() + ".txt";
        Path file = Path.of(properties.getStorage().getRoot(), "executions", name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "stored");
        try {
            mockMvc.perform(get("/media/executions/" + name))
                    .andExpect(status().isOk())
                    .andExpect(content().string("stored"));
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    void submissionIsAcceptedWithTheExecutionId() throws Exception {
        Execution execution = new Execution();
        execution.setId(UUID.randomUUID());
        when(executionService.submit(eq("acme"), any(), any())).thenReturn(execution);

        mockMvc.perform(post("/api/execute")
                        .header(ExecutionController.ORGANIZATION_HEADER, "acme")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PLAN))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.executionId").value(execution.getId().toString()))
                .andExpect(jsonPath("$.status").value("pending"));

        ArgumentCaptor<ExecutionPlan> plan = ArgumentCaptor.forClass(ExecutionPlan.class);
        ArgumentCaptor<ExecuteOptions> options = ArgumentCaptor.forClass(ExecuteOptions.class);
        verify(executionService).submit(eq("acme"), plan.capture(), options.capture());
        assertThat(plan.getValue().jobs()).hasSize(2);
        assertThat(plan.getValue().jobs().get(1).type()).isEqualTo(JobType.GENERATE);
        assertThat(plan.getValue().jobs().get(1).dependsOn()).containsExactly("job1");
        assertThat(plan.getValue().jobs().get(1).output()).isEqualTo("$job2");
        assertThat(options.getValue().providerApiKeys()).containsEntry("fal", "fal-key");
    }

    @Test
    void organizationDefaultsWhenTheHeaderIsMissing() throws Exception {
        Execution execution = new Execution();
        execution.setId(UUID.randomUUID());
        when(executionService.submit(eq("default"), any(), any())).thenReturn(execution);

        mockMvc.perform(post("/api/execute").contentType(MediaType.APPLICATION_JSON).content(PLAN))
                .andExpect(status().isAccepted());
    }

    @Test
    void missingPlanIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/execute").contentType(MediaType.APPLICATION_JSON).content("{\"options\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(status().reason("executionPlan is required"));

        verifyNoInteractions(executionService);
    }

    @Test
    void unknownJobTypeIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/execute").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"executionPlan\":{\"jobs\":[{\"id\":\"job1\",\"type\":\"teleport\"}]}}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(executionService);
    }

    @Test
    void invalidPlanIsABadRequestWithTheReason() throws Exception {
        when(executionService.submit(any(), any(), any())).thenThrow(new InvalidPlanException("Duplicate job id: job1"));

        mockMvc.perform(post("/api/execute").contentType(MediaType.APPLICATION_JSON).content(PLAN))
                .andExpect(status().isBadRequest())
                .andExpect(status().reason("Duplicate job id: job1"));
    }

    @Test
    void usageLimitIsTooManyRequests() throws Exception {
        when(executionService.submit(any(), any(), any())).thenThrow(new UsageLimitExceededException("acme", 5, 5));

        mockMvc.perform(post("/api/execute").contentType(MediaType.APPLICATION_JSON).content(PLAN))
                .andExpect(status().isTooManyRequests());
    }

    @Test
    void statusIsReturned() throws Exception {
        UUID id = UUID.randomUUID();
        when(executionService.getStatus(id)).thenReturn(Optional.of(new ExecutionStatusResponse(
                id.toString(), ExecutionStatus.COMPLETED, 100, 2, 2, null,
                Map.of("url", "https://cdn.example.com/final.mp4"), null, Instant.now(), Instant.now(), List.of())));

        mockMvc.perform(get("/api/execute/{id}/status", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.result.url").value("https://cdn.example.com/final.mp4"))
                .andExpect(jsonPath("$.completedJobs").value(2))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void unknownExecutionIsNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(executionService.getStatus(id)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/execute/{id}/status", id))
                .andExpect(status().isNotFound())
                .andExpect(status().reason("Execution not found: " + id));
    }
}
