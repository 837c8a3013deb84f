package com.mediaflow.mediaflow_backend.controller;

import com.mediaflow.mediaflow_backend.service.ProviderWebhookService;
import com.mediaflow.mediaflow_backend.service.ProviderWebhookService.Disposition;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ProviderWebhookController.class)
class ProviderWebhookControllerTest {

    @Autowired private MockMvc mockMvc;
    @MockitoBean private ProviderWebhookService webhookService;

    @Test
    void callbackIsAcknowledgedWithItsDisposition() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(webhookService.handle(eq(jobId), any())).thenReturn(Disposition.COMPLETED);

        mockMvc.perform(post("/api/webhooks/job/{id}", jobId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"p1\",\"status\":\"succeeded\",\"output\":\"https://replicate.delivery/v.mp4\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true))
                .andExpect(jsonPath("$.disposition").value("completed"));
    }

    @Test
    void duplicateCallbackIsStillAcknowledged() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(webhookService.handle(eq(jobId), any())).thenReturn(Disposition.IGNORED);

        mockMvc.perform(post("/api/webhooks/job/{id}", jobId).contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.disposition").value("ignored"));
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(webhookService.handle(eq(jobId), any())).thenReturn(Disposition.UNKNOWN_JOB);

        mockMvc.perform(post("/api/webhooks/job/{id}", jobId).contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isNotFound());
    }
}
