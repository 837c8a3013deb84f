package com.mediaflow.mediaflow_backend.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.mediaflow.mediaflow_backend.service.ProviderWebhookService;
import com.mediaflow.mediaflow_backend.service.ProviderWebhookService.Disposition;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.UUID;

/** Completion callbacks from Replicate and fal for jobs started with a webhook URL. */
@RestController
@RequestMapping("/api/webhooks/job")
@RequiredArgsConstructor
public class ProviderWebhookController {

    private final ProviderWebhookService webhookService;

    @PostMapping("/{jobRecordId}")
    public ResponseEntity<Map<String, Object>> receive(@PathVariable UUID jobRecordId, @RequestBody JsonNode payload) {
        Disposition disposition = webhookService.handle(jobRecordId, payload);
        if (disposition == Disposition.UNKNOWN_JOB) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + jobRecordId);
        }
        return ResponseEntity.ok(Map.of("received", true, "disposition", disposition.name().toLowerCase()));
    }
}
