package com.mediaflow.mediaflow_backend.controller;

import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;
import com.mediaflow.mediaflow_backend.model.domain.ProviderCredential;
import com.mediaflow.mediaflow_backend.repository.ProviderCredentialRepository;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.*;
import java.util.stream.Collectors;

/** Per-organization provider API keys used when a submission brings none of its own. */
@RestController
@RequestMapping("/api/provider-credentials")
public class ProviderCredentialController {

    private final ProviderCredentialRepository repo;

    public ProviderCredentialController(ProviderCredentialRepository repo) {
        this.repo = repo;
    }

    @GetMapping
    public List<Map<String, Object>> listCredentials(
            @RequestHeader(value = ExecutionController.ORGANIZATION_HEADER, defaultValue = "default") String organizationId) {
        Map<MediaProvider, ProviderCredential> saved = repo.findByOrganizationId(organizationId)
                .stream()
                .collect(Collectors.toMap(ProviderCredential::getProvider, c -> c));

        return Arrays.stream(MediaProvider.values())
                .map(p -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("provider", p.getId());
                    entry.put("displayName", p.getDisplayName());
                    ProviderCredential cred = saved.get(p);
                    entry.put("configured", cred != null);
                    entry.put("enabled", cred != null && cred.isEnabled());
                    entry.put("apiKeyMasked", cred != null ? maskKey(cred.getApiKey()) : null);
                    entry.put("updatedAt", cred != null ? cred.getUpdatedAt() : null);
                    return entry;
                })
                .collect(Collectors.toList());
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> saveCredential(
            @RequestHeader(value = ExecutionController.ORGANIZATION_HEADER, defaultValue = "default") String organizationId,
            @RequestBody Map<String, Object> body) {
        String providerStr = (String) body.get("provider");
        String apiKey = (String) body.get("apiKey");

        if (providerStr == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "provider is required");
        }
        MediaProvider provider = parseProvider(providerStr);
        if (apiKey == null || apiKey.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "apiKey is required");
        }

        ProviderCredential cred = repo.findByOrganizationIdAndProvider(organizationId, provider)
                .orElseGet(ProviderCredential::new);
        cred.setOrganizationId(organizationId);
        cred.setProvider(provider);
        cred.setApiKey(apiKey.trim());
        cred.setEnabled(true);
        ProviderCredential saved = repo.save(cred);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("provider", saved.getProvider().getId());
        response.put("configured", true);
        response.put("enabled", saved.isEnabled());
        response.put("apiKeyMasked", maskKey(saved.getApiKey()));
        return ResponseEntity.ok(response);
    }

    @PatchMapping("/{provider}/toggle")
    public ResponseEntity<Map<String, Object>> toggleCredential(
            @RequestHeader(value = ExecutionController.ORGANIZATION_HEADER, defaultValue = "default") String organizationId,
            @PathVariable String provider) {
        MediaProvider p = parseProvider(provider);
        ProviderCredential cred = repo.findByOrganizationIdAndProvider(organizationId, p)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Provider not configured: " + provider));
        cred.setEnabled(!cred.isEnabled());
        repo.save(cred);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("provider", p.getId());
        response.put("enabled", cred.isEnabled());
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{provider}")
    public ResponseEntity<Void> deleteCredential(
            @RequestHeader(value = ExecutionController.ORGANIZATION_HEADER, defaultValue = "default") String organizationId,
            @PathVariable String provider) {
        MediaProvider p = parseProvider(provider);
        repo.findByOrganizationIdAndProvider(organizationId, p).ifPresent(repo::delete);
        return ResponseEntity.noContent().build();
    }

    private MediaProvider parseProvider(String s) {
        try {
            return MediaProvider.fromId(s);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown provider: " + s);
        }
    }

    static String maskKey(String key) {
        if (key == null || key.length() < 10) return "****";
        return key.substring(0, 4) + "••••••••" + key.substring(key.length() - 4);
    }
}
