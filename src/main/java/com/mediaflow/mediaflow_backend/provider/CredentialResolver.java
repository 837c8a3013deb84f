package com.mediaflow.mediaflow_backend.provider;

import com.mediaflow.mediaflow_backend.model.domain.Execution;
import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;
import com.mediaflow.mediaflow_backend.model.domain.ProviderCredential;
import com.mediaflow.mediaflow_backend.repository.ProviderCredentialRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Picks the explicit credential for a job: the job's own {@code apiKey} param, then the keys sent
 * with the execution, then the organization's saved credential. Returns null when none applies so
 * that {@link ProviderClientFactory} can fall back to the server-wide key.
 */
@Component
@RequiredArgsConstructor
public class CredentialResolver {

    private final ProviderCredentialRepository credentialRepository;

    public String resolve(Execution execution, MediaProvider provider, String jobApiKey) {
        if (jobApiKey != null && !jobApiKey.isBlank()) {
            return jobApiKey;
        }
        if (execution.getProviderApiKeys() != null) {
            String key = execution.getProviderApiKeys().get(provider.getId());
            if (key != null && !key.isBlank()) {
                return key;
            }
        }
        return credentialRepository.findByOrganizationIdAndProvider(execution.getOrganizationId(), provider)
                .filter(ProviderCredential::isEnabled)
                .map(ProviderCredential::getApiKey)
                .orElse(null);
    }
}
