package com.mediaflow.mediaflow_backend.provider;

import com.mediaflow.mediaflow_backend.model.domain.Execution;
import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;
import com.mediaflow.mediaflow_backend.model.domain.ProviderCredential;
import com.mediaflow.mediaflow_backend.repository.ProviderCredentialRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CredentialResolverTest {

    @Mock
    private ProviderCredentialRepository credentialRepository;

    @InjectMocks
    private CredentialResolver resolver;

    private Execution execution;

    @BeforeEach
    void setUp() {
        execution = new Execution();
        execution.setOrganizationId("acme");
    }

    @Test
    void jobKeyWins() {
        execution.setProviderApiKeys(Map.of("fal", "from-execution"));

        assertThat(resolver.resolve(execution, MediaProvider.FAL, "from-job")).isEqualTo("from-job");
        verifyNoInteractions(credentialRepository);
    }

    @Test
    void executionKeyIsUsedForItsProviderOnly() {
        execution.setProviderApiKeys(Map.of("fal", "from-execution"));
        when(credentialRepository.findByOrganizationIdAndProvider("acme", MediaProvider.REPLICATE))
                .thenReturn(Optional.empty());

        assertThat(resolver.resolve(execution, MediaProvider.FAL, " ")).isEqualTo("from-execution");
        assertThat(resolver.resolve(execution, MediaProvider.REPLICATE, null)).isNull();
    }

    @Test
    void savedCredentialIsUsedWhenEnabled() {
        ProviderCredential saved = new ProviderCredential();
        saved.setApiKey("saved-key");
        when(credentialRepository.findByOrganizationIdAndProvider("acme", MediaProvider.ELEVENLABS))
                .thenReturn(Optional.of(saved));

        assertThat(resolver.resolve(execution, MediaProvider.ELEVENLABS, null)).isEqualTo("saved-key");

        saved.setEnabled(false);
        assertThat(resolver.resolve(execution, MediaProvider.ELEVENLABS, null)).isNull();
    }

    @Test
    void missingKeyMapIsTolerated() {
        execution.setProviderApiKeys(null);
        when(credentialRepository.findByOrganizationIdAndProvider(any(), any())).thenReturn(Optional.empty());

        assertThat(resolver.resolve(execution, MediaProvider.FAL, null)).isNull();
    }
}
