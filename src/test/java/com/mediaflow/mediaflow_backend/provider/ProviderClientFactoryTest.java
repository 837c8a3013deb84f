package com.mediaflow.mediaflow_backend.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediaflow.mediaflow_backend.config.MediaflowProperties;
import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderClientFactoryTest {

    private MediaflowProperties properties;
    private ProviderClientFactory factory;

    @BeforeEach
    void setUp() {
        properties = new MediaflowProperties();
        factory = new ProviderClientFactory(properties, new ObjectMapper());
    }

    @Test
    void sameCredentialSharesOneClient() {
        MediaProviderClient first = factory.getClient(MediaProvider.REPLICATE, "r8_org_a");
        MediaProviderClient second = factory.getClient(MediaProvider.REPLICATE, "r8_org_a");

        assertThat(first).isSameAs(second).isInstanceOf(ReplicateClient.class);
    }

    @Test
    void differentCredentialsNeverShareAClient() {
        MediaProviderClient orgA = factory.getClient(MediaProvider.FAL, "fal-key-a");
        MediaProviderClient orgB = factory.getClient(MediaProvider.FAL, "fal-key-b");

        assertThat(orgA).isNotSameAs(orgB);
    }

    @Test
    void configuredKeyIsTheFallback() {
        MediaflowProperties.Provider elevenLabs = new MediaflowProperties.Provider();
        elevenLabs.setApiKey("xi-server-key");
        properties.getProviders().put("elevenlabs", elevenLabs);

        assertThat(factory.resolveApiKey(MediaProvider.ELEVENLABS, null)).isEqualTo("xi-server-key");
        assertThat(factory.resolveApiKey(MediaProvider.ELEVENLABS, "xi-org-key")).isEqualTo("xi-org-key");
        assertThat(factory.getClient(MediaProvider.ELEVENLABS, " ")).isInstanceOf(ElevenLabsClient.class);
    }

    @Test
    void missingKeyExplainsEveryWayToProvideOne() {
        assertThatThrownBy(() -> factory.getClient(MediaProvider.FAL, null))
                .isInstanceOf(ProviderConfigurationException.class)
                .hasMessageContaining("No API key configured for fal.ai")
                .hasMessageContaining("providerApiKeys.fal")
                .hasMessageContaining("FAL_KEY");
    }
}
