package com.mediaflow.mediaflow_backend.repository;

import com.mediaflow.mediaflow_backend.model.domain.MediaProvider;
import com.mediaflow.mediaflow_backend.model.domain.ProviderCredential;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ProviderCredentialRepository extends JpaRepository<ProviderCredential, UUID> {
    Optional<ProviderCredential> findByOrganizationIdAndProvider(String organizationId, MediaProvider provider);
    List<ProviderCredential> findByOrganizationId(String organizationId);
}
