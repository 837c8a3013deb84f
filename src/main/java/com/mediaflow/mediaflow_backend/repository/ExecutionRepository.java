package com.mediaflow.mediaflow_backend.repository;

import com.mediaflow.mediaflow_backend.model.domain.Execution;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ExecutionRepository extends JpaRepository<Execution, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from Execution e where e.id = :id")
    Optional<Execution> findByIdForUpdate(@Param("id") UUID id);

    // Terminal executions whose completion webhook is still owed and not attempted recently
    @Query("""
            select e from Execution e
            where e.webhook is not null
              and e.completedAt is not null
              and e.webhookDeliveredAt is null
              and e.webhookAttempts < :maxAttempts
              and ((e.webhookLastAttemptAt is null and e.completedAt < :before)
                   or e.webhookLastAttemptAt < :before)
            order by e.completedAt
            """)
    List<Execution> findPendingWebhookDeliveries(@Param("maxAttempts") int maxAttempts, @Param("before") Instant before);

    List<Execution> findByOrganizationIdOrderByCreatedAtDesc(String organizationId);
}
