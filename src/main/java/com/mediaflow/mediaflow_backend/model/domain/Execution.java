package com.mediaflow.mediaflow_backend.model.domain;

import com.mediaflow.mediaflow_backend.model.job.ExecutionStatus;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "executions")
@Data
public class Execution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "organization_id", nullable = false)
    private String organizationId = "default";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ExecutionStatus status = ExecutionStatus.PENDING;

    @Column(name = "base_execution_id")
    private UUID baseExecutionId;

    // provider id -> API key, supplied per request
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "provider_api_keys")
    private Map<String, String> providerApiKeys = new HashMap<>();

    @Column(name = "webhook_url", length = 2048)
    private String webhook;

    @Column(name = "webhook_secret")
    private String webhookSecret;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "execution_result")
    private Map<String, Object> result;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String error;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "webhook_attempts", nullable = false)
    private int webhookAttempts;

    @Column(name = "webhook_last_attempt_at")
    private Instant webhookLastAttemptAt;

    @Column(name = "webhook_delivered_at")
    private Instant webhookDeliveredAt;

    @Column(name = "webhook_last_error", columnDefinition = "TEXT")
    private String webhookLastError;
}
