package com.mediaflow.mediaflow_backend.model.domain;

import com.mediaflow.mediaflow_backend.model.job.JobErrorKind;
import com.mediaflow.mediaflow_backend.model.job.JobStatus;
import com.mediaflow.mediaflow_backend.model.job.WaitingStrategy;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One job of an execution plan. {@code jobId} is the plan-local id ("job3"); {@code id} is the
 * record id handed to providers in webhook URLs.
 */
@Entity
@Table(name = "execution_jobs",
        uniqueConstraints = @UniqueConstraint(name = "uk_execution_jobs_plan_id", columnNames = {"execution_id", "job_id"}))
@Data
public class ExecutionJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "execution_id", nullable = false)
    private UUID executionId;

    @Column(name = "job_id", nullable = false, length = 64)
    private String jobId;

    @Column(name = "plan_index", nullable = false)
    private int planIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, length = 32)
    private JobType jobType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "params")
    private Map<String, Object> params = new HashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "depends_on")
    private List<String> dependsOn = new ArrayList<>();

    @Column(name = "output_ref", length = 64)
    private String output;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status = JobStatus.QUEUED;

    @Column(nullable = false)
    private int progress;

    @Column(length = 64)
    private String stage;

    @Column(name = "model_id")
    private String modelId;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private MediaProvider provider;

    @Column(name = "provider_job_id")
    private String providerJobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "waiting_strategy", length = 20)
    private WaitingStrategy waitingStrategy;

    // {url, outputs, completedAt}
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "job_result")
    private Map<String, Object> result;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind", length = 20)
    private JobErrorKind errorKind;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String error;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "job_metadata")
    private Map<String, Object> metadata = new HashMap<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
