package com.mediaflow.mediaflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDate;
import java.util.UUID;

/** Completed-job count for one organization in one calendar month. */
@Entity
@Table(name = "usage_counters",
        uniqueConstraints = @UniqueConstraint(name = "uk_usage_counters_period", columnNames = {"organization_id", "period_start"}))
@Data
public class UsageCounter {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "organization_id", nullable = false)
    private String organizationId;

    @Column(name = "period_start", nullable = false)
    private LocalDate periodStart;

    @Column(name = "completed_jobs", nullable = false)
    private long completedJobs;
}
