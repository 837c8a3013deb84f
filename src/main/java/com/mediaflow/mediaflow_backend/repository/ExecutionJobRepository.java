package com.mediaflow.mediaflow_backend.repository;

import com.mediaflow.mediaflow_backend.model.domain.ExecutionJob;
import com.mediaflow.mediaflow_backend.model.job.JobStatus;
import com.mediaflow.mediaflow_backend.model.job.WaitingStrategy;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ExecutionJobRepository extends JpaRepository<ExecutionJob, UUID> {

    List<ExecutionJob> findByExecutionIdOrderByPlanIndexAsc(UUID executionId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select j from ExecutionJob j where j.id = :id")
    Optional<ExecutionJob> findByIdForUpdate(@Param("id") UUID id);

    List<ExecutionJob> findByStatusAndWaitingStrategyAndStartedAtBefore(JobStatus status, WaitingStrategy strategy, Instant before);
}
