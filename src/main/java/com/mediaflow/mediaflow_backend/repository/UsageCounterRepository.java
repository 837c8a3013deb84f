package com.mediaflow.mediaflow_backend.repository;

import com.mediaflow.mediaflow_backend.model.domain.UsageCounter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

public interface UsageCounterRepository extends JpaRepository<UsageCounter, UUID> {

    Optional<UsageCounter> findByOrganizationIdAndPeriodStart(String organizationId, LocalDate periodStart);

    @Modifying
    @Transactional
    @Query("update UsageCounter c set c.completedJobs = c.completedJobs + 1 "
            + "where c.organizationId = :organizationId and c.periodStart = :periodStart")
    int increment(@Param("organizationId") String organizationId, @Param("periodStart") LocalDate periodStart);
}
