package com.mediaflow.mediaflow_backend.config;

import com.mediaflow.mediaflow_backend.model.domain.JobType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Keeps the execution_jobs job_type check constraint in step with {@link JobType} and adds the
 * indexes the scheduler and reaper query by. Hibernate's ddl-auto does neither.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "mediaflow.migrations.enabled", havingValue = "true", matchIfMissing = true)
public class ExecutionJobIndexMigration {

    private final JdbcTemplate jdbcTemplate;

    @PostConstruct
    public void apply() {
        try {
            String allowed = String.join("', '", Arrays.stream(JobType.values()).map(Enum::name).toList());
            jdbcTemplate.execute("ALTER TABLE execution_jobs DROP CONSTRAINT IF EXISTS execution_jobs_job_type_check");
            jdbcTemplate.execute("ALTER TABLE execution_jobs ADD CONSTRAINT execution_jobs_job_type_check CHECK (job_type IN ('" + allowed + "'))");
            log.debug("Updated execution_jobs_job_type_check to allow all JobType values");
        } catch (Exception e) {
            log.warn("Could not update execution_jobs_job_type_check (constraint may already be correct): {}", e.getMessage());
        }
        try {
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_execution_jobs_execution ON execution_jobs (execution_id, plan_index)");
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_execution_jobs_waiting ON execution_jobs (status, waiting_strategy, started_at)");
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_executions_webhook_pending ON executions (webhook_delivered_at, completed_at)");
        } catch (Exception e) {
            log.warn("Could not create execution indexes: {}", e.getMessage());
        }
    }
}
