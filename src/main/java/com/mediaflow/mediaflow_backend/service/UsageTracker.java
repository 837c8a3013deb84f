package com.mediaflow.mediaflow_backend.service;

import com.mediaflow.mediaflow_backend.config.MediaflowProperties;
import com.mediaflow.mediaflow_backend.model.domain.UsageCounter;
import com.mediaflow.mediaflow_backend.repository.UsageCounterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneOffset;

/** Per-organization monthly count of completed jobs, with an optional submission limit. */
@Slf4j
@Service
@RequiredArgsConstructor
public class UsageTracker {

    private final UsageCounterRepository repository;
    private final MediaflowProperties properties;

    /**
     * @throws UsageLimitExceededException when a limit is configured and already reached this month
     */
    public void assertWithinLimit(String organizationId) {
        long limit = properties.getUsage().getMonthlyJobLimit();
        if (limit <= 0) return;
        long used = currentUsage(organizationId);
        if (used >= limit) {
            throw new UsageLimitExceededException(organizationId, used, limit);
        }
    }

    public long currentUsage(String organizationId) {
        return repository.findByOrganizationIdAndPeriodStart(organizationId, currentPeriod())
                .map(UsageCounter::getCompletedJobs)
                .orElse(0L);
    }

    public void recordCompletedJob(String organizationId) {
        LocalDate period = currentPeriod();
        if (repository.increment(organizationId, period) > 0) return;
        UsageCounter counter = new UsageCounter();
        counter.setOrganizationId(organizationId);
        counter.setPeriodStart(period);
        counter.setCompletedJobs(1);
        try {
            repository.saveAndFlush(counter);
        } catch (DataIntegrityViolationException e) {
            // another worker created this month's row first
            log.debug("[Usage] Counter for {} {} already exists, incrementing", organizationId, period);
            repository.increment(organizationId, period);
        }
    }

    static LocalDate currentPeriod() {
        return LocalDate.now(ZoneOffset.UTC).withDayOfMonth(1);
    }
}
