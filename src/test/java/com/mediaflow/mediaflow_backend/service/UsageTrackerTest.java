package com.mediaflow.mediaflow_backend.service;

import com.mediaflow.mediaflow_backend.config.MediaflowProperties;
import com.mediaflow.mediaflow_backend.model.domain.UsageCounter;
import com.mediaflow.mediaflow_backend.repository.UsageCounterRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UsageTrackerTest {

    @Mock private UsageCounterRepository repository;

    private MediaflowProperties properties;
    private UsageTracker tracker;

    @BeforeEach
    void setUp() {
        properties = new MediaflowProperties();
        tracker = new UsageTracker(repository, properties);
    }

    private static UsageCounter counter(long completed) {
        UsageCounter counter = new UsageCounter();
        counter.setCompletedJobs(completed);
        return counter;
    }

    @Test
    void noLimitMeansNoLookup() {
        assertThatCode(() -> tracker.assertWithinLimit("acme")).doesNotThrowAnyException();
        verifyNoInteractions(repository);
    }

    @Test
    void limitReachedRejectsSubmission() {
        properties.getUsage().setMonthlyJobLimit(10);
        when(repository.findByOrganizationIdAndPeriodStart("acme", UsageTracker.currentPeriod()))
                .thenReturn(Optional.of(counter(10)));

        assertThatThrownBy(() -> tracker.assertWithinLimit("acme"))
                .isInstanceOf(UsageLimitExceededException.class)
                .hasMessage("Monthly job limit reached for organization acme (10/10)");
    }

    @Test
    void belowLimitPasses() {
        properties.getUsage().setMonthlyJobLimit(10);
        when(repository.findByOrganizationIdAndPeriodStart("acme", UsageTracker.currentPeriod()))
                .thenReturn(Optional.of(counter(9)));

        assertThatCode(() -> tracker.assertWithinLimit("acme")).doesNotThrowAnyException();
    }

    @Test
    void existingCounterIsIncremented() {
        when(repository.increment("acme", UsageTracker.currentPeriod())).thenReturn(1);

        tracker.recordCompletedJob("acme");

        verify(repository, never()).saveAndFlush(any());
    }

    @Test
    void firstJobOfTheMonthCreatesTheCounter() {
        when(repository.increment("acme", UsageTracker.currentPeriod())).thenReturn(0);

        tracker.recordCompletedJob("acme");

        ArgumentCaptor<UsageCounter> saved = ArgumentCaptor.forClass(UsageCounter.class);
        verify(repository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getOrganizationId()).isEqualTo("acme");
        assertThat(saved.getValue().getCompletedJobs()).isEqualTo(1);
        assertThat(saved.getValue().getPeriodStart().getDayOfMonth()).isEqualTo(1);
    }

    @Test
    void concurrentCreationFallsBackToIncrement() {
        when(repository.increment("acme", UsageTracker.currentPeriod())).thenReturn(0, 1);
        when(repository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("duplicate key"));

        tracker.recordCompletedJob("acme");

        verify(repository, times(2)).increment("acme", UsageTracker.currentPeriod());
    }
}
