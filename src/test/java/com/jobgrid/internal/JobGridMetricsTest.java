package com.jobgrid.internal;

import com.jobgrid.model.JobDefinition;
import com.jobgrid.model.JobResultStatus;
import com.jobgrid.repository.JobResultRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobGridMetricsTest {

    private JobResultRepository jobResultRepository;
    private MeterRegistry meterRegistry;
    private JobGridMetrics metrics;

    @BeforeEach
    void setUp() {
        jobResultRepository = mock(JobResultRepository.class);
        meterRegistry = new SimpleMeterRegistry();
        metrics = new JobGridMetrics(jobResultRepository, meterRegistry);
    }

    @Test
    void shouldRegisterGaugesForResultStatuses() {
        JobResultRepository.StatusCounts counts = mock(JobResultRepository.StatusCounts.class);
        when(counts.getPendingCount()).thenReturn(4L);
        when(counts.getRunningCount()).thenReturn(2L);
        when(counts.getCompletedCount()).thenReturn(50L);
        when(counts.getErroredCount()).thenReturn(3L);
        when(counts.getFailedCount()).thenReturn(null);
        when(jobResultRepository.countStatuses()).thenReturn(counts);

        metrics.registerMetrics();

        Gauge pending = meterRegistry.find(JobGridMetrics.RESULT_COUNT).tag("status", "PENDING").gauge();
        assertThat(pending).isNotNull();
        assertThat(pending.value()).isEqualTo(4.0);

        Gauge failed = meterRegistry.find(JobGridMetrics.RESULT_COUNT).tag("status", "FAILED").gauge();
        assertThat(failed).isNotNull();
        assertThat(failed.value()).isEqualTo(0.0);

        Gauge total = meterRegistry.find(JobGridMetrics.RESULT_TOTAL).gauge();
        assertThat(total).isNotNull();
        assertThat(total.value()).isEqualTo(59.0);

        verify(jobResultRepository, times(1)).countStatuses();
    }

    @Test
    void shouldReportZeroWhenCountsCannotBeLoaded() {
        when(jobResultRepository.countStatuses()).thenThrow(new IllegalStateException("no database"));

        metrics.registerMetrics();

        assertThat(meterRegistry.find(JobGridMetrics.RESULT_TOTAL).gauge().value()).isEqualTo(0.0);
    }

    @Test
    void shouldRecordExecutionDurationWithJobTags() {
        JobDefinition definition = new JobDefinition("com.example.jobs", "BackupConfigs");
        definition.setGrouping("Backups");

        metrics.recordExecution(definition, JobResultStatus.COMPLETED, Duration.ofMillis(1500));

        Timer timer = meterRegistry.find(JobGridMetrics.EXECUTION_DURATION)
                .tag("grouping", "Backups")
                .tag("name", "BackupConfigs")
                .tag("status", "COMPLETED")
                .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(1500.0);
    }

    @Test
    void shouldIgnoreMissingDuration() {
        metrics.recordExecution(new JobDefinition("com.example.jobs", "BackupConfigs"), JobResultStatus.FAILED, null);

        assertThat(meterRegistry.find(JobGridMetrics.EXECUTION_DURATION).timer()).isNull();
    }
}
