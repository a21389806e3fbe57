package com.jobgrid.internal;

import com.jobgrid.model.JobDefinition;
import com.jobgrid.model.JobResultStatus;
import com.jobgrid.repository.JobResultRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Job result gauges and the execution duration timer.
 */
public class JobGridMetrics {

    private static final Logger log = LoggerFactory.getLogger(JobGridMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    public static final String RESULT_COUNT = "jobgrid.job.results.count";
    public static final String RESULT_TOTAL = "jobgrid.job.results.total";
    public static final String EXECUTION_DURATION = "jobgrid.job.execution.duration";

    private final JobResultRepository jobResultRepository;
    private final MeterRegistry meterRegistry;
    private final Object snapshotMonitor = new Object();

    private volatile StatusSnapshot cachedSnapshot = StatusSnapshot.empty();
    private volatile long snapshotCapturedAtNanos = 0L;

    public JobGridMetrics(JobResultRepository jobResultRepository, MeterRegistry meterRegistry) {
        this.jobResultRepository = jobResultRepository;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerMetrics() {
        log.debug("Registering JobGrid gauges...");

        for (JobResultStatus status : JobResultStatus.values()) {
            Gauge.builder(RESULT_COUNT, this, metrics -> metrics.countFor(status))
                    .description("Number of job results")
                    .tag("status", status.name())
                    .register(meterRegistry);
        }

        Gauge.builder(RESULT_TOTAL, this, JobGridMetrics::totalCount)
                .description("Total number of job results in the database")
                .register(meterRegistry);
    }

    /**
     * Records how long a finished job took, tagged with its grouping, name and final status.
     */
    public void recordExecution(JobDefinition definition, JobResultStatus status, Duration duration) {
        if (duration == null || duration.isNegative()) {
            return;
        }
        Timer.builder(EXECUTION_DURATION)
                .description("Duration of job executions")
                .tag("grouping", definition.getGrouping() == null ? "" : definition.getGrouping())
                .tag("name", definition.getName() == null ? "" : definition.getName())
                .tag("status", status.name())
                .register(meterRegistry)
                .record(duration);
    }

    private double countFor(JobResultStatus status) {
        StatusSnapshot snapshot = getSnapshot();
        return switch (status) {
            case PENDING -> snapshot.pendingCount();
            case RUNNING -> snapshot.runningCount();
            case COMPLETED -> snapshot.completedCount();
            case ERRORED -> snapshot.erroredCount();
            case FAILED -> snapshot.failedCount();
        };
    }

    private double totalCount() {
        StatusSnapshot snapshot = getSnapshot();
        return snapshot.pendingCount() + snapshot.runningCount() + snapshot.completedCount()
                + snapshot.erroredCount() + snapshot.failedCount();
    }

    private StatusSnapshot getSnapshot() {
        long now = System.nanoTime();
        StatusSnapshot currentSnapshot = cachedSnapshot;
        if (snapshotCapturedAtNanos != 0L && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return currentSnapshot;
        }

        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (snapshotCapturedAtNanos != 0L && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedSnapshot;
            }
            cachedSnapshot = loadSnapshot();
            snapshotCapturedAtNanos = now;
            return cachedSnapshot;
        }
    }

    private StatusSnapshot loadSnapshot() {
        try {
            JobResultRepository.StatusCounts counts = jobResultRepository.countStatuses();
            if (counts == null) {
                return StatusSnapshot.empty();
            }
            return new StatusSnapshot(
                    countOrZero(counts.getPendingCount()),
                    countOrZero(counts.getRunningCount()),
                    countOrZero(counts.getCompletedCount()),
                    countOrZero(counts.getErroredCount()),
                    countOrZero(counts.getFailedCount()));
        } catch (Exception e) {
            log.trace("Failed to query job result counts for metrics: {}", e.getMessage());
            return StatusSnapshot.empty();
        }
    }

    private long countOrZero(Long value) {
        return value == null ? 0L : value;
    }

    private record StatusSnapshot(
            long pendingCount,
            long runningCount,
            long completedCount,
            long erroredCount,
            long failedCount) {
        private static StatusSnapshot empty() {
            return new StatusSnapshot(0, 0, 0, 0, 0);
        }
    }
}
