package com.jobgrid.internal;

import com.jobgrid.config.JobGridProperties;
import com.jobgrid.model.JobResultStatus;
import com.jobgrid.repository.JobResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Locale;

/**
 * Deletes finished job results, and with them their log entries, once they pass the configured age.
 */
@Component
@ConditionalOnProperty(prefix = "jobgrid.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobResultCleaner {

    private static final Logger log = LoggerFactory.getLogger(JobResultCleaner.class);
    private final JobResultRepository jobResultRepository;
    private final JobGridProperties properties;

    public JobResultCleaner(JobResultRepository jobResultRepository, JobGridProperties properties) {
        this.jobResultRepository = jobResultRepository;
        this.properties = properties;
    }

    // Run cleaner every hour
    @Scheduled(fixedDelay = 3600000)
    public void cleanup() {
        String retentionStr = properties.getResults().getDeleteCompletedAfter();
        if (retentionStr == null || retentionStr.isBlank()) {
            return;
        }
        log.info("Running job result cleanup task...");

        try {
            Duration retention = parseDuration(retentionStr);
            OffsetDateTime threshold = OffsetDateTime.now().minus(retention);
            int deleted = jobResultRepository.deleteByStatusInAndDateDoneBefore(
                    JobResultStatus.terminalStatuses(), threshold);
            if (deleted > 0) {
                log.info("Cleaned up {} finished job results older than {}", deleted, retention);
            }
        } catch (Exception e) {
            log.error("Failed to clean up finished job results: {}", e.getMessage());
        }
    }

    static Duration parseDuration(String durationStr) {
        String trimmed = durationStr.trim();
        try {
            return Duration.parse(trimmed);
        } catch (RuntimeException ignored) {
            // Continue with shorthand parsing below.
        }

        // Supports shorthand inputs like "36h" or "30d".
        String shorthand = trimmed.toLowerCase(Locale.ROOT);
        if (shorthand.endsWith("h")) {
            long hours = Long.parseLong(shorthand.substring(0, shorthand.length() - 1));
            return Duration.ofHours(hours);
        } else if (shorthand.endsWith("d")) {
            long days = Long.parseLong(shorthand.substring(0, shorthand.length() - 1));
            return Duration.ofDays(days);
        }
        throw new IllegalArgumentException("Unsupported duration value: " + durationStr);
    }
}
