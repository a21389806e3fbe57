package com.jobgrid.scheduling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobgrid.JobClient;
import com.jobgrid.JobValidationException;
import com.jobgrid.catalog.JobCatalog;
import com.jobgrid.config.JobGridProperties;
import com.jobgrid.model.ScheduleChangeMarker;
import com.jobgrid.model.ScheduledJob;
import com.jobgrid.repository.ScheduleChangeMarkerRepository;
import com.jobgrid.repository.ScheduledJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Fires due scheduled jobs.
 * <p>
 * The entry table is rebuilt from storage whenever the schedule change marker moves. Each due
 * entry is sent through {@link JobClient} and its run is recorded with an atomic increment.
 */
@Component
@ConditionalOnProperty(prefix = "jobgrid.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final ScheduledJobRepository scheduledJobRepository;
    private final ScheduleChangeMarkerRepository changeMarkerRepository;
    private final JobClient jobClient;
    private final JobCatalog catalog;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final JobGridProperties properties;

    private volatile Map<UUID, ScheduleEntry> entries = Map.of();
    private volatile boolean loaded = false;
    private OffsetDateTime lastSeenChange;

    public JobScheduler(
            ScheduledJobRepository scheduledJobRepository,
            ScheduleChangeMarkerRepository changeMarkerRepository,
            JobClient jobClient,
            JobCatalog catalog,
            ObjectMapper objectMapper,
            TransactionTemplate transactionTemplate,
            JobGridProperties properties) {
        this.scheduledJobRepository = scheduledJobRepository;
        this.changeMarkerRepository = changeMarkerRepository;
        this.jobClient = jobClient;
        this.catalog = catalog;
        this.objectMapper = objectMapper;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${jobgrid.scheduler.tick-interval-in-seconds:5}000")
    public void tick() {
        tick(OffsetDateTime.now());
    }

    /**
     * Sends every entry that is due at {@code now}. A failing entry is logged and does not stop the others.
     */
    public void tick(OffsetDateTime now) {
        try {
            OffsetDateTime lastUpdate = currentChange();
            if (schedulesChanged(lastUpdate)) {
                reloadEntries();
                lastSeenChange = lastUpdate;
            }
        } catch (Exception e) {
            log.error("Failed to load scheduled jobs, keeping {} previously loaded entries", entries.size(), e);
        }

        for (ScheduleEntry entry : new ArrayList<>(entries.values())) {
            if (!entry.isDue(now)) {
                continue;
            }
            try {
                applyDispatch(entry, now);
            } catch (SchedulingException e) {
                log.error("{}", e.getMessage(), e.getCause());
            }
        }
        touchHeartbeat();
    }

    /**
     * Enqueues the job of a due entry and records the run.
     * <p>
     * The entry is reserved for {@code now} before anything is sent, so a failed send waits for the
     * next fire time instead of being repeated on every tick. A one-off entry is retired either way.
     *
     * @throws SchedulingException if the job could not be enqueued
     */
    public void applyDispatch(ScheduleEntry entry, OffsetDateTime now) {
        ScheduledJob scheduledJob = entry.getScheduledJob();
        UUID id = scheduledJob.getId();
        log.info("Scheduler: Sending due task {} ({})", entry.getName(), scheduledJob.getTask());

        if (!scheduledJobRepository.existsById(id)) {
            log.error("Schedule {} was removed from the database, dropping it", entry.getName());
            dropEntry(id);
            return;
        }

        entry.recordRun(now);
        try {
            transactionTemplate.executeWithoutResult(status -> {
                jobClient.enqueue(
                        scheduledJob.getJobDefinition(),
                        scheduledJob.getUser(),
                        entry.getArgs(),
                        entry.getKwargs(),
                        scheduledJob,
                        scheduledJob.getQueue(),
                        false);
                scheduledJobRepository.recordRun(id, now);
            });
        } catch (RuntimeException e) {
            throw new SchedulingException(
                    "Couldn't apply scheduled task " + entry.getName() + ": " + e.getMessage(), e);
        } finally {
            if (scheduledJob.getInterval().isOneOff()) {
                scheduledJobRepository.disable(id);
                dropEntry(id);
                log.debug("One-off schedule {} was sent and disabled", entry.getName());
            }
        }

        scheduledJobRepository.findTotalRunCount(id).ifPresent(stored -> {
            if (stored != entry.getTotalRunCount()) {
                log.debug("Run counter of {} advanced elsewhere ({} -> {})", entry.getName(),
                        entry.getTotalRunCount(), stored);
                entry.syncTotalRunCount(stored);
            }
        });
    }

    public Collection<ScheduleEntry> getEntries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    private OffsetDateTime currentChange() {
        return changeMarkerRepository.findById(ScheduleChangeMarker.IDENT)
                .map(ScheduleChangeMarker::getLastUpdate)
                .orElse(null);
    }

    private boolean schedulesChanged(OffsetDateTime lastUpdate) {
        return !loaded || (lastUpdate != null && (lastSeenChange == null || lastUpdate.isAfter(lastSeenChange)));
    }

    private void reloadEntries() {
        Map<UUID, ScheduleEntry> reloaded = new LinkedHashMap<>();
        for (ScheduledJob scheduledJob : scheduledJobRepository.findSchedulable()) {
            if (scheduledJob.getJobDefinition() == null) {
                log.error("Disabling schedule {}: its job no longer exists", scheduledJob.getName());
                scheduledJobRepository.disable(scheduledJob.getId());
                continue;
            }
            try {
                reloaded.put(scheduledJob.getId(), ScheduleEntry.from(scheduledJob, objectMapper));
            } catch (JsonProcessingException e) {
                log.error("Disabling schedule {} that failed to load: {}", scheduledJob.getName(),
                        e.getOriginalMessage());
                scheduledJobRepository.disable(scheduledJob.getId());
                continue;
            } catch (JobValidationException e) {
                log.error("Disabling schedule {} that failed to load: {}", scheduledJob.getName(), e.getMessage());
                scheduledJobRepository.disable(scheduledJob.getId());
                continue;
            }
            if (catalog.lookup(scheduledJob.getTask()).isEmpty()) {
                log.warn("Job {} of schedule {} is not installed in this process", scheduledJob.getTask(),
                        scheduledJob.getName());
            }
        }
        this.entries = reloaded;
        this.loaded = true;
        log.info("Scheduler: loaded {} schedule entries", reloaded.size());
    }

    private void dropEntry(UUID id) {
        Map<UUID, ScheduleEntry> remaining = new LinkedHashMap<>(entries);
        remaining.remove(id);
        this.entries = remaining;
    }

    private void touchHeartbeat() {
        String heartbeatFile = properties.getScheduler().getHeartbeatFile();
        if (heartbeatFile == null || heartbeatFile.isBlank()) {
            return;
        }
        Path path = Path.of(heartbeatFile);
        try {
            if (Files.exists(path)) {
                Files.setLastModifiedTime(path, FileTime.fromMillis(System.currentTimeMillis()));
            } else {
                Files.createFile(path);
            }
        } catch (IOException e) {
            log.warn("Failed to touch scheduler heartbeat file {}: {}", path, e.getMessage());
        }
    }
}
