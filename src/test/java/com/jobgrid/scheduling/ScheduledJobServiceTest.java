package com.jobgrid.scheduling;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobgrid.JobValidationException;
import com.jobgrid.config.JobGridProperties;
import com.jobgrid.model.JobDefinition;
import com.jobgrid.model.ScheduleChangeMarker;
import com.jobgrid.model.ScheduleInterval;
import com.jobgrid.model.ScheduledJob;
import com.jobgrid.repository.ScheduleChangeMarkerRepository;
import com.jobgrid.repository.ScheduledJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.OffsetDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScheduledJobServiceTest {

    private static final OffsetDateTime START = OffsetDateTime.parse("2024-01-08T10:00:00Z");

    private ScheduledJobRepository scheduledJobRepository;
    private ScheduleChangeMarkerRepository changeMarkerRepository;
    private JobGridProperties properties;
    private ScheduledJobService service;
    private JobDefinition definition;

    @BeforeEach
    void setUp() {
        scheduledJobRepository = mock(ScheduledJobRepository.class);
        changeMarkerRepository = mock(ScheduleChangeMarkerRepository.class);
        properties = new JobGridProperties();
        service = new ScheduledJobService(scheduledJobRepository, changeMarkerRepository, new ObjectMapper(),
                properties);
        when(scheduledJobRepository.save(any(ScheduledJob.class))).thenAnswer(invocation -> invocation.getArgument(0));

        definition = new JobDefinition("com.example.jobs", "BackupConfigs");
        definition.setHasSensitiveVariables(false);
    }

    @Test
    void shouldBackdateFirstRunOfWeeklySchedule() {
        ScheduledJob job = new ScheduledJob("weekly backup", definition, ScheduleInterval.WEEKLY, START);

        ScheduledJob saved = service.save(job);

        assertEquals(OffsetDateTime.parse("2024-01-01T10:00:00Z"), saved.getLastRunAt());
        assertEquals("com.example.jobs.BackupConfigs", saved.getTask());
    }

    @Test
    void shouldTouchChangeMarkerOnSave() {
        service.save(new ScheduledJob("daily backup", definition, ScheduleInterval.DAILY, START));

        ArgumentCaptor<ScheduleChangeMarker> captor = ArgumentCaptor.forClass(ScheduleChangeMarker.class);
        verify(changeMarkerRepository).save(captor.capture());
        assertEquals(ScheduleChangeMarker.IDENT, captor.getValue().getIdent());
        assertNotNull(captor.getValue().getLastUpdate());
    }

    @Test
    void shouldLeaveOneOffScheduleWithoutLastRun() {
        ScheduledJob saved = service.save(new ScheduledJob("once", definition, ScheduleInterval.FUTURE, START));

        assertNull(saved.getLastRunAt());
    }

    @Test
    void shouldClearLastRunWhenDisabled() {
        ScheduledJob job = new ScheduledJob("daily backup", definition, ScheduleInterval.DAILY, START);
        job.setLastRunAt(START.plusDays(3));
        job.setEnabled(false);

        assertNull(service.save(job).getLastRunAt());
    }

    @Test
    void shouldStoreBlankQueueAsNull() {
        ScheduledJob job = new ScheduledJob("daily backup", definition, ScheduleInterval.DAILY, START);
        job.setQueue("   ");

        assertNull(service.save(job).getQueue());
    }

    @Test
    void shouldApplyConfiguredTimeZoneToNewSchedule() {
        properties.getScheduler().setTimeZone("Europe/Amsterdam");
        ScheduledJob job = new ScheduledJob("daily backup", definition, ScheduleInterval.DAILY, START);

        ScheduledJob saved = service.save(job);

        assertEquals("Europe/Amsterdam", saved.getTimeZone());
        // 10:00Z is 11:00 in Amsterdam in winter
        assertEquals("0 11 * * *", ((CrontabSchedule) JobSchedules.compute(saved)).expression());
    }

    @Test
    void shouldKeepExplicitTimeZone() {
        properties.getScheduler().setTimeZone("Europe/Amsterdam");
        ScheduledJob job = new ScheduledJob("daily backup", definition, ScheduleInterval.DAILY, START);
        job.setTimeZone("UTC");

        assertEquals("UTC", service.save(job).getTimeZone());
    }

    @Test
    void shouldRejectRequesterApprovingOwnSchedule() {
        ScheduledJob job = new ScheduledJob("daily backup", definition, ScheduleInterval.DAILY, START);
        job.setUser("alice");
        job.setApprovedByUser("alice");
        job.setApprovedAt(START);

        JobValidationException exception = assertThrows(JobValidationException.class, () -> service.save(job));

        assertEquals("approved_by_user", exception.getField());
        verify(scheduledJobRepository, never()).save(any(ScheduledJob.class));
    }

    @Test
    void shouldRequireApproverAndApprovalTimeTogether() {
        ScheduledJob job = new ScheduledJob("daily backup", definition, ScheduleInterval.DAILY, START);
        job.setUser("alice");
        job.setApprovedByUser("bob");

        JobValidationException exception = assertThrows(JobValidationException.class, () -> service.clean(job));

        assertEquals("approved_at", exception.getField());
    }

    @Test
    void shouldRejectJobsWithSensitiveVariables() {
        definition.setHasSensitiveVariables(true);
        ScheduledJob job = new ScheduledJob("daily backup", definition, ScheduleInterval.DAILY, START);

        JobValidationException exception = assertThrows(JobValidationException.class, () -> service.clean(job));

        assertEquals("job_definition", exception.getField());
    }

    @Test
    void shouldRejectArgumentsOfWrongShape() {
        ScheduledJob job = new ScheduledJob("daily backup", definition, ScheduleInterval.DAILY, START);
        job.setArgs("{}");
        assertEquals("args", assertThrows(JobValidationException.class, () -> service.clean(job)).getField());

        job.setArgs("[]");
        job.setKwargs("[1, 2]");
        assertEquals("kwargs", assertThrows(JobValidationException.class, () -> service.clean(job)).getField());

        job.setKwargs("{\"site\":");
        assertEquals("kwargs", assertThrows(JobValidationException.class, () -> service.clean(job)).getField());
    }

    @Test
    void shouldRejectInvalidCustomCrontab() {
        ScheduledJob job = new ScheduledJob("custom", definition, ScheduleInterval.CUSTOM, START);
        job.setCrontab("61 * * * *");

        assertThrows(JobValidationException.class, () -> service.save(job));
        verify(scheduledJobRepository, never()).save(any(ScheduledJob.class));
        verify(changeMarkerRepository, never()).save(any(ScheduleChangeMarker.class));
    }

    @Test
    void shouldApproveScheduleBySecondUser() {
        ScheduledJob job = new ScheduledJob("approval", definition, ScheduleInterval.DAILY, START);
        job.setUser("alice");
        job.setApprovalRequired(true);
        when(scheduledJobRepository.findById(job.getId())).thenReturn(Optional.of(job));

        ScheduledJob approved = service.approve(job.getId(), "bob");

        assertEquals("bob", approved.getApprovedByUser());
        assertNotNull(approved.getApprovedAt());
        verify(scheduledJobRepository).save(job);
    }

    @Test
    void shouldNotLetRequesterApproveOwnSchedule() {
        ScheduledJob job = new ScheduledJob("approval", definition, ScheduleInterval.DAILY, START);
        job.setUser("alice");
        job.setApprovalRequired(true);
        when(scheduledJobRepository.findById(job.getId())).thenReturn(Optional.of(job));

        assertThrows(JobValidationException.class, () -> service.approve(job.getId(), "alice"));
    }

    @Test
    void shouldDeleteDeniedSchedule() {
        ScheduledJob job = new ScheduledJob("approval", definition, ScheduleInterval.DAILY, START);
        when(scheduledJobRepository.findById(job.getId())).thenReturn(Optional.of(job));

        service.deny(job.getId());

        verify(scheduledJobRepository).delete(job);
        verify(changeMarkerRepository).save(any(ScheduleChangeMarker.class));
    }

    @Test
    void shouldRequireOneOffStartInTheFuture() {
        ScheduledJob now = new ScheduledJob("once", definition, ScheduleInterval.FUTURE, OffsetDateTime.now());
        ScheduledJob later = new ScheduledJob("later", definition, ScheduleInterval.FUTURE,
                OffsetDateTime.now().plusHours(1));

        assertThrows(JobValidationException.class, () -> service.requireFutureStart(now));
        assertDoesNotThrow(() -> service.requireFutureStart(later));
    }

    @Test
    void shouldOfferEarliestStartAfterMinimumLeadTime() {
        OffsetDateTime before = OffsetDateTime.now();

        OffsetDateTime earliest = service.earliestPossibleTime();

        assertTrue(!earliest.isBefore(before.plusSeconds(15)));
        assertTrue(earliest.isBefore(OffsetDateTime.now().plusSeconds(16)));
    }

    @Test
    void shouldReportLastChange() {
        OffsetDateTime changedAt = OffsetDateTime.parse("2024-02-01T08:00:00Z");
        when(changeMarkerRepository.findById(ScheduleChangeMarker.IDENT))
                .thenReturn(Optional.of(new ScheduleChangeMarker(changedAt)));

        assertEquals(Optional.of(changedAt), service.lastChange());
    }
}
