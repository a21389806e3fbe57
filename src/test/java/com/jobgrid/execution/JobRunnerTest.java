package com.jobgrid.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobgrid.JobContext;
import com.jobgrid.JobWorker;
import com.jobgrid.catalog.JobCatalog;
import com.jobgrid.config.JobGridProperties;
import com.jobgrid.internal.JobGridMetrics;
import com.jobgrid.logging.JobLogStore;
import com.jobgrid.logging.LogSanitizer;
import com.jobgrid.model.JobDefinition;
import com.jobgrid.model.JobLogEntry;
import com.jobgrid.model.JobResult;
import com.jobgrid.model.JobResultStatus;
import com.jobgrid.model.LogLevel;
import com.jobgrid.repository.JobLogEntryRepository;
import com.jobgrid.repository.JobResultRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobRunnerTest {

    private JobResultRepository jobResultRepository;
    private JobLogStore jobLogStore;
    private JobResultService jobResultService;
    private JobGridProperties properties;

    static class InventoryJob implements JobWorker {
        @Override
        public Object run(JobContext context, Map<String, Object> kwargs) {
            context.info("Counting devices in " + kwargs.get("site"));
            return Map.of("devices", 3);
        }
    }

    static class ValidationJob implements JobWorker {
        @Override
        public Object run(JobContext context, Map<String, Object> kwargs) {
            context.fail("Site is missing a prefix");
            return null;
        }
    }

    static class CrashingJob implements JobWorker {
        @Override
        public Object run(JobContext context, Map<String, Object> kwargs) {
            throw new IllegalStateException("boom");
        }
    }

    static class StatusRecordingJob implements JobWorker {
        volatile JobResultStatus observed;

        @Override
        public Object run(JobContext context, Map<String, Object> kwargs) {
            observed = context.getJobResult().getStatus();
            return null;
        }
    }

    @BeforeEach
    void setUp() {
        jobResultRepository = mock(JobResultRepository.class);
        jobLogStore = mock(JobLogStore.class);
        properties = new JobGridProperties();
        properties.getWorker().setWorkerName("worker-1");
        jobResultService = new JobResultService(jobResultRepository, mock(JobLogEntryRepository.class), jobLogStore,
                new LogSanitizer(properties), new JobGridMetrics(jobResultRepository, new SimpleMeterRegistry()));
        when(jobResultRepository.save(any(JobResult.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private JobRunner runner(JobWorker... workers) {
        return new JobRunner(jobResultRepository, jobResultService, JobCatalog.fromWorkers(List.of(workers)),
                new ObjectMapper(), properties);
    }

    private JobResult pendingResult(Class<?> jobClass) {
        JobDefinition definition = new JobDefinition(jobClass.getPackageName(), jobClass.getSimpleName());
        JobResult result = new JobResult(UUID.randomUUID(), definition, "alice");
        when(jobResultRepository.findById(result.getId())).thenReturn(Optional.of(result));
        return result;
    }

    private TaskMessage message(JobResult result, Map<String, Object> kwargs) {
        return new TaskMessage(result.getId(), result.getTaskName(), "default", List.of(), kwargs,
                Map.of(TaskMessage.QUEUE, "default"));
    }

    @Test
    void shouldCompleteJobAndStoreItsReturnValue() {
        JobResult result = pendingResult(InventoryJob.class);

        ExecutionOutcome outcome = runner(new InventoryJob()).execute(message(result, Map.of("site", "ams01")));

        assertEquals(JobResultStatus.COMPLETED, outcome.status());
        assertEquals(3, outcome.result().get("devices").asInt());
        assertEquals("worker-1", outcome.worker());
        assertNotNull(outcome.dateDone());
        assertNull(outcome.traceback());
        ArgumentCaptor<JobLogEntry> captor = ArgumentCaptor.forClass(JobLogEntry.class);
        verify(jobLogStore).append(captor.capture());
        assertEquals("Counting devices in ams01", captor.getValue().getMessage());
    }

    @Test
    void shouldMarkJobFailedWhenItReportsFailure() {
        JobResult result = pendingResult(ValidationJob.class);

        ExecutionOutcome outcome = runner(new ValidationJob()).execute(message(result, Map.of()));

        assertEquals(JobResultStatus.FAILED, outcome.status());
        ArgumentCaptor<JobLogEntry> captor = ArgumentCaptor.forClass(JobLogEntry.class);
        verify(jobLogStore).append(captor.capture());
        assertEquals(LogLevel.FAILURE, captor.getValue().getLogLevel());
    }

    @Test
    void shouldMarkJobErroredAndKeepTracebackWhenItThrows() {
        JobResult result = pendingResult(CrashingJob.class);

        ExecutionOutcome outcome = runner(new CrashingJob()).execute(message(result, Map.of()));

        assertEquals(JobResultStatus.ERRORED, outcome.status());
        assertThat(outcome.traceback()).contains("IllegalStateException: boom");
        assertEquals(JobResultStatus.ERRORED, result.getStatus());
    }

    @Test
    void shouldErrorWhenJobIsNotInstalled() {
        JobResult result = pendingResult(CrashingJob.class);

        ExecutionOutcome outcome = runner().execute(message(result, Map.of()));

        assertEquals(JobResultStatus.ERRORED, outcome.status());
        assertThat(outcome.traceback()).contains("not installed");
        ArgumentCaptor<JobLogEntry> captor = ArgumentCaptor.forClass(JobLogEntry.class);
        verify(jobLogStore).append(captor.capture());
        assertEquals("initialization", captor.getValue().getGrouping());
        assertEquals(LogLevel.FAILURE, captor.getValue().getLogLevel());
    }

    @Test
    void shouldMarkResultRunningWhileJobExecutes() {
        JobResult result = pendingResult(StatusRecordingJob.class);
        StatusRecordingJob recorder = new StatusRecordingJob();

        ExecutionOutcome outcome = runner(recorder).execute(message(result, Map.of()));

        assertEquals(JobResultStatus.RUNNING, recorder.observed);
        assertEquals(JobResultStatus.COMPLETED, outcome.status());
        verify(jobResultRepository, atLeastOnce()).save(result);
    }

    @Test
    void shouldRejectUnknownResult() {
        TaskMessage message = new TaskMessage(UUID.randomUUID(), "com.example.jobs.Missing", "default", List.of(),
                Map.of(), Map.of());
        when(jobResultRepository.findById(message.jobResultId())).thenReturn(Optional.empty());

        assertThrows(IllegalStateException.class, () -> runner().execute(message));
    }
}
