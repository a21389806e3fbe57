package com.jobgrid;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobgrid.config.JobGridProperties;
import com.jobgrid.execution.ExecutionOutcome;
import com.jobgrid.execution.JobRunner;
import com.jobgrid.execution.TaskMessage;
import com.jobgrid.execution.TaskQueue;
import com.jobgrid.internal.AfterCommitExecutor;
import com.jobgrid.model.JobDefinition;
import com.jobgrid.model.JobResult;
import com.jobgrid.model.ScheduledJob;
import com.jobgrid.repository.JobResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class JobClient {

    private static final Logger log = LoggerFactory.getLogger(JobClient.class);

    private final JobResultRepository jobResultRepository;
    private final ObjectMapper objectMapper;
    private final JobGridProperties properties;
    private final JobRunner jobRunner;
    private final ObjectProvider<TaskQueue> taskQueue;
    private final AfterCommitExecutor afterCommitExecutor;
    private final TransactionTemplate newTransaction;

    public JobClient(
            JobResultRepository jobResultRepository,
            ObjectMapper objectMapper,
            JobGridProperties properties,
            JobRunner jobRunner,
            ObjectProvider<TaskQueue> taskQueue,
            AfterCommitExecutor afterCommitExecutor,
            TransactionTemplate transactionTemplate) {
        this.jobResultRepository = jobResultRepository;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.jobRunner = jobRunner;
        this.taskQueue = taskQueue;
        this.afterCommitExecutor = afterCommitExecutor;
        this.newTransaction = new TransactionTemplate(transactionTemplate.getTransactionManager());
        this.newTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Enqueue a job with keyword arguments only.
     */
    public JobResult enqueue(JobDefinition jobDefinition, String user, Map<String, ?> kwargs) {
        return enqueue(jobDefinition, user, List.of(), kwargs, null, null, false);
    }

    /**
     * Enqueue a job on a specific queue.
     */
    public JobResult enqueue(JobDefinition jobDefinition, String user, Map<String, ?> kwargs, String queue) {
        return enqueue(jobDefinition, user, List.of(), kwargs, null, queue, false);
    }

    /**
     * Run a job in the calling thread and return its finished result.
     */
    public JobResult runSynchronously(JobDefinition jobDefinition, String user, Map<String, ?> kwargs) {
        return enqueue(jobDefinition, user, List.of(), kwargs, null, null, true);
    }

    /**
     * Full enqueue method with all options.
     * <p>
     * Creates a PENDING job result and hands the job to the task queue once the caller's
     * transaction commits (immediately when there is none). Keyword arguments of jobs with
     * sensitive variables are passed to the worker but never stored. A synchronous run executes
     * the job in the calling thread and returns the finished result.
     *
     * @throws IllegalArgumentException if a schedule is given for a synchronous run
     */
    public JobResult enqueue(
            JobDefinition jobDefinition,
            String user,
            List<?> args,
            Map<String, ?> kwargs,
            ScheduledJob schedule,
            String queue,
            boolean synchronous) {
        if (schedule != null && synchronous) {
            throw new IllegalArgumentException("Scheduled jobs cannot be run synchronously");
        }
        if (jobDefinition == null) {
            throw new IllegalArgumentException("Job definition must not be null");
        }

        List<Object> taskArgs = args == null ? new ArrayList<>() : new ArrayList<>(args);
        Map<String, Object> taskKwargs = kwargs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(kwargs);
        String resolvedQueue = resolveQueue(jobDefinition, queue);

        Map<String, Object> options = new LinkedHashMap<>();
        options.put(TaskMessage.QUEUE, resolvedQueue);
        if (jobDefinition.getSoftTimeLimit() > 0) {
            options.put(TaskMessage.SOFT_TIME_LIMIT, jobDefinition.getSoftTimeLimit());
        }
        if (jobDefinition.getTimeLimit() > 0) {
            options.put(TaskMessage.TIME_LIMIT, jobDefinition.getTimeLimit());
        }

        JobResult jobResult = new JobResult(UUID.randomUUID(), jobDefinition, user);
        jobResult.setTaskArgs(objectMapper.valueToTree(taskArgs));
        if (!jobDefinition.isHasSensitiveVariables()) {
            jobResult.setTaskKwargs(objectMapper.valueToTree(taskKwargs));
        }
        jobResult.setDispatchKwargs(objectMapper.valueToTree(options));
        jobResult.setScheduledJob(schedule);

        TaskMessage message = new TaskMessage(jobResult.getId(), jobDefinition.getClassPath(), resolvedQueue,
                taskArgs, taskKwargs, options);

        if (synchronous) {
            return runInCallerThread(jobResult, message);
        }

        JobResult saved = jobResultRepository.save(jobResult);
        afterCommitExecutor.execute(() -> send(message));
        log.debug("Enqueued job {} as result {} on queue {}", message.taskName(), saved.getId(), resolvedQueue);
        return saved;
    }

    private JobResult runInCallerThread(JobResult jobResult, TaskMessage message) {
        // Committed up front so the run and its log entries can see the row.
        JobResult saved = newTransaction.execute(status -> jobResultRepository.save(jobResult));
        ExecutionOutcome outcome = jobRunner.execute(message);

        saved.setStatus(outcome.status());
        saved.setResult(outcome.result());
        saved.setTraceback(outcome.traceback());
        saved.setWorker(outcome.worker());
        saved.setDateDone(outcome.dateDone());
        log.debug("Ran job {} synchronously as result {}: {}", message.taskName(), saved.getId(), outcome.status());
        return jobResultRepository.save(saved);
    }

    private void send(TaskMessage message) {
        TaskQueue queue = taskQueue.getIfAvailable();
        if (queue == null) {
            throw new IllegalStateException("No task queue is available to run job result " + message.jobResultId());
        }
        queue.send(message);
    }

    private String resolveQueue(JobDefinition jobDefinition, String queue) {
        if (queue != null && !queue.isBlank()) {
            return queue.trim();
        }
        List<String> taskQueues = jobDefinition.getTaskQueues();
        if (taskQueues != null && !taskQueues.isEmpty()) {
            return taskQueues.get(0);
        }
        return properties.getJobs().getDefaultQueue();
    }
}
