package com.jobgrid.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process {@link TaskQueue}: a fixed pool of worker threads running {@link JobRunner}.
 * The hard time limit of a message is enforced by interrupting its worker thread. Sending to a
 * full queue fails instead of running the job on the sender's thread.
 */
public class ExecutorTaskQueue implements TaskQueue, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ExecutorTaskQueue.class);

    private final JobRunner jobRunner;
    private final ThreadPoolExecutor processingExecutor;
    private final ScheduledExecutorService watchdog;

    public ExecutorTaskQueue(JobRunner jobRunner, int workerCount) {
        this.jobRunner = jobRunner;
        int threads = Math.max(1, workerCount);
        int processingQueueCapacity = Math.max(32, threads * 8);
        AtomicInteger threadIndex = new AtomicInteger();
        this.processingExecutor = new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(processingQueueCapacity),
                runnable -> new Thread(runnable, "jobgrid-worker-" + threadIndex.incrementAndGet()),
                new ThreadPoolExecutor.AbortPolicy());
        this.watchdog = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "jobgrid-watchdog");
            thread.setDaemon(true);
            return thread;
        });
        log.info("Task queue started with {} worker thread(s)", threads);
    }

    /**
     * @throws IllegalStateException if the queue is full or shutting down
     */
    @Override
    public void send(TaskMessage message) {
        Future<?> future;
        try {
            future = processingExecutor.submit(() -> run(message));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Task queue rejected job result " + message.jobResultId() + " ("
                    + message.taskName() + "): " + processingExecutor.getQueue().size() + " message(s) waiting", e);
        }

        message.softTimeLimit().ifPresent(limit -> watchdog.schedule(() -> {
            if (!future.isDone()) {
                log.warn("Job result {} ({}) passed its soft time limit of {}s", message.jobResultId(),
                        message.taskName(), limit);
            }
        }, limit, TimeUnit.SECONDS));

        message.timeLimit().ifPresent(limit -> watchdog.schedule(() -> {
            if (!future.isDone()) {
                log.error("Job result {} ({}) exceeded its time limit of {}s, interrupting it",
                        message.jobResultId(), message.taskName(), limit);
                future.cancel(true);
            }
        }, limit, TimeUnit.SECONDS));
    }

    private void run(TaskMessage message) {
        try {
            jobRunner.execute(message);
        } catch (Exception e) {
            log.error("Failed to execute job result {} ({})", message.jobResultId(), message.taskName(), e);
        }
    }

    @Override
    public void destroy() throws InterruptedException {
        watchdog.shutdownNow();
        processingExecutor.shutdown();
        if (!processingExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warn("Worker threads did not finish within 30s, interrupting them");
            processingExecutor.shutdownNow();
        }
    }
}
