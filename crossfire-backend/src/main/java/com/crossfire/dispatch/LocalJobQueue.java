package com.crossfire.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * In-process {@link JobQueue}: one single-threaded executor per queue name.
 *
 * <p>Finished jobs stay registered for the retention period so they can still be requeued, then
 * are dropped on the next submission or completion.
 */
public class LocalJobQueue implements JobQueue, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LocalJobQueue.class);
    private static final String MDC_TRACE_ID = "trace_id";
    public static final Duration DEFAULT_RETENTION = Duration.ofMinutes(10);

    private final Duration retention;
    private final Clock clock;

    private final Map<String, ExecutorService> executors = new ConcurrentHashMap<>();
    private final Map<String, SubmittedJob> jobs = new ConcurrentHashMap<>();

    private static final class SubmittedJob {
        private final String queue;
        private final Runnable job;
        private volatile Future<?> future;
        private volatile Instant finishedAt;

        private SubmittedJob(String queue, Runnable job) {
            this.queue = queue;
            this.job = job;
        }
    }

    public LocalJobQueue() {
        this(DEFAULT_RETENTION, Clock.systemUTC());
    }

    /**
     * Create a job queue.
     *
     * @param retention how long a finished job can still be requeued
     * @param clock time source for retention
     */
    public LocalJobQueue(Duration retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
    }

    @Override
    public String enqueue(String queue, Runnable job) {
        String jobId = UUID.randomUUID().toString();
        SubmittedJob submitted = new SubmittedJob(queue, job);
        jobs.put(jobId, submitted);
        submit(jobId, submitted);
        log.info("Job enqueued: job_id={}, queue={}", jobId, queue);
        return jobId;
    }

    @Override
    public boolean delete(String jobId) {
        SubmittedJob submitted = jobs.remove(jobId);
        if (submitted == null) {
            log.warn("Delete requested for unknown job: job_id={}", jobId);
            return false;
        }
        Future<?> future = submitted.future;
        boolean cancelled = future != null && future.cancel(true);
        log.info("Job deleted: job_id={}, cancelled={}", jobId, cancelled);
        return cancelled;
    }

    @Override
    public boolean requeue(String jobId) {
        SubmittedJob submitted = jobs.get(jobId);
        if (submitted == null) {
            log.warn("Requeue requested for unknown job: job_id={}", jobId);
            return false;
        }
        submit(jobId, submitted);
        log.info("Job requeued: job_id={}, queue={}", jobId, submitted.queue);
        return true;
    }

    private void submit(String jobId, SubmittedJob submitted) {
        ExecutorService executor = executors.computeIfAbsent(submitted.queue, q -> Executors.newSingleThreadExecutor());
        submitted.finishedAt = null;
        submitted.future = executor.submit(() -> {
            MDC.put(MDC_TRACE_ID, jobId);
            try {
                submitted.job.run();
            } catch (RuntimeException e) {
                log.error("Job failed: job_id={}, queue={}", jobId, submitted.queue, e);
            } finally {
                submitted.finishedAt = clock.instant();
                MDC.remove(MDC_TRACE_ID);
                purgeFinished();
            }
        });
        purgeFinished();
    }

    private void purgeFinished() {
        Instant now = clock.instant();
        jobs.values().removeIf(j -> j.finishedAt != null && Duration.between(j.finishedAt, now).compareTo(retention) > 0);
    }

    int retainedJobCount() {
        return jobs.size();
    }

    @Override
    public void close() {
        for (ExecutorService executor : executors.values()) {
            executor.shutdown();
        }
        for (Map.Entry<String, ExecutorService> entry : executors.entrySet()) {
            try {
                if (!entry.getValue().awaitTermination(5, TimeUnit.SECONDS)) {
                    entry.getValue().shutdownNow();
                }
            } catch (InterruptedException e) {
                entry.getValue().shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
