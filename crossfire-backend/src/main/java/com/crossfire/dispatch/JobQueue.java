package com.crossfire.dispatch;

/**
 * Job runtime that executes submitted work on named queues.
 */
public interface JobQueue {

    /**
     * Enqueues work without waiting for it to run.
     *
     * @param queue queue name
     * @param job work to run
     * @return job identifier
     */
    String enqueue(String queue, Runnable job);

    /**
     * Removes a job, interrupting it when already running. Best effort: a running job may not observe
     * the interruption.
     *
     * @param jobId job identifier
     * @return true when the job was known and not yet finished
     */
    boolean delete(String jobId);

    /**
     * Submits a known job again on its original queue.
     *
     * @param jobId job identifier
     * @return true when the job was known
     */
    boolean requeue(String jobId);
}
