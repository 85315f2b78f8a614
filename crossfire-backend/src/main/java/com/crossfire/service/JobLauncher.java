package com.crossfire.service;

import com.crossfire.api.JobRequest;
import com.crossfire.config.QueryProcessorProperties;
import com.crossfire.delivery.ChannelKind;
import com.crossfire.delivery.Channels;
import com.crossfire.delivery.DeliveryChannel;
import com.crossfire.delivery.JobStatusMessage;
import com.crossfire.dispatch.JobQueue;
import com.crossfire.dispatch.ShardAssigner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Accepts jobs onto this host's queues and relays job control requests to the job runtime.
 *
 * <p>Acceptance returns as soon as the job is enqueued; its outcome reaches the client through the
 * delivery channel.
 */
@Slf4j
@Service
public class JobLauncher {
    private final JobQueue jobQueue;
    private final ShardAssigner shardAssigner;
    private final DeliveryChannel deliveryChannel;
    private final Clock clock;
    private final List<String> queues;

    /**
     * Create a job launcher.
     *
     * @param jobQueue job runtime
     * @param shardAssigner queue picker
     * @param deliveryChannel channel for job status messages
     * @param clock time source for status timestamps
     * @param properties worker count and host name used to derive this host's queues
     */
    public JobLauncher(
            JobQueue jobQueue,
            ShardAssigner shardAssigner,
            DeliveryChannel deliveryChannel,
            Clock clock,
            QueryProcessorProperties properties
    ) {
        this.jobQueue = jobQueue;
        this.shardAssigner = shardAssigner;
        this.deliveryChannel = deliveryChannel;
        this.clock = clock;
        this.queues = ShardAssigner.queues(properties.getWorkers(), properties.resolveHostName());
        log.info("Job launcher ready: queues={}", queues);
    }

    /**
     * Enqueues a job for background processing on one of this host's queues.
     *
     * @param job job to run
     * @param request job input
     * @param userPrincipalName user principal name
     * @param userSubscriberName user object identifier
     * @param <R> request type
     * @return job identifier
     */
    public <R> String acceptJob(BackgroundJob<R, ?> job, R request, String userPrincipalName, String userSubscriberName) {
        BackgroundJobParams jobParams = new BackgroundJobParams(userPrincipalName, userSubscriberName);
        String queue = shardAssigner.assign(queues);
        return jobQueue.enqueue(queue, () -> job.process(request, jobParams));
    }

    /**
     * Cancels a job and reports the outcome to the client.
     *
     * @param request job control request
     * @param userSubscriberName user object identifier
     */
    public void cancelJob(JobRequest request, String userSubscriberName) {
        boolean cancelled = jobQueue.delete(request.getJobId());
        sendStatus(request, cancelled ? JobRequest.JOB_ACTION_CANCEL : JobRequest.JOB_ACTION_FAILURE, userSubscriberName);
    }

    /**
     * Requeues a job and reports the outcome to the client.
     *
     * @param request job control request
     * @param userSubscriberName user object identifier
     */
    public void requeueJob(JobRequest request, String userSubscriberName) {
        boolean requeued = jobQueue.requeue(request.getJobId());
        sendStatus(request, requeued ? JobRequest.JOB_ACTION_REQUEUE : JobRequest.JOB_ACTION_FAILURE, userSubscriberName);
    }

    public List<String> getQueues() {
        return queues;
    }

    private void sendStatus(JobRequest request, String status, String userSubscriberName) {
        JobStatusMessage message = new JobStatusMessage(Channels.timestamp(clock.instant()), request.getJobId(), status);
        String group = Channels.groupIdentifier(userSubscriberName, request.getUniqueClientIdentifier());
        deliveryChannel.send(Channels.channel(group, ChannelKind.STATUS), ChannelKind.STATUS, message);
    }
}
