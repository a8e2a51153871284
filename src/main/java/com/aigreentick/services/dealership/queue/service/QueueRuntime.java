package com.aigreentick.services.dealership.queue.service;

import com.aigreentick.services.dealership.queue.dto.EnqueuedJob;
import com.aigreentick.services.dealership.queue.dto.JobOptions;
import com.aigreentick.services.dealership.queue.enums.JobType;

/**
 * At-least-once job queue with priority, delay and retry-with-backoff.
 * Components receive it by injection and never hold a queue instance of their own.
 */
public interface QueueRuntime {

    /**
     * Stores a job for later execution.
     *
     * @param type    job type, selects the handler and the worker pool
     * @param payload payload object, serialized to JSON
     * @param options priority, delay, attempts and dedupe key
     * @return handle of the stored job, or of the existing job when deduplicated
     */
    EnqueuedJob enqueue(JobType type, Object payload, JobOptions options);

    default EnqueuedJob enqueue(JobType type, Object payload) {
        return enqueue(type, payload, JobOptions.defaults());
    }
}
