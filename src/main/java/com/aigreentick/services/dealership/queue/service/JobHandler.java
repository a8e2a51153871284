package com.aigreentick.services.dealership.queue.service;

import com.aigreentick.services.dealership.queue.enums.JobType;

/**
 * Executes the payload of one job type. Throwing makes the queue retry the job
 * unless the exception is a {@code NonRetryableJobException}.
 *
 * @param <P> payload type the JSON body is bound to
 */
public interface JobHandler<P> {

    JobType type();

    Class<P> payloadType();

    /**
     * @return a result object, logged by the worker; may be null
     */
    Object handle(P payload);

    /**
     * Called once when the job is given up after its last attempt failed with an error
     * that would otherwise have been retried, or after it stalled with no attempts left.
     * Not called for non-retryable failures, which the handler saw when it threw them.
     */
    default void onExhausted(P payload, Exception cause) {
    }
}
