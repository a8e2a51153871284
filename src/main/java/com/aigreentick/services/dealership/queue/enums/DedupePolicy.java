package com.aigreentick.services.dealership.queue.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which existing jobs block a new job carrying the same dedupe key.
 */
public enum DedupePolicy {

    /** Only a job still waiting or running counts as a duplicate. */
    IN_FLIGHT(EnumSet.of(JobStatus.WAITING, JobStatus.ACTIVE)),

    /** A completed job also counts; used for provider sends so a re-run batch never re-sends. */
    ONCE(EnumSet.of(JobStatus.WAITING, JobStatus.ACTIVE, JobStatus.COMPLETED));

    private final Set<JobStatus> blockingStatuses;

    DedupePolicy(Set<JobStatus> blockingStatuses) {
        this.blockingStatuses = blockingStatuses;
    }

    public Set<JobStatus> getBlockingStatuses() {
        return blockingStatuses;
    }
}
