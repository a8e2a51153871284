package com.aigreentick.services.dealership.leads.dto;

import java.util.List;

/**
 * Outcome of an assignment attempt. "Already assigned" and "no representative"
 * are regular results, not errors.
 */
public record AssignmentResult(
        Outcome outcome,
        Long assignmentId,
        Long assignedTo,
        String representativeName,
        double confidence,
        String reason,
        List<String> recommendedActions,
        boolean escalationRequired,
        Long waitQueueEntryId
) {

    public enum Outcome {
        ASSIGNED,
        ALREADY_ASSIGNED,
        QUEUED_FOR_LATER
    }

    public static AssignmentResult alreadyAssigned(Long existingAssignmentId, Long representativeId) {
        return new AssignmentResult(Outcome.ALREADY_ASSIGNED, existingAssignmentId, representativeId, null,
                0, "Lead already assigned", List.of(), false, null);
    }

    public boolean isAssigned() {
        return outcome == Outcome.ASSIGNED;
    }
}
