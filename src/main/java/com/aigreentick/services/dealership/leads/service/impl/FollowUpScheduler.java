package com.aigreentick.services.dealership.leads.service.impl;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.dealership.campaigns.dto.SendSingleEmailPayload;
import com.aigreentick.services.dealership.common.exception.IllegalStateTransitionException;
import com.aigreentick.services.dealership.common.exception.InvalidJobPayloadException;
import com.aigreentick.services.dealership.common.exception.ResourceNotFoundException;
import com.aigreentick.services.dealership.leads.dto.FollowUpReminderPayload;
import com.aigreentick.services.dealership.leads.dto.FollowUpResult;
import com.aigreentick.services.dealership.leads.enums.FollowUpStatus;
import com.aigreentick.services.dealership.leads.enums.FollowUpType;
import com.aigreentick.services.dealership.leads.enums.Urgency;
import com.aigreentick.services.dealership.leads.model.FollowUpTask;
import com.aigreentick.services.dealership.leads.model.LeadAssignment;
import com.aigreentick.services.dealership.leads.model.SalesRepresentative;
import com.aigreentick.services.dealership.leads.model.Vehicle;
import com.aigreentick.services.dealership.leads.repository.FollowUpTaskRepository;
import com.aigreentick.services.dealership.leads.repository.LeadAssignmentRepository;
import com.aigreentick.services.dealership.leads.repository.SalesRepresentativeRepository;
import com.aigreentick.services.dealership.leads.repository.VehicleRepository;
import com.aigreentick.services.dealership.leads.service.impl.LeadContactResolver.LeadContact;
import com.aigreentick.services.dealership.queue.dto.JobOptions;
import com.aigreentick.services.dealership.queue.enums.DedupePolicy;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.service.QueueRuntime;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Schedules and processes follow-up reminders for lead assignments.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FollowUpScheduler {

    static final int REMINDER_EMAIL_PRIORITY = 3;

    private final QueueRuntime queueRuntime;
    private final LeadAssignmentRepository assignmentRepository;
    private final FollowUpTaskRepository followUpTaskRepository;
    private final SalesRepresentativeRepository representativeRepository;
    private final VehicleRepository vehicleRepository;
    private final LeadContactResolver contactResolver;
    private final Clock clock;

    @Value("${assignment.follow-up-delay:24h}")
    private Duration followUpDelay;

    /**
     * Reminder for the first contact, due when the urgency's response window ends.
     */
    public void scheduleInitialContact(LeadAssignment assignment) {
        Urgency urgency = assignment.getUrgency() == null ? Urgency.MEDIUM : assignment.getUrgency();
        schedule(assignment, FollowUpType.INITIAL_CONTACT, urgency.getResponseWindow());
    }

    public void scheduleFollowUp(LeadAssignment assignment) {
        schedule(assignment, FollowUpType.FOLLOW_UP, followUpDelay);
    }

    private void schedule(LeadAssignment assignment, FollowUpType type, Duration delay) {
        queueRuntime.enqueue(JobType.FOLLOW_UP_REMINDER,
                FollowUpReminderPayload.builder()
                        .assignmentId(assignment.getId())
                        .type(type)
                        .build(),
                JobOptions.delayed(JobOptions.DEFAULT_PRIORITY, delay));

        log.info("Follow-up reminder scheduled. assignmentId={} type={} in={}min",
                assignment.getId(), type, delay.toMinutes());
    }

    /**
     * Creates the follow-up task and queues the reminder email. An assignment that is no
     * longer open gets neither.
     */
    @Transactional
    public FollowUpResult processReminder(FollowUpReminderPayload payload) {
        InvalidJobPayloadException.require(payload.getAssignmentId() != null, "assignmentId is required");
        FollowUpType type = payload.getType() == null ? FollowUpType.INITIAL_CONTACT : payload.getType();

        Optional<LeadAssignment> found = assignmentRepository.findById(payload.getAssignmentId());
        if (found.isEmpty()) {
            log.info("Follow-up skipped, assignment not found. assignmentId={}", payload.getAssignmentId());
            return FollowUpResult.skipped("Assignment not found");
        }
        LeadAssignment assignment = found.get();

        if (!assignment.getStatus().isOpen()) {
            log.info("Follow-up skipped, assignment no longer active. assignmentId={} status={}",
                    assignment.getId(), assignment.getStatus());
            return FollowUpResult.skipped("Assignment no longer active");
        }

        boolean alreadyPending = followUpTaskRepository
                .findByAssignmentIdAndStatus(assignment.getId(), FollowUpStatus.PENDING).stream()
                .anyMatch(task -> task.getType() == type);
        if (alreadyPending) {
            return FollowUpResult.skipped("Reminder already pending");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        FollowUpTask task = followUpTaskRepository.save(FollowUpTask.builder()
                .assignmentId(assignment.getId())
                .representativeId(assignment.getRepresentativeId())
                .type(type)
                .dueAt(now)
                .createdAt(now)
                .build());

        SalesRepresentative rep = representativeRepository.findById(assignment.getRepresentativeId())
                .orElseThrow(() -> new InvalidJobPayloadException(
                        "Representative not found: " + assignment.getRepresentativeId()));
        LeadContact contact = contactResolver.resolve(assignment.getCustomerId(), assignment.getInquiryId());
        Vehicle vehicle = contact.vehicleId() == null ? null : vehicleRepository.findById(contact.vehicleId()).orElse(null);

        queueRuntime.enqueue(JobType.SEND_SINGLE_EMAIL,
                SendSingleEmailPayload.builder()
                        .to(rep.getEmail())
                        .subject(LeadNotifications.reminderSubject(type))
                        .content(LeadNotifications.reminderContent(type, assignment, contact.name(), vehicle))
                        .priority(REMINDER_EMAIL_PRIORITY)
                        .build(),
                JobOptions.builder()
                        .priority(REMINDER_EMAIL_PRIORITY)
                        .dedupeKey("follow-up:" + task.getId())
                        .dedupePolicy(DedupePolicy.ONCE)
                        .build());

        log.info("Follow-up reminder queued. assignmentId={} taskId={} representativeId={} type={}",
                assignment.getId(), task.getId(), rep.getId(), type);
        return new FollowUpResult(true, task.getId(), null);
    }

    @Transactional
    public void completeTask(Long taskId, String notes) {
        FollowUpTask task = followUpTaskRepository.findById(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("FollowUpTask", taskId));
        if (!task.getStatus().canTransitionTo(FollowUpStatus.COMPLETED)) {
            throw new IllegalStateTransitionException("FollowUpTask", taskId, task.getStatus(), FollowUpStatus.COMPLETED);
        }
        if (followUpTaskRepository.complete(taskId, notes, LocalDateTime.now(clock)) != 1) {
            throw new IllegalStateTransitionException("FollowUpTask", taskId, "status changed concurrently");
        }
        log.info("Follow-up task completed. taskId={} assignmentId={}", taskId, task.getAssignmentId());
    }
}
