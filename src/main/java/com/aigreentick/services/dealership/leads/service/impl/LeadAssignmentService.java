package com.aigreentick.services.dealership.leads.service.impl;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.dealership.campaigns.dto.SendSingleEmailPayload;
import com.aigreentick.services.dealership.common.exception.IllegalStateTransitionException;
import com.aigreentick.services.dealership.common.exception.InvalidJobPayloadException;
import com.aigreentick.services.dealership.common.exception.ResourceNotFoundException;
import com.aigreentick.services.dealership.config.DealershipProperties;
import com.aigreentick.services.dealership.leads.dto.AssignLeadPayload;
import com.aigreentick.services.dealership.leads.dto.AssignmentResult;
import com.aigreentick.services.dealership.leads.dto.AssignmentResult.Outcome;
import com.aigreentick.services.dealership.leads.enums.AssignmentPriority;
import com.aigreentick.services.dealership.leads.enums.AssignmentStatus;
import com.aigreentick.services.dealership.leads.enums.LeadEventType;
import com.aigreentick.services.dealership.leads.enums.Urgency;
import com.aigreentick.services.dealership.leads.enums.WaitQueueStatus;
import com.aigreentick.services.dealership.leads.kafka.event.LeadLifecycleEvent;
import com.aigreentick.services.dealership.leads.kafka.producer.LeadEventProducer;
import com.aigreentick.services.dealership.leads.model.LeadAssignment;
import com.aigreentick.services.dealership.leads.model.SalesRepresentative;
import com.aigreentick.services.dealership.leads.model.WaitQueueEntry;
import com.aigreentick.services.dealership.leads.repository.FollowUpTaskRepository;
import com.aigreentick.services.dealership.leads.repository.LeadAssignmentRepository;
import com.aigreentick.services.dealership.leads.repository.SalesRepresentativeRepository;
import com.aigreentick.services.dealership.leads.repository.WaitQueueEntryRepository;
import com.aigreentick.services.dealership.leads.service.impl.AssignmentEngine.RepresentativeScore;
import com.aigreentick.services.dealership.leads.service.impl.LeadContactResolver.LeadContact;
import com.aigreentick.services.dealership.queue.dto.JobOptions;
import com.aigreentick.services.dealership.queue.enums.DedupePolicy;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.service.QueueRuntime;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Assigns leads to sales representatives and manages the assignment lifecycle.
 *
 * <p>The open-assignment guard runs before anything is written, so a lead scored
 * several times ends up with one assignment. Notifications, the acknowledgment and
 * the first follow-up reminder are queued jobs, never direct calls.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeadAssignmentService {

    static final String NO_REPRESENTATIVE_REASON = "No sales representatives available";
    static final String LOW_CONFIDENCE_REASON = "Best available option (low confidence)";
    static final double MANUAL_ASSIGNMENT_CONFIDENCE = 75;
    static final int NOTIFICATION_PRIORITY = 2;

    private final AssignmentEngine assignmentEngine;
    private final LeadAssignmentRepository assignmentRepository;
    private final SalesRepresentativeRepository representativeRepository;
    private final WaitQueueEntryRepository waitQueueRepository;
    private final FollowUpTaskRepository followUpTaskRepository;
    private final FollowUpScheduler followUpScheduler;
    private final LeadContactResolver contactResolver;
    private final LeadEventProducer leadEventProducer;
    private final QueueRuntime queueRuntime;
    private final DealershipProperties dealership;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${assignment.min-confidence:30}")
    private double minConfidence;

    @Transactional
    public AssignmentResult assign(AssignLeadPayload lead) {
        InvalidJobPayloadException.require(lead.getCustomerId() != null || lead.getInquiryId() != null,
                "customerId or inquiryId is required");

        Optional<LeadAssignment> existing = assignmentRepository.findOpenAssignment(lead.getCustomerId(), lead.getInquiryId());
        if (existing.isPresent()) {
            LeadAssignment open = existing.get();
            log.info("Lead already has an open assignment. assignmentId={} customerId={} inquiryId={} status={}",
                    open.getId(), lead.getCustomerId(), lead.getInquiryId(), open.getStatus());
            return AssignmentResult.alreadyAssigned(open.getId(), open.getRepresentativeId());
        }

        List<SalesRepresentative> candidates = assignmentEngine.availableNow(
                representativeRepository.findByActiveTrueAndAvailableTrue());
        if (candidates.isEmpty()) {
            return queueForLater(lead);
        }

        RepresentativeScore best = assignmentEngine.rank(candidates, lead).get(0);
        if (best.score() < minConfidence) {
            log.warn("Low confidence assignment. customerId={} inquiryId={} representativeId={} score={}",
                    lead.getCustomerId(), lead.getInquiryId(), best.representative().getId(), best.score());
            boolean escalate = urgencyOf(lead) == Urgency.URGENT
                    || (lead.getLeadScore() != null && lead.getLeadScore() > 80);
            return createAssignment(lead, best.representative(), best.score(), LOW_CONFIDENCE_REASON, escalate);
        }
        return createAssignment(lead, best.representative(), best.score(), best.reason(), false);
    }

    /**
     * Moves an assignment along its status table. Closing or expiring ends its reminders
     * and frees the representative; entering FOLLOW_UP schedules the next reminder.
     */
    @Transactional
    public LeadAssignment updateStatus(Long assignmentId, AssignmentStatus to) {
        LeadAssignment assignment = assignmentRepository.findById(assignmentId)
                .orElseThrow(() -> new ResourceNotFoundException("LeadAssignment", assignmentId));
        AssignmentStatus from = assignment.getStatus();
        LocalDateTime now = LocalDateTime.now(clock);

        assignmentRepository.transition(assignment, to, now);
        if (!to.isOpen()) {
            release(assignment, now);
        } else if (to == AssignmentStatus.FOLLOW_UP) {
            followUpScheduler.scheduleFollowUp(assignment);
        }

        log.info("Assignment status changed. assignmentId={} {}->{}", assignmentId, from, to);
        return assignmentRepository.findById(assignmentId).orElse(assignment);
    }

    /**
     * Closes the assignment and assigns the lead again, to the given representative
     * or to the best available one.
     */
    @Transactional
    public AssignmentResult reassign(Long assignmentId, String reason, Long targetRepresentativeId) {
        LeadAssignment current = assignmentRepository.findById(assignmentId)
                .orElseThrow(() -> new ResourceNotFoundException("LeadAssignment", assignmentId));
        if (!current.getStatus().isOpen()) {
            throw new IllegalStateTransitionException("LeadAssignment", assignmentId, current.getStatus(), AssignmentStatus.CLOSED);
        }

        SalesRepresentative target = null;
        if (targetRepresentativeId != null) {
            target = representativeRepository.findById(targetRepresentativeId)
                    .orElseThrow(() -> new ResourceNotFoundException("SalesRepresentative", targetRepresentativeId));
        }

        LocalDateTime now = LocalDateTime.now(clock);
        current.setReassignmentReason(reason);
        assignmentRepository.save(current);
        assignmentRepository.transition(current, AssignmentStatus.CLOSED, now);
        release(current, now);

        AssignLeadPayload lead = AssignLeadPayload.builder()
                .customerId(current.getCustomerId())
                .inquiryId(current.getInquiryId())
                .leadScore(current.getLeadScore())
                .urgency(Urgency.HIGH)
                .build();

        AssignmentResult result = target != null
                ? createAssignment(lead, target, MANUAL_ASSIGNMENT_CONFIDENCE, "Manual reassignment: " + reason, false)
                : assign(lead);

        LeadLifecycleEvent event = event(LeadEventType.REASSIGNED, lead);
        event.setAssignmentId(result.assignmentId());
        event.setRepresentativeId(result.assignedTo());
        event.setReason(reason);
        leadEventProducer.publish(event);

        log.info("Lead reassigned. previousAssignmentId={} previousRepresentativeId={} outcome={} newRepresentativeId={}",
                assignmentId, current.getRepresentativeId(), result.outcome(), result.assignedTo());
        return result;
    }

    private AssignmentResult createAssignment(AssignLeadPayload lead, SalesRepresentative rep, double confidence,
            String reason, boolean escalationRequired) {
        LocalDateTime now = LocalDateTime.now(clock);
        Urgency urgency = urgencyOf(lead);

        LeadAssignment saved = assignmentRepository.save(LeadAssignment.builder()
                .customerId(lead.getCustomerId())
                .inquiryId(lead.getInquiryId())
                .representativeId(rep.getId())
                .priority(priorityOf(urgency, lead.getLeadScore()))
                .urgency(urgency)
                .confidence(confidence)
                .assignmentReason(reason)
                .leadScore(lead.getLeadScore())
                .assignedAt(now)
                .dueAt(now.plus(urgency.getResponseWindow()))
                .build());
        representativeRepository.incrementWorkload(rep.getId(), now);

        List<String> actions = AssignmentEngine.recommendedActions(lead);
        LeadContact contact = contactResolver.resolve(lead.getCustomerId(), lead.getInquiryId());

        notifyRepresentative(saved, rep, contact, actions);
        acknowledgeCustomer(saved, rep, contact);
        followUpScheduler.scheduleInitialContact(saved);
        markWaitingEntriesAssigned(lead);

        LeadLifecycleEvent assigned = event(LeadEventType.ASSIGNED, lead);
        assigned.setAssignmentId(saved.getId());
        assigned.setRepresentativeId(rep.getId());
        assigned.setReason(reason);
        assigned.setEscalationRequired(escalationRequired);
        leadEventProducer.publish(assigned);
        if (escalationRequired) {
            LeadLifecycleEvent escalation = event(LeadEventType.ESCALATION_REQUIRED, lead);
            escalation.setAssignmentId(saved.getId());
            escalation.setEscalationRequired(true);
            escalation.setReason(reason);
            leadEventProducer.publish(escalation);
        }

        log.info("Lead assigned. assignmentId={} customerId={} inquiryId={} representativeId={} confidence={} priority={}",
                saved.getId(), lead.getCustomerId(), lead.getInquiryId(), rep.getId(), confidence, saved.getPriority());

        return new AssignmentResult(Outcome.ASSIGNED, saved.getId(), rep.getId(), rep.getName(),
                confidence, reason, actions, escalationRequired, null);
    }

    private AssignmentResult queueForLater(AssignLeadPayload lead) {
        Urgency urgency = urgencyOf(lead);
        boolean escalate = urgency == Urgency.URGENT;

        List<WaitQueueEntry> waiting = waitQueueRepository.findWaitingForLead(lead.getCustomerId(), lead.getInquiryId());
        WaitQueueEntry entry = waiting.isEmpty()
                ? waitQueueRepository.save(WaitQueueEntry.builder()
                        .customerId(lead.getCustomerId())
                        .inquiryId(lead.getInquiryId())
                        .priority(urgency)
                        .leadScore(lead.getLeadScore())
                        .criteria(criteriaJson(lead))
                        .reason(NO_REPRESENTATIVE_REASON)
                        .attempts(0)
                        .createdAt(LocalDateTime.now(clock))
                        .build())
                : waiting.get(0);

        LeadLifecycleEvent event = event(LeadEventType.QUEUED_FOR_LATER, lead);
        event.setWaitQueueEntryId(entry.getId());
        event.setEscalationRequired(escalate);
        event.setReason(NO_REPRESENTATIVE_REASON);
        leadEventProducer.publish(event);

        log.warn("No representative available, lead queued. waitQueueEntryId={} customerId={} inquiryId={} urgency={}",
                entry.getId(), lead.getCustomerId(), lead.getInquiryId(), urgency);

        return new AssignmentResult(Outcome.QUEUED_FOR_LATER, null, null, null, 0, NO_REPRESENTATIVE_REASON,
                List.of(
                        "Add lead to queue for next available representative",
                        "Send automated acknowledgment email",
                        "Escalate to sales manager if urgent",
                        "Schedule callback for next business day"),
                escalate, entry.getId());
    }

    private void notifyRepresentative(LeadAssignment assignment, SalesRepresentative rep, LeadContact contact,
            List<String> actions) {
        queueRuntime.enqueue(JobType.SEND_SINGLE_EMAIL,
                SendSingleEmailPayload.builder()
                        .to(rep.getEmail())
                        .subject(LeadNotifications.assignmentSubject(assignment.getConfidence()))
                        .content(LeadNotifications.assignmentContent(contact.name(), assignment.getConfidence(),
                                assignment.getAssignmentReason(), actions, dealership))
                        .priority(NOTIFICATION_PRIORITY)
                        .build(),
                notificationOptions("assignment-notify:" + assignment.getId()));
    }

    private void acknowledgeCustomer(LeadAssignment assignment, SalesRepresentative rep, LeadContact contact) {
        if (contact.email() == null || contact.email().isBlank()) {
            log.debug("No email for acknowledgment. assignmentId={}", assignment.getId());
            return;
        }
        queueRuntime.enqueue(JobType.SEND_SINGLE_EMAIL,
                SendSingleEmailPayload.builder()
                        .to(contact.email())
                        .subject(LeadNotifications.acknowledgmentSubject(dealership))
                        .content(LeadNotifications.acknowledgmentContent(contact.name(), rep, dealership))
                        .customerId(assignment.getCustomerId())
                        .priority(NOTIFICATION_PRIORITY)
                        .build(),
                notificationOptions("assignment-ack:" + assignment.getId()));
    }

    private static JobOptions notificationOptions(String dedupeKey) {
        return JobOptions.builder()
                .priority(NOTIFICATION_PRIORITY)
                .dedupeKey(dedupeKey)
                .dedupePolicy(DedupePolicy.ONCE)
                .build();
    }

    private void markWaitingEntriesAssigned(AssignLeadPayload lead) {
        for (WaitQueueEntry entry : waitQueueRepository.findWaitingForLead(lead.getCustomerId(), lead.getInquiryId())) {
            waitQueueRepository.transition(entry, WaitQueueStatus.ASSIGNED);
            log.info("Wait queue entry resolved. waitQueueEntryId={}", entry.getId());
        }
    }

    private void release(LeadAssignment assignment, LocalDateTime now) {
        int cancelled = followUpTaskRepository.cancelPending(assignment.getId(), now);
        representativeRepository.decrementWorkload(assignment.getRepresentativeId());
        log.debug("Assignment released. assignmentId={} cancelledFollowUps={}", assignment.getId(), cancelled);
    }

    private String criteriaJson(AssignLeadPayload lead) {
        try {
            return objectMapper.writeValueAsString(lead);
        } catch (JsonProcessingException e) {
            throw new InvalidJobPayloadException("Assignment criteria are not serializable", e);
        }
    }

    private LeadLifecycleEvent event(LeadEventType type, AssignLeadPayload lead) {
        LeadLifecycleEvent event = LeadLifecycleEvent.of(type, lead.getCustomerId(), lead.getInquiryId(), clock.millis());
        event.setUrgency(urgencyOf(lead));
        event.setLeadScore(lead.getLeadScore());
        return event;
    }

    static Urgency urgencyOf(AssignLeadPayload lead) {
        return lead.getUrgency() == null ? Urgency.MEDIUM : lead.getUrgency();
    }

    static AssignmentPriority priorityOf(Urgency urgency, Double leadScore) {
        double score = leadScore == null ? 0 : leadScore;
        if (urgency == Urgency.URGENT || score > 80) return AssignmentPriority.HIGH;
        if (urgency == Urgency.HIGH || score > 60) return AssignmentPriority.MEDIUM;
        return AssignmentPriority.LOW;
    }
}
