package com.aigreentick.services.dealership.leads.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import com.aigreentick.services.dealership.campaigns.dto.SendSingleEmailPayload;
import com.aigreentick.services.dealership.common.exception.IllegalStateTransitionException;
import com.aigreentick.services.dealership.common.exception.InvalidJobPayloadException;
import com.aigreentick.services.dealership.config.DealershipProperties;
import com.aigreentick.services.dealership.leads.dto.AssignLeadPayload;
import com.aigreentick.services.dealership.leads.dto.AssignmentResult;
import com.aigreentick.services.dealership.leads.dto.AssignmentResult.Outcome;
import com.aigreentick.services.dealership.leads.enums.AssignmentPriority;
import com.aigreentick.services.dealership.leads.enums.AssignmentStatus;
import com.aigreentick.services.dealership.leads.enums.LeadEventType;
import com.aigreentick.services.dealership.leads.enums.Urgency;
import com.aigreentick.services.dealership.leads.kafka.event.LeadLifecycleEvent;
import com.aigreentick.services.dealership.leads.kafka.producer.LeadEventProducer;
import com.aigreentick.services.dealership.leads.model.LeadAssignment;
import com.aigreentick.services.dealership.leads.model.SalesRepresentative;
import com.aigreentick.services.dealership.leads.model.WaitQueueEntry;
import com.aigreentick.services.dealership.leads.repository.FollowUpTaskRepository;
import com.aigreentick.services.dealership.leads.repository.LeadAssignmentRepository;
import com.aigreentick.services.dealership.leads.repository.SalesRepresentativeRepository;
import com.aigreentick.services.dealership.leads.repository.WaitQueueEntryRepository;
import com.aigreentick.services.dealership.leads.service.impl.LeadContactResolver.LeadContact;
import com.aigreentick.services.dealership.queue.InMemoryQueueRuntime;
import com.aigreentick.services.dealership.queue.InMemoryQueueRuntime.RecordedJob;
import com.aigreentick.services.dealership.queue.enums.DedupePolicy;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.fasterxml.jackson.databind.ObjectMapper;

@ExtendWith(MockitoExtension.class)
class LeadAssignmentServiceTest {

    // Tuesday 10:00
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-14T10:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    @Mock
    private LeadAssignmentRepository assignmentRepository;
    @Mock
    private SalesRepresentativeRepository representativeRepository;
    @Mock
    private WaitQueueEntryRepository waitQueueRepository;
    @Mock
    private FollowUpTaskRepository followUpTaskRepository;
    @Mock
    private FollowUpScheduler followUpScheduler;
    @Mock
    private LeadContactResolver contactResolver;
    @Mock
    private LeadEventProducer leadEventProducer;

    @Captor
    private ArgumentCaptor<LeadLifecycleEvent> eventCaptor;
    @Captor
    private ArgumentCaptor<LeadAssignment> assignmentCaptor;

    private InMemoryQueueRuntime queueRuntime;
    private LeadAssignmentService service;
    private final AtomicLong ids = new AtomicLong(500);

    private final SalesRepresentative besa = SalesRepresentative.builder()
            .id(3L)
            .name("Besa Hoxha")
            .email("besa@autoani.com")
            .phone("+38349111222")
            .vehicleExpertise("SUV")
            .languages("sq,en")
            .conversionRate(new BigDecimal("28"))
            .build();

    @BeforeEach
    void setUp() {
        queueRuntime = new InMemoryQueueRuntime();
        service = new LeadAssignmentService(new AssignmentEngine(CLOCK), assignmentRepository,
                representativeRepository, waitQueueRepository, followUpTaskRepository, followUpScheduler,
                contactResolver, leadEventProducer, queueRuntime, new DealershipProperties(), new ObjectMapper(), CLOCK);
        ReflectionTestUtils.setField(service, "minConfidence", 30.0);

        lenient().when(assignmentRepository.save(any(LeadAssignment.class))).thenAnswer(invocation -> {
            LeadAssignment assignment = invocation.getArgument(0);
            if (assignment.getId() == null) {
                assignment.setId(ids.incrementAndGet());
            }
            return assignment;
        });
        lenient().when(contactResolver.resolve(any(), any()))
                .thenReturn(new LeadContact("Arben Krasniqi", "arben@example.com", "+38349123456", null));
    }

    @Test
    @DisplayName("A lead with an open assignment is not assigned again")
    void alreadyAssigned() {
        // given
        LeadAssignment open = LeadAssignment.builder().id(77L).customerId(42L).representativeId(3L)
                .status(AssignmentStatus.CONTACTED).build();
        when(assignmentRepository.findOpenAssignment(42L, null)).thenReturn(Optional.of(open));

        // when
        AssignmentResult result = service.assign(lead(Urgency.HIGH, 85.0));

        // then
        assertThat(result.outcome()).isEqualTo(Outcome.ALREADY_ASSIGNED);
        assertThat(result.assignmentId()).isEqualTo(77L);
        assertThat(result.assignedTo()).isEqualTo(3L);
        verify(assignmentRepository, never()).save(any());
        verifyNoInteractions(representativeRepository, leadEventProducer);
        assertThat(queueRuntime.jobs()).isEmpty();
    }

    @Test
    @DisplayName("Assigning a lead writes the assignment and queues notifications and the first reminder")
    void assignsBestRepresentative() {
        // given
        when(representativeRepository.findByActiveTrueAndAvailableTrue()).thenReturn(List.of(besa));

        // when
        AssignmentResult result = service.assign(lead(Urgency.HIGH, 85.0));

        // then
        assertThat(result.outcome()).isEqualTo(Outcome.ASSIGNED);
        assertThat(result.assignedTo()).isEqualTo(3L);
        assertThat(result.representativeName()).isEqualTo("Besa Hoxha");
        assertThat(result.escalationRequired()).isFalse();

        verify(assignmentRepository).save(assignmentCaptor.capture());
        LeadAssignment saved = assignmentCaptor.getValue();
        assertThat(saved.getStatus()).isEqualTo(AssignmentStatus.ACTIVE);
        assertThat(saved.getPriority()).isEqualTo(AssignmentPriority.HIGH);
        assertThat(saved.getAssignedAt()).isEqualTo(NOW);
        assertThat(saved.getDueAt()).isEqualTo(NOW.plusHours(1));
        assertThat(saved.getLeadScore()).isEqualTo(85.0);

        verify(representativeRepository).incrementWorkload(3L, NOW);
        verify(followUpScheduler).scheduleInitialContact(saved);

        List<RecordedJob> emails = queueRuntime.jobsOfType(JobType.SEND_SINGLE_EMAIL);
        assertThat(emails).extracting(job -> job.options().getDedupeKey())
                .containsExactly("assignment-notify:" + saved.getId(), "assignment-ack:" + saved.getId());
        assertThat(emails).allSatisfy(job -> {
            assertThat(job.options().getDedupePolicy()).isEqualTo(DedupePolicy.ONCE);
            assertThat(job.options().getPriority()).isEqualTo(2);
        });
        assertThat(emails.get(0).payloadAs(SendSingleEmailPayload.class).getTo()).isEqualTo("besa@autoani.com");
        assertThat(emails.get(1).payloadAs(SendSingleEmailPayload.class).getTo()).isEqualTo("arben@example.com");
        assertThat(emails.get(1).payloadAs(SendSingleEmailPayload.class).getContent()).contains("Besa Hoxha");

        verify(leadEventProducer).publish(eventCaptor.capture());
        assertThat(eventCaptor.getValue().getType()).isEqualTo(LeadEventType.ASSIGNED);
        assertThat(eventCaptor.getValue().getAssignmentId()).isEqualTo(saved.getId());
    }

    @Test
    @DisplayName("Without representatives the lead waits in the queue, reusing an existing entry")
    void queuesWhenNobodyAvailable() {
        // given
        when(representativeRepository.findByActiveTrueAndAvailableTrue()).thenReturn(List.of());
        when(waitQueueRepository.findWaitingForLead(42L, null)).thenReturn(List.of());
        when(waitQueueRepository.save(any(WaitQueueEntry.class))).thenAnswer(invocation -> {
            WaitQueueEntry entry = invocation.getArgument(0);
            entry.setId(900L);
            return entry;
        });

        // when
        AssignmentResult first = service.assign(lead(Urgency.URGENT, 70.0));

        // then
        assertThat(first.outcome()).isEqualTo(Outcome.QUEUED_FOR_LATER);
        assertThat(first.waitQueueEntryId()).isEqualTo(900L);
        assertThat(first.escalationRequired()).isTrue();
        verify(assignmentRepository, never()).save(any());

        verify(leadEventProducer).publish(eventCaptor.capture());
        assertThat(eventCaptor.getValue().getType()).isEqualTo(LeadEventType.QUEUED_FOR_LATER);
        assertThat(eventCaptor.getValue().getWaitQueueEntryId()).isEqualTo(900L);

        // a second attempt reuses the waiting entry
        WaitQueueEntry existing = WaitQueueEntry.builder().id(900L).customerId(42L).priority(Urgency.URGENT).build();
        when(waitQueueRepository.findWaitingForLead(42L, null)).thenReturn(List.of(existing));

        AssignmentResult second = service.assign(lead(Urgency.URGENT, 70.0));

        assertThat(second.waitQueueEntryId()).isEqualTo(900L);
        verify(waitQueueRepository, times(1)).save(any(WaitQueueEntry.class));
    }

    @Test
    @DisplayName("A low confidence match for an urgent lead is assigned and escalated")
    void lowConfidenceEscalates() {
        // given
        SalesRepresentative overloaded = SalesRepresentative.builder()
                .id(4L)
                .name("Leart Berisha")
                .email("leart@autoani.com")
                .currentActiveLeads(15)
                .build();
        when(representativeRepository.findByActiveTrueAndAvailableTrue()).thenReturn(List.of(overloaded));

        // when
        AssignmentResult result = service.assign(AssignLeadPayload.builder()
                .customerId(42L)
                .urgency(Urgency.URGENT)
                .build());

        // then
        assertThat(result.outcome()).isEqualTo(Outcome.ASSIGNED);
        assertThat(result.reason()).isEqualTo(LeadAssignmentService.LOW_CONFIDENCE_REASON);
        assertThat(result.escalationRequired()).isTrue();

        verify(leadEventProducer, times(2)).publish(eventCaptor.capture());
        assertThat(eventCaptor.getAllValues()).extracting(LeadLifecycleEvent::getType)
                .containsExactly(LeadEventType.ASSIGNED, LeadEventType.ESCALATION_REQUIRED);
    }

    @Test
    @DisplayName("A lead needs a customer or an inquiry")
    void rejectsAnonymousLead() {
        assertThatThrownBy(() -> service.assign(AssignLeadPayload.builder().urgency(Urgency.HIGH).build()))
                .isInstanceOf(InvalidJobPayloadException.class);
    }

    @Test
    @DisplayName("Closing an assignment cancels its reminders and frees the representative")
    void closingReleasesRepresentative() {
        LeadAssignment assignment = assignment(AssignmentStatus.CONTACTED);
        when(assignmentRepository.findById(500L)).thenReturn(Optional.of(assignment));

        service.updateStatus(500L, AssignmentStatus.CLOSED);

        verify(assignmentRepository).transition(assignment, AssignmentStatus.CLOSED, NOW);
        verify(followUpTaskRepository).cancelPending(500L, NOW);
        verify(representativeRepository).decrementWorkload(3L);
        verifyNoInteractions(followUpScheduler);
    }

    @Test
    @DisplayName("Entering FOLLOW_UP schedules the next reminder")
    void followUpSchedulesReminder() {
        LeadAssignment assignment = assignment(AssignmentStatus.CONTACTED);
        when(assignmentRepository.findById(500L)).thenReturn(Optional.of(assignment));

        service.updateStatus(500L, AssignmentStatus.FOLLOW_UP);

        verify(followUpScheduler).scheduleFollowUp(assignment);
        verify(representativeRepository, never()).decrementWorkload(anyLong());
    }

    @Test
    @DisplayName("Reassigning to a named representative closes the old assignment")
    void manualReassignment() {
        // given
        LeadAssignment current = assignment(AssignmentStatus.ACTIVE);
        SalesRepresentative target = SalesRepresentative.builder()
                .id(9L)
                .name("Driton Gashi")
                .email("driton@autoani.com")
                .build();
        when(assignmentRepository.findById(500L)).thenReturn(Optional.of(current));
        when(representativeRepository.findById(9L)).thenReturn(Optional.of(target));

        // when
        AssignmentResult result = service.reassign(500L, "customer request", 9L);

        // then
        verify(assignmentRepository).transition(current, AssignmentStatus.CLOSED, NOW);
        verify(representativeRepository).decrementWorkload(3L);
        assertThat(current.getReassignmentReason()).isEqualTo("customer request");

        assertThat(result.outcome()).isEqualTo(Outcome.ASSIGNED);
        assertThat(result.assignedTo()).isEqualTo(9L);
        assertThat(result.confidence()).isEqualTo(LeadAssignmentService.MANUAL_ASSIGNMENT_CONFIDENCE);
        assertThat(result.reason()).isEqualTo("Manual reassignment: customer request");

        verify(leadEventProducer, times(2)).publish(eventCaptor.capture());
        assertThat(eventCaptor.getAllValues()).extracting(LeadLifecycleEvent::getType)
                .containsExactly(LeadEventType.ASSIGNED, LeadEventType.REASSIGNED);
    }

    @Test
    @DisplayName("A closed assignment cannot be reassigned")
    void reassigningClosedAssignmentFails() {
        when(assignmentRepository.findById(500L)).thenReturn(Optional.of(assignment(AssignmentStatus.CLOSED)));

        assertThatThrownBy(() -> service.reassign(500L, "too slow", null))
                .isInstanceOf(IllegalStateTransitionException.class);
        verify(assignmentRepository, never()).save(any());
    }

    @Test
    @DisplayName("Priority follows urgency and lead score")
    void priorityRules() {
        assertThat(LeadAssignmentService.priorityOf(Urgency.URGENT, null)).isEqualTo(AssignmentPriority.HIGH);
        assertThat(LeadAssignmentService.priorityOf(Urgency.LOW, 81.0)).isEqualTo(AssignmentPriority.HIGH);
        assertThat(LeadAssignmentService.priorityOf(Urgency.HIGH, 50.0)).isEqualTo(AssignmentPriority.MEDIUM);
        assertThat(LeadAssignmentService.priorityOf(Urgency.LOW, 61.0)).isEqualTo(AssignmentPriority.MEDIUM);
        assertThat(LeadAssignmentService.priorityOf(Urgency.MEDIUM, 40.0)).isEqualTo(AssignmentPriority.LOW);
    }

    private static AssignLeadPayload lead(Urgency urgency, Double score) {
        return AssignLeadPayload.builder()
                .customerId(42L)
                .leadScore(score)
                .urgency(urgency)
                .vehicleType("SUV")
                .preferredLanguage("sq")
                .build();
    }

    private static LeadAssignment assignment(AssignmentStatus status) {
        return LeadAssignment.builder()
                .id(500L)
                .customerId(42L)
                .representativeId(3L)
                .status(status)
                .priority(AssignmentPriority.MEDIUM)
                .urgency(Urgency.HIGH)
                .leadScore(70.0)
                .assignedAt(NOW.minusHours(2))
                .build();
    }
}
