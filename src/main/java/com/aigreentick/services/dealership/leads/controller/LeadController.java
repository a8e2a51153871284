package com.aigreentick.services.dealership.leads.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.aigreentick.services.dealership.common.dto.ResponseMessage;
import com.aigreentick.services.dealership.common.exception.InvalidJobPayloadException;
import com.aigreentick.services.dealership.leads.dto.AssignmentResult;
import com.aigreentick.services.dealership.leads.dto.AssignmentStatusRequest;
import com.aigreentick.services.dealership.leads.dto.BatchScoreRequest;
import com.aigreentick.services.dealership.leads.dto.CalculateLeadScorePayload;
import com.aigreentick.services.dealership.leads.dto.CustomerValuePrediction;
import com.aigreentick.services.dealership.leads.dto.EngagementEventRequest;
import com.aigreentick.services.dealership.leads.dto.FollowUpCompletionRequest;
import com.aigreentick.services.dealership.leads.dto.ReassignRequest;
import com.aigreentick.services.dealership.leads.dto.UpdateLeadScorePayload;
import com.aigreentick.services.dealership.leads.model.LeadAssignment;
import com.aigreentick.services.dealership.leads.model.LeadScore;
import com.aigreentick.services.dealership.leads.service.impl.FollowUpScheduler;
import com.aigreentick.services.dealership.leads.service.impl.LeadAssignmentService;
import com.aigreentick.services.dealership.leads.service.impl.LeadScoringService;
import com.aigreentick.services.dealership.leads.service.impl.ScoringEngine;
import com.aigreentick.services.dealership.queue.dto.EnqueuedJob;
import com.aigreentick.services.dealership.queue.dto.JobOptions;
import com.aigreentick.services.dealership.queue.enums.JobType;
import com.aigreentick.services.dealership.queue.service.QueueRuntime;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Lead scoring, engagement events and assignment management.
 * Scoring requests are queued; the response carries the job handle.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/leads")
@RequiredArgsConstructor
public class LeadController {

    private final QueueRuntime queueRuntime;
    private final LeadScoringService leadScoringService;
    private final ScoringEngine scoringEngine;
    private final LeadAssignmentService leadAssignmentService;
    private final FollowUpScheduler followUpScheduler;

    @PostMapping("/inquiries/{inquiryId}/score")
    public ResponseEntity<ResponseMessage<EnqueuedJob>> scoreInquiry(
            @PathVariable Long inquiryId,
            @RequestParam(required = false) String reason) {
        EnqueuedJob job = queueRuntime.enqueue(JobType.CALCULATE_LEAD_SCORE,
                CalculateLeadScorePayload.builder().inquiryId(inquiryId).reason(reason).build(),
                JobOptions.withPriority(2));
        log.info("Inquiry scoring requested. inquiryId={} jobId={}", inquiryId, job.jobId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ResponseMessage.success("Scoring queued", job));
    }

    @PostMapping("/customers/{customerId}/score")
    public ResponseEntity<ResponseMessage<EnqueuedJob>> scoreCustomer(
            @PathVariable Long customerId,
            @RequestParam(required = false) String reason) {
        EnqueuedJob job = queueRuntime.enqueue(JobType.CALCULATE_LEAD_SCORE,
                CalculateLeadScorePayload.builder().customerId(customerId).reason(reason).build());
        log.info("Customer scoring requested. customerId={} jobId={}", customerId, job.jobId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ResponseMessage.success("Scoring queued", job));
    }

    @PostMapping("/customers/score-batch")
    public ResponseEntity<ResponseMessage<EnqueuedJob>> scoreBatch(@Valid @RequestBody BatchScoreRequest request) {
        EnqueuedJob job = queueRuntime.enqueue(JobType.CALCULATE_LEAD_SCORE,
                CalculateLeadScorePayload.builder()
                        .batchCustomerIds(request.getCustomerIds())
                        .forceRecalculation(request.isForceRecalculation())
                        .reason(request.getReason())
                        .build(),
                JobOptions.withPriority(5));
        log.info("Batch scoring requested. customers={} jobId={}", request.getCustomerIds().size(), job.jobId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ResponseMessage.success("Batch scoring queued", job));
    }

    @GetMapping("/customers/{customerId}/scores")
    public ResponseEntity<ResponseMessage<List<LeadScore>>> scoreHistory(@PathVariable Long customerId) {
        return ResponseEntity.ok(ResponseMessage.success("Score history", leadScoringService.history(customerId)));
    }

    @GetMapping("/customers/{customerId}/lifetime-value")
    public ResponseEntity<ResponseMessage<CustomerValuePrediction>> lifetimeValue(@PathVariable Long customerId) {
        return ResponseEntity.ok(ResponseMessage.success("Lifetime value prediction",
                scoringEngine.predictLifetimeValue(customerId)));
    }

    /**
     * Engagement action (email click, site visit, ...) worth a number of score points.
     */
    @PostMapping("/events")
    public ResponseEntity<ResponseMessage<EnqueuedJob>> recordEngagement(@Valid @RequestBody EngagementEventRequest request) {
        if (request.getCustomerId() == null && isBlank(request.getEmail()) && isBlank(request.getPhone())) {
            throw new InvalidJobPayloadException("customerId, email or phone is required");
        }
        EnqueuedJob job = queueRuntime.enqueue(JobType.UPDATE_LEAD_SCORE,
                UpdateLeadScorePayload.builder()
                        .customerId(request.getCustomerId())
                        .email(request.getEmail())
                        .phone(request.getPhone())
                        .action(request.getAction())
                        .points(request.getPoints())
                        .metadata(request.getMetadata())
                        .build());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ResponseMessage.success("Engagement recorded", job));
    }

    @PatchMapping("/assignments/{assignmentId}/status")
    public ResponseEntity<ResponseMessage<LeadAssignment>> updateAssignmentStatus(
            @PathVariable Long assignmentId,
            @Valid @RequestBody AssignmentStatusRequest request) {
        LeadAssignment updated = leadAssignmentService.updateStatus(assignmentId, request.getStatus());
        return ResponseEntity.ok(ResponseMessage.success("Assignment updated", updated));
    }

    @PostMapping("/assignments/{assignmentId}/reassign")
    public ResponseEntity<ResponseMessage<AssignmentResult>> reassign(
            @PathVariable Long assignmentId,
            @Valid @RequestBody ReassignRequest request) {
        AssignmentResult result = leadAssignmentService.reassign(assignmentId, request.getReason(), request.getRepresentativeId());
        return ResponseEntity.ok(ResponseMessage.success("Lead reassigned", result));
    }

    @PostMapping("/follow-ups/{taskId}/complete")
    public ResponseEntity<ResponseMessage<Void>> completeFollowUp(
            @PathVariable Long taskId,
            @Valid @RequestBody(required = false) FollowUpCompletionRequest request) {
        followUpScheduler.completeTask(taskId, request == null ? null : request.getNotes());
        return ResponseEntity.ok(ResponseMessage.success("Follow-up completed", null));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
