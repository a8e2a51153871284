package com.aigreentick.services.dealership.leads.dto;

import com.aigreentick.services.dealership.leads.enums.FollowUpType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FollowUpReminderPayload {
    private Long assignmentId;
    private FollowUpType type;
}
