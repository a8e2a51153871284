package com.aigreentick.services.dealership.leads.dto;

import com.aigreentick.services.dealership.leads.enums.AssignmentStatus;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class AssignmentStatusRequest {

    @NotNull(message = "status is required")
    private AssignmentStatus status;
}
