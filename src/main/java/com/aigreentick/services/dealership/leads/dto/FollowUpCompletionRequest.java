package com.aigreentick.services.dealership.leads.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class FollowUpCompletionRequest {

    @Size(max = 1000)
    private String notes;
}
