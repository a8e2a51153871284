package com.aigreentick.services.dealership.leads.dto;

import java.util.List;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

@Data
public class BatchScoreRequest {

    @NotEmpty(message = "customerIds must not be empty")
    private List<Long> customerIds;

    private boolean forceRecalculation;

    private String reason;
}
