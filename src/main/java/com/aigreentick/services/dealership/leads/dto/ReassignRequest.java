package com.aigreentick.services.dealership.leads.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ReassignRequest {

    @NotBlank(message = "reason is required")
    @Size(max = 500)
    private String reason;

    // null lets the engine pick the representative
    private Long representativeId;
}
