package com.aigreentick.services.dealership.leads.dto;

import java.util.Map;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class EngagementEventRequest {

    private Long customerId;

    @Email
    private String email;

    private String phone;

    @NotBlank(message = "action is required")
    private String action;

    @NotNull(message = "points is required")
    private Integer points;

    private Map<String, Object> metadata;
}
