package com.aigreentick.services.dealership.campaigns.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResendEmailResponse {
    private String id;
}
