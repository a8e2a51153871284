package com.aigreentick.services.dealership.campaigns.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TwilioMessageResponse {

    private String sid;

    private String status;

    // negative decimal string, e.g. "-0.0075"; null until the message is priced
    private String price;

    @JsonProperty("num_segments")
    private String numSegments;

    @JsonProperty("error_message")
    private String errorMessage;
}
