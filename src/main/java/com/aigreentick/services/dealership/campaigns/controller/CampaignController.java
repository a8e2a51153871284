package com.aigreentick.services.dealership.campaigns.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.aigreentick.services.dealership.campaigns.dto.CampaignProgress;
import com.aigreentick.services.dealership.campaigns.service.impl.CampaignDispatcher;
import com.aigreentick.services.dealership.common.dto.ResponseMessage;
import com.aigreentick.services.dealership.queue.dto.EnqueuedJob;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Campaign start, cancellation and progress.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/campaigns")
@RequiredArgsConstructor
public class CampaignController {

    private final CampaignDispatcher campaignDispatcher;

    @PostMapping("/{campaignId}/start")
    public ResponseEntity<ResponseMessage<EnqueuedJob>> start(@PathVariable Long campaignId) {
        EnqueuedJob job = campaignDispatcher.startCampaign(campaignId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ResponseMessage.success("Campaign queued", job));
    }

    /**
     * Marks the campaign FAILED. Sends already queued are still delivered.
     */
    @PostMapping("/{campaignId}/cancel")
    public ResponseEntity<ResponseMessage<CampaignProgress>> cancel(@PathVariable Long campaignId) {
        log.info("Campaign cancel requested. campaignId={}", campaignId);
        return ResponseEntity.ok(ResponseMessage.success("Campaign cancelled", campaignDispatcher.cancelCampaign(campaignId)));
    }

    @GetMapping("/{campaignId}")
    public ResponseEntity<ResponseMessage<CampaignProgress>> progress(@PathVariable Long campaignId) {
        return ResponseEntity.ok(ResponseMessage.success("Campaign progress", campaignDispatcher.progress(campaignId)));
    }
}
