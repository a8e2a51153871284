package com.aigreentick.services.dealership.campaigns.service.impl;

import java.util.List;

import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.campaigns.enums.Channel;
import com.aigreentick.services.dealership.campaigns.model.Campaign;
import com.aigreentick.services.dealership.campaigns.repository.AudienceRepository;
import com.aigreentick.services.dealership.leads.model.Customer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the ordered recipient list of a campaign: segment members, else the custom
 * audience, else every active customer who consented to the channel.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecipientResolver {

    private final AudienceRepository audienceRepository;

    public List<Customer> resolve(Campaign campaign) {
        Channel channel = campaign.getChannel();

        if (campaign.getSegmentId() != null) {
            return channel == Channel.EMAIL
                    ? audienceRepository.findEmailSegmentAudience(campaign.getSegmentId())
                    : audienceRepository.findSmsSegmentAudience(campaign.getSegmentId());
        }

        if (campaign.hasCustomAudience()) {
            // rule-based targeting is not supported; never widen to all customers
            log.warn("Custom audience targeting is not supported, campaign has no recipients. campaignId={} rule={}",
                    campaign.getId(), campaign.getCustomAudience());
            return List.of();
        }

        return channel == Channel.EMAIL
                ? audienceRepository.findEmailAudience()
                : audienceRepository.findSmsAudience();
    }

    /**
     * Address the channel delivers to.
     */
    public static String addressOf(Customer customer, Channel channel) {
        return channel == Channel.EMAIL ? customer.getEmail() : customer.getPhone();
    }
}
