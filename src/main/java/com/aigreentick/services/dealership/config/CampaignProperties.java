package com.aigreentick.services.dealership.config;

import java.time.Duration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.aigreentick.services.dealership.campaigns.enums.Channel;

/**
 * Batch throttling of campaign dispatch, per channel.
 */
@Data
@Component
@ConfigurationProperties(prefix = "campaign")
public class CampaignProperties {

    private Throttle email = new Throttle(100, Duration.ofSeconds(10), Duration.ZERO, Duration.ofSeconds(5));

    private Throttle sms = new Throttle(50, Duration.ofSeconds(60), Duration.ofSeconds(1), Duration.ofSeconds(3));

    /**
     * Queue priority of individual sends queued by a batch.
     */
    private int sendPriority = 2;

    public Throttle forChannel(Channel channel) {
        return channel == Channel.EMAIL ? email : sms;
    }

    @Data
    public static class Throttle {

        private int batchSize;

        // delay before the next batch of the same campaign
        private Duration batchDelay;

        private Duration jitterMin;

        private Duration jitterMax;

        public Throttle() {
        }

        public Throttle(int batchSize, Duration batchDelay, Duration jitterMin, Duration jitterMax) {
            this.batchSize = batchSize;
            this.batchDelay = batchDelay;
            this.jitterMin = jitterMin;
            this.jitterMax = jitterMax;
        }
    }
}
