package com.aigreentick.services.dealership.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Dealership identity used in outgoing messages and personalization tokens.
 */
@Data
@Component
@ConfigurationProperties(prefix = "dealership")
public class DealershipProperties {

    private String name = "AUTO ANI";

    private String companyName = "AUTO ANI Sh.p.k.";

    private String phone = "+383 49 204 242";

    private String email = "aniautosallon@gmail.com";

    private String siteUrl = "https://autoani.com";

    /**
     * Zone of the {@link java.time.Clock} bean; working hours and timing scores use it.
     */
    private String timeZone = "Europe/Belgrade";

    /**
     * Appended to marketing SMS through the {{stopText}} token.
     */
    private String stopText = "Reply STOP to unsubscribe";
}
