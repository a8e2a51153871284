package com.aigreentick.services.dealership.config;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;

/**
 * Single time source for scoring windows, queue scheduling and working hours.
 */
@Configuration
@Slf4j
public class ClockConfig {

    @Value("${dealership.time-zone:Europe/Belgrade}")
    private String timeZone;

    @Bean
    public Clock clock() {
        log.info("Using dealership time zone {}", timeZone);
        return Clock.system(ZoneId.of(timeZone));
    }
}
