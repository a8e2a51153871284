package com.aigreentick.services.dealership;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LeadPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeadPipelineApplication.class, args);
    }
}
