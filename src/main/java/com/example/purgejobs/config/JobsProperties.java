package com.example.purgejobs.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for invalidation jobs.
 * These values are bound from application.yml (jobs.*).
 * The store-held parameters (maxRevalDurationDays, use_reval_pending) take precedence where
 * present; the values below are the fallbacks.
 */
@Component
@ConfigurationProperties(prefix = "jobs")
@Data
public class JobsProperties {

    private int defaultRecencyWindowDays = 90;
    private int maxStartLeadDays = 2;
    private String actingUserHeader = "X-Auth-User";
}
