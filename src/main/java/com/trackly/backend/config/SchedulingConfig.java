package com.trackly.backend.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the background learning loop unless
 * {@code learning.scheduler.enabled=false}, e.g. for a read-only replica
 * that serves predictions from a shared Redis store.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "learning.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
