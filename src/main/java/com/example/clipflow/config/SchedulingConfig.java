package com.example.clipflow.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Periodic jobs (queue polling, result polling, reaper, settings refresh, idle sweep).
 * Tests switch this off and drive the jobs directly.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "clipflow.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
