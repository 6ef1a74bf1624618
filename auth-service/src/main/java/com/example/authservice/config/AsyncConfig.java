package com.example.authservice.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables @Async (audit logging) and @Scheduled (expired refresh record cleanup).
 */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {
}
