package com.flagship.escrow_engine.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Background jobs (outbox relay, timeout sweeper, idempotency cleanup, metrics refresh)
 * and the retry proxies the sweeper's engine calls go through.
 */
@Configuration
@EnableScheduling
@EnableRetry
public class SchedulingConfig {
}
