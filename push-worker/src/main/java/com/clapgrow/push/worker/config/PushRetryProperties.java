package com.clapgrow.push.worker.config;

import com.clapgrow.push.common.retry.BackoffPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for per-recipient retries.
 * 
 * Maps to:
 * push:
 *   retry:
 *     max-retries: 5
 *     initial-delay-ms: 1000
 *     max-delay-ms: 1024000
 *     jitter-percent: 50
 */
@Configuration
@ConfigurationProperties(prefix = "push.retry")
@Data
public class PushRetryProperties {

    /**
     * Retry rounds used for messages consumed from Kafka.
     */
    private int maxRetries = 5;

    private long initialDelayMs = BackoffPolicy.DEFAULT_INITIAL_DELAY_MS;

    private long maxDelayMs = BackoffPolicy.DEFAULT_MAX_DELAY_MS;

    private int jitterPercent = BackoffPolicy.DEFAULT_JITTER_PERCENT;

    public BackoffPolicy toBackoffPolicy() {
        return new BackoffPolicy(initialDelayMs, maxDelayMs, jitterPercent);
    }
}
