package com.clapgrow.push.worker.config;

import com.clapgrow.push.common.provider.BackendLimits;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for the GCM/FCM multicast endpoint.
 * 
 * Maps to:
 * push:
 *   gcm:
 *     api-key: ${GCM_API_KEY:}
 *     endpoint: https://fcm.googleapis.com/fcm/send
 *     max-registration-ids: 1000
 */
@Configuration
@ConfigurationProperties(prefix = "push.gcm")
@Data
public class GcmProperties {

    /**
     * Server API key sent as "Authorization: key=...". Required.
     */
    private String apiKey;

    /**
     * Multicast send endpoint.
     */
    private String endpoint = "https://fcm.googleapis.com/fcm/send";

    /**
     * Maximum recipients per call. Legacy GCM allowed 1000, newer variants 500.
     */
    private int maxRegistrationIds = BackendLimits.DEFAULT_MAX_REGISTRATION_IDS;

    /**
     * Upper bound for time_to_live in seconds. Default: 4 weeks
     */
    private int maxTimeToLiveSeconds = BackendLimits.DEFAULT_MAX_TIME_TO_LIVE_SECONDS;

    /**
     * Timeout for one backend call.
     */
    private Duration requestTimeout = Duration.ofSeconds(30);

    /**
     * Maximum response body buffered by the WebClient, in bytes.
     */
    private int maxInMemorySize = 10 * 1024 * 1024;

    public BackendLimits toLimits() {
        return new BackendLimits(maxRegistrationIds, maxTimeToLiveSeconds);
    }
}
