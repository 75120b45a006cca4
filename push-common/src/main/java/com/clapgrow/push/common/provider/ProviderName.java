package com.clapgrow.push.common.provider;

/**
 * Push provider name enumeration.
 * 
 * Identifies the backend a {@link PushTransport} talks to.
 */
public enum ProviderName {
    /**
     * Firebase Cloud Messaging legacy HTTP API (GCM-compatible multicast)
     */
    FCM_LEGACY,
    
    /**
     * Google Cloud Messaging (pre-Firebase endpoint)
     */
    GCM;
    
    /**
     * Lowercase name for configuration and logging (e.g., "fcm_legacy").
     */
    public String toConfigValue() {
        return name().toLowerCase();
    }
}
