package com.clapgrow.push.common.provider;

/**
 * Provider error category for call-level push failures.
 * 
 * Lets callers decide what to do with a failed batch without inspecting
 * HTTP details:
 * - TEMPORARY: Backend or network trouble, the whole call may be retried later
 * - PERMANENT: Rejected request or malformed response, don't retry as-is
 * - AUTH: Invalid or revoked API key, alert admin
 * - CONFIG: Sender is not configured, alert admin
 * 
 * Example usage:
 * <pre>
 * try {
 *     pushSender.sendWithRetry(message, 5);
 * } catch (PushSendException e) {
 *     if (e.getCategory() == ProviderErrorCategory.TEMPORARY) {
 *         // Re-queue the whole message
 *     }
 * }
 * </pre>
 */
public enum ProviderErrorCategory {
    /**
     * Temporary errors that may resolve: 5xx, 429, timeouts, connection resets.
     */
    TEMPORARY,
    
    /**
     * Permanent errors that won't resolve: invalid request, undecodable response.
     */
    PERMANENT,
    
    /**
     * Authentication/authorization errors: invalid API key, sender not allowed.
     */
    AUTH,
    
    /**
     * Configuration errors: missing API key or endpoint.
     */
    CONFIG
}
