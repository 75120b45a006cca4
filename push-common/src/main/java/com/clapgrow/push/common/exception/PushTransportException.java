package com.clapgrow.push.common.exception;

import com.clapgrow.push.common.provider.ProviderErrorCategory;

/**
 * Exception thrown when a batch call failed as a whole: network error,
 * non-200 status, or a response that could not be decoded.
 * 
 * Example usage:
 * <pre>
 * catch (PushTransportException e) {
 *     log.error("Push call failed (HTTP {}), retry after {}s",
 *         e.getStatusCode(), e.getRetryAfterSeconds());
 * }
 * </pre>
 */
public class PushTransportException extends PushSendException {

    private final Integer statusCode;
    private final Integer retryAfterSeconds;

    public PushTransportException(String message, ProviderErrorCategory category, Throwable cause) {
        super(message, category, cause);
        this.statusCode = null;
        this.retryAfterSeconds = null;
    }

    public PushTransportException(String message, ProviderErrorCategory category,
                                  Integer statusCode, Integer retryAfterSeconds) {
        super(message, category);
        this.statusCode = statusCode;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    /**
     * HTTP status of the failed call, or null if no response was received.
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    /**
     * Seconds the backend asked us to wait (Retry-After header), or null.
     */
    public Integer getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    @Override
    public String toString() {
        return String.format("%s: %s (status=%s, retryAfter=%s)",
            getClass().getSimpleName(), getMessage(), statusCode, retryAfterSeconds);
    }
}
