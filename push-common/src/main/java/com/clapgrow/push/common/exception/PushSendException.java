package com.clapgrow.push.common.exception;

import com.clapgrow.push.common.provider.ProviderErrorCategory;

/**
 * Call-level failure of a push send.
 * 
 * Per-recipient failures are never reported this way; they are data in the
 * returned {@code MulticastResult}. This exception means the whole call was
 * aborted and no aggregated result exists.
 */
public class PushSendException extends RuntimeException {

    private final ProviderErrorCategory category;

    public PushSendException(String message, ProviderErrorCategory category) {
        super(message);
        this.category = category;
    }

    public PushSendException(String message, ProviderErrorCategory category, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ProviderErrorCategory getCategory() {
        return category;
    }
}
