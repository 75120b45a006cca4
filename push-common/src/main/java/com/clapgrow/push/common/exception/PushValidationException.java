package com.clapgrow.push.common.exception;

import com.clapgrow.push.common.provider.ProviderErrorCategory;

/**
 * Exception thrown when a push request is malformed (no recipients, too many
 * recipients, bad time-to-live, negative retry count). Raised before any
 * transport call.
 */
public class PushValidationException extends PushSendException {

    public PushValidationException(String message) {
        super(message, ProviderErrorCategory.PERMANENT);
    }
}
