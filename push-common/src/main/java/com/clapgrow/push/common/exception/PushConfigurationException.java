package com.clapgrow.push.common.exception;

import com.clapgrow.push.common.provider.ProviderErrorCategory;

/**
 * Exception thrown when the sender is missing credentials or transport
 * configuration. Raised before any network activity.
 */
public class PushConfigurationException extends PushSendException {

    public PushConfigurationException(String message) {
        super(message, ProviderErrorCategory.CONFIG);
    }
}
