package com.clapgrow.push.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one recipient in a multicast call.
 * 
 * A success carries the backend's message id and, if the device token has
 * been replaced, the canonical registration id the caller should use from now
 * on. A failure carries an error code.
 *
 * @param messageId backend message id, null on failure
 * @param registrationId canonical replacement id, usually null
 * @param error failure code, null on success
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecipientResult(
    @JsonProperty("message_id") String messageId,
    @JsonProperty("registration_id") String registrationId,
    @JsonProperty("error") BackendErrorCode error
) {

    public static RecipientResult success(String messageId) {
        return new RecipientResult(messageId, null, null);
    }

    public static RecipientResult success(String messageId, String canonicalRegistrationId) {
        return new RecipientResult(messageId, canonicalRegistrationId, null);
    }

    public static RecipientResult failure(BackendErrorCode error) {
        return new RecipientResult(null, null, error);
    }

    /**
     * Stand-in for a recipient whose outcome was never reported.
     */
    public static RecipientResult unknownFailure() {
        return failure(BackendErrorCode.UNKNOWN);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null && messageId != null && !messageId.isBlank();
    }

    @JsonIgnore
    public boolean hasCanonicalId() {
        return isSuccess() && registrationId != null && !registrationId.isBlank();
    }
}
