package com.clapgrow.push.common.model;

import com.clapgrow.push.common.retry.FailureClassification;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-recipient error codes returned by the push backend.
 * 
 * Wire values are the strings found in the {@code error} field of a
 * multicast result entry. Anything the backend sends that is not listed
 * here maps to {@link #UNKNOWN}.
 */
public enum BackendErrorCode {
    MISSING_REGISTRATION("MissingRegistration"),
    INVALID_REGISTRATION("InvalidRegistration"),
    MISMATCH_SENDER_ID("MismatchSenderId"),
    NOT_REGISTERED("NotRegistered"),
    MESSAGE_TOO_BIG("MessageTooBig"),
    INVALID_DATA_KEY("InvalidDataKey"),
    INVALID_TTL("InvalidTtl"),
    UNAVAILABLE("Unavailable"),
    INTERNAL_SERVER_ERROR("InternalServerError"),
    INVALID_PACKAGE_NAME("InvalidPackageName"),
    DEVICE_MESSAGE_RATE_EXCEEDED("DeviceMessageRateExceeded"),
    TOPICS_MESSAGE_RATE_EXCEEDED("TopicsMessageRateExceeded"),
    UNKNOWN("UnknownError");

    private final String wireValue;

    BackendErrorCode(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Whether a recipient failing with this code may be resent in a later round.
     * Only the backend's transient-unavailability code qualifies.
     */
    public FailureClassification classification() {
        return switch (this) {
            case UNAVAILABLE -> FailureClassification.TRANSIENT;
            case MISSING_REGISTRATION, INVALID_REGISTRATION, MISMATCH_SENDER_ID, NOT_REGISTERED,
                 MESSAGE_TOO_BIG, INVALID_DATA_KEY, INVALID_TTL, INTERNAL_SERVER_ERROR,
                 INVALID_PACKAGE_NAME, DEVICE_MESSAGE_RATE_EXCEEDED, TOPICS_MESSAGE_RATE_EXCEEDED,
                 UNKNOWN -> FailureClassification.PERMANENT;
        };
    }

    /**
     * Map a wire value to a code. Never throws.
     * 
     * @param value error string from the backend, may be null
     * @return matching code, null for a null or blank value, {@link #UNKNOWN} otherwise
     */
    @JsonCreator
    public static BackendErrorCode fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (BackendErrorCode code : values()) {
            if (code.wireValue.equals(value)) {
                return code;
            }
        }
        return UNKNOWN;
    }
}
