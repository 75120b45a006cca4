package com.clapgrow.push.common.provider;

/**
 * Request limits enforced by a push backend.
 * 
 * Backends disagree on these (500 vs 1000 registration ids per multicast),
 * so each {@link PushTransport} reports its own.
 *
 * @param maxRegistrationIds maximum number of recipients in one batch
 * @param maxTimeToLiveSeconds upper bound for a message's time_to_live
 */
public record BackendLimits(int maxRegistrationIds, int maxTimeToLiveSeconds) {

    public static final int DEFAULT_MAX_REGISTRATION_IDS = 1000;
    public static final int DEFAULT_MAX_TIME_TO_LIVE_SECONDS = 2_419_200; // 4 weeks

    public BackendLimits {
        if (maxRegistrationIds < 1) {
            throw new IllegalArgumentException("maxRegistrationIds must be at least 1");
        }
        if (maxTimeToLiveSeconds < 0) {
            throw new IllegalArgumentException("maxTimeToLiveSeconds must not be negative");
        }
    }

    public static BackendLimits defaults() {
        return new BackendLimits(DEFAULT_MAX_REGISTRATION_IDS, DEFAULT_MAX_TIME_TO_LIVE_SECONDS);
    }
}
