package com.clapgrow.push.common.retry;

/**
 * Classification of per-recipient delivery failures.
 * 
 * - TRANSIENT: Backend was temporarily unavailable for this recipient, resend in a later round
 * - PERMANENT: Anything else (bad token, sender mismatch, oversized payload), never resent
 */
public enum FailureClassification {
    TRANSIENT,   // Resend after backoff
    PERMANENT    // Keep the failure in the final result
}
