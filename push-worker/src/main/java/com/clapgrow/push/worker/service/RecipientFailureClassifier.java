package com.clapgrow.push.worker.service;

import com.clapgrow.push.common.model.RecipientResult;
import com.clapgrow.push.common.retry.FailureClassification;
import org.springframework.stereotype.Service;

/**
 * Classifies per-recipient outcomes to decide which recipients are resent.
 * 
 * Only a failure whose code is the backend's transient-unavailability code
 * is retryable. Successes, other error codes and unrecognized codes are not.
 */
@Service
public class RecipientFailureClassifier {

    /**
     * Classify one recipient outcome.
     * 
     * @param result Recipient outcome (may be null)
     * @return Failure classification, or null if the recipient succeeded
     */
    public FailureClassification classify(RecipientResult result) {
        if (result == null) {
            return FailureClassification.PERMANENT;
        }
        if (result.isSuccess()) {
            return null;
        }
        if (result.error() == null) {
            // No message id and no error code: nothing says the backend was unavailable
            return FailureClassification.PERMANENT;
        }
        return result.error().classification();
    }

    public boolean isRetryable(RecipientResult result) {
        return classify(result) == FailureClassification.TRANSIENT;
    }
}
