package com.clapgrow.push.worker.service;

import com.clapgrow.push.common.model.BackendErrorCode;
import com.clapgrow.push.common.model.RecipientResult;
import com.clapgrow.push.common.retry.FailureClassification;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RecipientFailureClassifierTest {

    private final RecipientFailureClassifier classifier = new RecipientFailureClassifier();

    @Test
    void testIsRetryable_Unavailable_ReturnsTrue() {
        assertTrue(classifier.isRetryable(RecipientResult.failure(BackendErrorCode.UNAVAILABLE)));
        assertEquals(FailureClassification.TRANSIENT,
            classifier.classify(RecipientResult.failure(BackendErrorCode.UNAVAILABLE)));
    }

    @Test
    void testIsRetryable_OtherErrors_ReturnsFalse() {
        for (BackendErrorCode code : BackendErrorCode.values()) {
            if (code != BackendErrorCode.UNAVAILABLE) {
                assertFalse(classifier.isRetryable(RecipientResult.failure(code)), code.name());
            }
        }
    }

    @Test
    void testIsRetryable_UnrecognizedWireValue_ReturnsFalse() {
        RecipientResult result = RecipientResult.failure(BackendErrorCode.fromWireValue("QuotaMeltdown"));

        assertFalse(classifier.isRetryable(result));
    }

    @Test
    void testClassify_Success_ReturnsNull() {
        assertNull(classifier.classify(RecipientResult.success("m-1")));
        assertFalse(classifier.isRetryable(RecipientResult.success("m-1", "canonical")));
    }

    @Test
    void testClassify_NullOrEmptyResult_IsPermanent() {
        assertEquals(FailureClassification.PERMANENT, classifier.classify(null));
        assertEquals(FailureClassification.PERMANENT, classifier.classify(new RecipientResult(null, null, null)));
        assertFalse(classifier.isRetryable(null));
    }
}
