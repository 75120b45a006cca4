package com.clapgrow.push.worker.service;

import com.clapgrow.push.common.exception.PushConfigurationException;
import com.clapgrow.push.common.exception.PushSendException;
import com.clapgrow.push.common.exception.PushTransportException;
import com.clapgrow.push.common.exception.PushValidationException;
import com.clapgrow.push.common.model.MulticastResult;
import com.clapgrow.push.common.model.PushMessage;
import com.clapgrow.push.common.model.RecipientResult;
import com.clapgrow.push.common.provider.BackendLimits;
import com.clapgrow.push.common.provider.ProviderErrorCategory;
import com.clapgrow.push.common.provider.PushTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sends push messages to many recipients, resending only to recipients the
 * backend reported as temporarily unavailable.
 *
 * The caller's {@link PushMessage} is never modified. Retry rounds work on
 * a private copy of the recipient list and the final result is realigned
 * with the message's original recipient order. Registration ids must be
 * unique within a message.
 *
 * Calls block on the caller's thread, including backoff sleeps between
 * rounds, and may take several seconds when retries are needed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PushSender {

    private final PushTransport transport;
    private final RecipientFailureClassifier failureClassifier;
    private final BackoffScheduler backoffScheduler;

    /**
     * Send the message once, without retrying unavailable recipients.
     *
     * @param message Message to send
     * @return Backend response, aligned with the message's recipients
     * @throws PushConfigurationException if the transport is not configured
     * @throws PushValidationException if the message is malformed
     * @throws PushTransportException if the call failed as a whole
     */
    public MulticastResult sendOnce(PushMessage message) {
        checkTransport();
        checkMessage(message);
        return transport.send(message, message.getRegistrationIds());
    }

    /**
     * Send the message, retrying recipients that failed with a transient
     * error up to {@code maxRetries} more times with exponential backoff.
     *
     * @param message Message to send
     * @param maxRetries Retry rounds after the first send, 0 for none
     * @return Outcome of every recipient in the message's original order
     * @throws PushConfigurationException if the transport is not configured
     * @throws PushValidationException if the message is malformed or maxRetries is negative
     * @throws PushTransportException if any call failed as a whole
     */
    public MulticastResult sendWithRetry(PushMessage message, int maxRetries) {
        if (maxRetries < 0) {
            throw new PushValidationException("maxRetries must not be negative, got " + maxRetries);
        }

        MulticastResult response = sendOnce(message);
        if (response.failure() == 0 || maxRetries == 0) {
            return response;
        }

        List<String> originalIds = List.copyOf(message.getRegistrationIds());
        Map<String, RecipientResult> ledger = new HashMap<>(originalIds.size() * 2);
        BackoffScheduler.Backoff backoff = backoffScheduler.start();

        List<String> pending = recordRound(originalIds, response, ledger);
        for (int retry = 0; !pending.isEmpty() && retry < maxRetries; retry++) {
            log.info("Retrying {} unavailable recipient(s) (attempt {}/{})",
                pending.size(), retry + 1, maxRetries);
            pauseBeforeRetry(backoff);
            try {
                response = transport.send(message, pending);
            } catch (PushTransportException e) {
                log.error("Retry attempt {}/{} failed for {} recipient(s): {}",
                    retry + 1, maxRetries, pending.size(), e.getMessage());
                throw e;
            }
            pending = recordRound(pending, response, ledger);
        }

        if (!pending.isEmpty()) {
            log.warn("Giving up on {} recipient(s) still unavailable after {} retries",
                pending.size(), maxRetries);
        }

        List<RecipientResult> finalResults = new ArrayList<>(originalIds.size());
        for (String registrationId : originalIds) {
            RecipientResult result = ledger.get(registrationId);
            finalResults.add(result != null ? result : RecipientResult.unknownFailure());
        }
        MulticastResult aggregated = MulticastResult.of(response.multicastId(), finalResults);
        log.info("Push multicast {} via {} finished: success={}, failure={}, canonicalIds={}",
            aggregated.multicastId(), transport.getProviderName().toConfigValue(),
            aggregated.success(), aggregated.failure(), aggregated.canonicalIds());
        return aggregated;
    }

    /**
     * Record one round's outcomes, matched by position to the ids sent in that round.
     *
     * @return ids to send again in the next round
     */
    private List<String> recordRound(List<String> sentIds, MulticastResult response,
                                     Map<String, RecipientResult> ledger) {
        List<RecipientResult> results = response.results();
        if (results.size() != sentIds.size()) {
            log.warn("Backend returned {} result(s) for {} recipient(s) in multicast {}",
                results.size(), sentIds.size(), response.multicastId());
        }

        List<String> retryable = new ArrayList<>();
        for (int i = 0; i < sentIds.size(); i++) {
            String registrationId = sentIds.get(i);
            // Recipients without a reported outcome are failed rather than dropped
            RecipientResult result = i < results.size() ? results.get(i) : RecipientResult.unknownFailure();
            if (result == null) {
                result = RecipientResult.unknownFailure();
            }
            ledger.put(registrationId, result);
            if (failureClassifier.isRetryable(result)) {
                retryable.add(registrationId);
            }
        }
        return retryable;
    }

    private void pauseBeforeRetry(BackoffScheduler.Backoff backoff) {
        try {
            backoff.pause();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while backing off before a push retry");
            throw new PushSendException("Interrupted while waiting to retry push delivery",
                ProviderErrorCategory.TEMPORARY, e);
        }
    }

    private void checkTransport() {
        if (transport == null || !transport.isConfigured()) {
            throw new PushConfigurationException("Push transport is not configured");
        }
    }

    private void checkMessage(PushMessage message) {
        BackendLimits limits = transport.limits();
        if (message == null) {
            throw new PushValidationException("The message must not be null");
        } else if (message.getRegistrationIds() == null) {
            throw new PushValidationException("The message's registration ids must not be null");
        } else if (message.getRegistrationIds().isEmpty()) {
            throw new PushValidationException("The message must specify at least one registration id");
        } else if (message.getRegistrationIds().size() > limits.maxRegistrationIds()) {
            throw new PushValidationException(String.format(
                "The message may specify at most %d registration ids, got %d",
                limits.maxRegistrationIds(), message.getRegistrationIds().size()));
        } else if (message.getTimeToLive() != null
            && (message.getTimeToLive() < 0 || message.getTimeToLive() > limits.maxTimeToLiveSeconds())) {
            throw new PushValidationException(String.format(
                "The message's time to live must be between 0 and %d seconds",
                limits.maxTimeToLiveSeconds()));
        }
        checkRegistrationIds(message.getRegistrationIds());
    }

    private void checkRegistrationIds(List<String> registrationIds) {
        Set<String> seen = new HashSet<>(registrationIds.size() * 2);
        for (String registrationId : registrationIds) {
            if (registrationId == null || registrationId.isBlank()) {
                throw new PushValidationException("The message's registration ids must not be null or blank");
            }
            if (!seen.add(registrationId)) {
                throw new PushValidationException("Duplicate registration id: " + registrationId);
            }
        }
    }
}
