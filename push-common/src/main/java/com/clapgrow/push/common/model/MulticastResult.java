package com.clapgrow.push.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Response to a multicast push: counters plus one result per recipient.
 * 
 * Used both for the raw response of a single backend call and for the
 * aggregated result of a call with retries, where {@code results} follows the
 * caller's original recipient order.
 *
 * @param multicastId backend id of the (most recent) multicast call
 * @param success number of recipients delivered
 * @param failure number of recipients not delivered
 * @param canonicalIds number of successes carrying a replacement registration id
 * @param results per-recipient outcomes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MulticastResult(
    @JsonProperty("multicast_id") long multicastId,
    @JsonProperty("success") int success,
    @JsonProperty("failure") int failure,
    @JsonProperty("canonical_ids") int canonicalIds,
    @JsonProperty("results") List<RecipientResult> results
) {

    public MulticastResult {
        results = results == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(results));
    }

    /**
     * Build a result whose counters are computed from the given outcomes.
     */
    public static MulticastResult of(long multicastId, List<RecipientResult> results) {
        int success = 0;
        int failure = 0;
        int canonicalIds = 0;
        for (RecipientResult result : results) {
            if (result.isSuccess()) {
                success++;
                if (result.hasCanonicalId()) {
                    canonicalIds++;
                }
            } else {
                failure++;
            }
        }
        return new MulticastResult(multicastId, success, failure, canonicalIds, results);
    }
}
