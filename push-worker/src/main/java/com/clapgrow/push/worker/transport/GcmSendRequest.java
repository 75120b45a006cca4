package com.clapgrow.push.worker.transport;

import com.clapgrow.push.common.model.PushMessage;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON body of one multicast call: the message options with the round's
 * recipients in place of the message's own list.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
record GcmSendRequest(
    @JsonProperty("registration_ids") List<String> registrationIds,
    @JsonProperty("collapse_key") String collapseKey,
    @JsonProperty("data") Map<String, String> data,
    @JsonProperty("delay_while_idle") Boolean delayWhileIdle,
    @JsonProperty("time_to_live") Integer timeToLive,
    @JsonProperty("restricted_package_name") String restrictedPackageName,
    @JsonProperty("dry_run") Boolean dryRun
) {

    static GcmSendRequest from(PushMessage message, List<String> registrationIds) {
        return new GcmSendRequest(
            List.copyOf(registrationIds),
            message.getCollapseKey(),
            message.getData(),
            message.getDelayWhileIdle(),
            message.getTimeToLive(),
            message.getRestrictedPackageName(),
            message.getDryRun()
        );
    }
}
