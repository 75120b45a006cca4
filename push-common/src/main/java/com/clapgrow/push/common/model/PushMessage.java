package com.clapgrow.push.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Push message sent to one or more devices.
 * 
 * Owned by the caller. Senders read it but never modify it, so the same
 * instance can be inspected or sent again after a call returns.
 * 
 * Property names match the backend's JSON wire format, which also makes this
 * the Kafka payload consumed by the push worker.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PushMessage {

    @JsonProperty("registration_ids")
    private List<String> registrationIds;

    @JsonProperty("collapse_key")
    private String collapseKey;

    // Free-form key/value payload delivered to the app
    @JsonProperty("data")
    private Map<String, String> data;

    @JsonProperty("delay_while_idle")
    private Boolean delayWhileIdle;

    // Seconds; null means the backend default
    @JsonProperty("time_to_live")
    private Integer timeToLive;

    @JsonProperty("restricted_package_name")
    private String restrictedPackageName;

    @JsonProperty("dry_run")
    private Boolean dryRun;

    /**
     * Create a message with the given payload and recipients.
     * 
     * @param data key/value payload, may be null
     * @param registrationIds recipients, in order
     * @return new message
     */
    public static PushMessage of(Map<String, String> data, String... registrationIds) {
        PushMessage message = new PushMessage();
        message.setData(data != null ? new LinkedHashMap<>(data) : null);
        message.setRegistrationIds(registrationIds != null
            ? new ArrayList<>(Arrays.asList(registrationIds))
            : null);
        return message;
    }
}
