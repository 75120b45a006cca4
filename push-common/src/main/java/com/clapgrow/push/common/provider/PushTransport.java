package com.clapgrow.push.common.provider;

import com.clapgrow.push.common.exception.PushTransportException;
import com.clapgrow.push.common.model.MulticastResult;
import com.clapgrow.push.common.model.PushMessage;

import java.util.List;

/**
 * Push batch transport interface.
 * 
 * Abstraction for multicast push backends. One call carries one payload and
 * an ordered list of registration ids and yields one result per id.
 * 
 * Implementation guidelines:
 * - Results must be positionally aligned with the ids passed in that call
 * - Send the given ids, not the ones stored on the message
 * - Never modify the message
 * - Throw {@link PushTransportException} when the call as a whole fails;
 *   no result of a failed call is trusted
 * - Never log API keys
 * 
 * Example usage:
 * <pre>
 * MulticastResult result = transport.send(message, List.of("token-1", "token-2"));
 * </pre>
 */
public interface PushTransport {
    
    /**
     * Send the message options to the given recipients.
     * 
     * @param message Message whose options and payload are sent
     * @param registrationIds Recipients for this call, in order
     * @return Per-recipient results aligned with {@code registrationIds}
     * @throws PushTransportException if the call itself failed
     */
    MulticastResult send(PushMessage message, List<String> registrationIds);
    
    /**
     * Limits the backend enforces on a single call.
     * 
     * @return Backend limits
     */
    default BackendLimits limits() {
        return BackendLimits.defaults();
    }
    
    /**
     * Get the provider name.
     * 
     * @return ProviderName enum value
     */
    ProviderName getProviderName();
    
    /**
     * Check if the transport has credentials and an endpoint.
     * 
     * @return true if configured, false otherwise
     */
    default boolean isConfigured() {
        return true;
    }
}
