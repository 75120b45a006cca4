package com.clapgrow.push.worker.transport;

import com.clapgrow.push.common.exception.PushConfigurationException;
import com.clapgrow.push.common.exception.PushTransportException;
import com.clapgrow.push.common.model.MulticastResult;
import com.clapgrow.push.common.model.PushMessage;
import com.clapgrow.push.common.provider.BackendLimits;
import com.clapgrow.push.common.provider.ProviderErrorCategory;
import com.clapgrow.push.common.provider.ProviderName;
import com.clapgrow.push.common.provider.PushTransport;
import com.clapgrow.push.worker.config.GcmProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/**
 * Multicast transport for the GCM-compatible FCM HTTP endpoint.
 * 
 * One {@link #send} is one blocking POST. Any non-200 status, network
 * failure, timeout or undecodable body fails the whole call with a
 * {@link PushTransportException}; per-recipient errors come back as data.
 */
@Component
@Slf4j
public class GcmHttpTransport implements PushTransport {

    private final WebClient gcmWebClient;
    private final GcmProperties properties;
    private final Clock clock;

    @Autowired
    public GcmHttpTransport(WebClient gcmWebClient, GcmProperties properties) {
        this(gcmWebClient, properties, Clock.systemUTC());
    }

    GcmHttpTransport(WebClient gcmWebClient, GcmProperties properties, Clock clock) {
        this.gcmWebClient = gcmWebClient;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public MulticastResult send(PushMessage message, List<String> registrationIds) {
        if (!isConfigured()) {
            throw new PushConfigurationException("GCM API key is not configured (push.gcm.api-key)");
        }

        GcmSendRequest request = GcmSendRequest.from(message, registrationIds);
        try {
            MulticastResult result = gcmWebClient.post()
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .header(HttpHeaders.AUTHORIZATION, "key=" + properties.getApiKey())
                .bodyValue(request)
                .exchangeToMono(this::readResponse)
                .timeout(properties.getRequestTimeout())
                .block();

            if (result == null) {
                throw new PushTransportException("GCM returned an empty response body",
                    ProviderErrorCategory.PERMANENT, 200, null);
            }
            log.debug("GCM multicast {} for {} recipient(s): success={}, failure={}",
                result.multicastId(), registrationIds.size(), result.success(), result.failure());
            return result;

        } catch (PushTransportException e) {
            throw e;
        } catch (CodecException e) {
            log.error("Could not decode GCM response: {}", e.getMessage());
            throw new PushTransportException("Malformed GCM response: " + e.getMessage(),
                ProviderErrorCategory.PERMANENT, e);
        } catch (WebClientException e) {
            log.error("Network error calling GCM: {}", e.getMessage());
            throw new PushTransportException("GCM request failed: " + e.getMessage(),
                ProviderErrorCategory.TEMPORARY, e);
        } catch (RuntimeException e) {
            // Reactor wraps checked exceptions such as TimeoutException
            log.error("Error calling GCM for {} recipient(s)", registrationIds.size(), e);
            throw new PushTransportException("GCM request failed: " + e.getMessage(),
                ProviderErrorCategory.TEMPORARY, e);
        }
    }

    private Mono<MulticastResult> readResponse(ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        if (status.value() == 200) {
            return response.bodyToMono(MulticastResult.class);
        }
        Integer retryAfter = RetryAfterParser.parse(
            response.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER), clock);
        log.error("GCM rejected the batch with HTTP {} (retry-after: {})", status.value(), retryAfter);
        return response.releaseBody().then(Mono.error(new PushTransportException(
            "GCM returned HTTP " + status.value(), categorize(status), status.value(), retryAfter)));
    }

    static ProviderErrorCategory categorize(HttpStatusCode status) {
        int code = status.value();
        if (code == 401 || code == 403) {
            return ProviderErrorCategory.AUTH;
        }
        if (code == 429 || status.is5xxServerError()) {
            return ProviderErrorCategory.TEMPORARY;
        }
        return ProviderErrorCategory.PERMANENT;
    }

    @Override
    public BackendLimits limits() {
        return properties.toLimits();
    }

    @Override
    public ProviderName getProviderName() {
        return ProviderName.FCM_LEGACY;
    }

    @Override
    public boolean isConfigured() {
        return properties.getApiKey() != null && !properties.getApiKey().trim().isEmpty()
            && properties.getEndpoint() != null && !properties.getEndpoint().trim().isEmpty();
    }
}
