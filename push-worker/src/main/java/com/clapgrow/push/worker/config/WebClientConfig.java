package com.clapgrow.push.worker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient gcmWebClient(WebClient.Builder builder, GcmProperties gcmProperties) {
        return builder
            .baseUrl(gcmProperties.getEndpoint())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(gcmProperties.getMaxInMemorySize()))
            .build();
    }
}
