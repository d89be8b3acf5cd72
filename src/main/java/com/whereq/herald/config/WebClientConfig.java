package com.whereq.herald.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient configuration for webhook delivery
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient webhookWebClient(WebClient.Builder builder, HeraldProperties properties) {
        WebClient.Builder configured = builder.clone()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(256 * 1024)); // responses only carry a delivery id

        String baseUrl = properties.getDispatch().getWebhookBaseUrl();
        if (baseUrl != null && !baseUrl.isBlank()) {
            configured.baseUrl(baseUrl);
        }
        return configured.build();
    }
}
