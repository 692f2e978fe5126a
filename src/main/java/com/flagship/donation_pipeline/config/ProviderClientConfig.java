package com.flagship.donation_pipeline.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * HTTP client and clock wiring for the PayPal integration.
 *
 * The RestTemplate carries bounded timeouts; nothing in the pipeline retries a
 * provider call, a timeout fails the current request.
 */
@Configuration
public class ProviderClientConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate payPalRestTemplate(RestTemplateBuilder builder, PayPalProperties properties) {
        return builder
                .setConnectTimeout(properties.getConnectTimeout())
                .setReadTimeout(properties.getReadTimeout())
                .build();
    }
}
