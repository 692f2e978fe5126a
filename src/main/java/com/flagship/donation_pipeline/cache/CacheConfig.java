package com.flagship.donation_pipeline.cache;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CacheConfig {

    /**
     * Holds the PayPal bearer token and the provisioned catalog product id.
     */
    @Bean
    public TtlCache<String, String> providerCache(Clock clock) {
        return new CaffeineTtlCache<>(clock, 100);
    }
}
