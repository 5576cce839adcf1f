package com.priceradar.config;

import com.priceradar.common.ClientRateLimiter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class RateLimitConfig {

    @Bean
    public ClientRateLimiter clientRateLimiter(RateLimitProperties properties, Clock clock) {
        return new ClientRateLimiter(properties.getQuota(), Duration.ofSeconds(properties.getWindowSeconds()), clock);
    }
}
