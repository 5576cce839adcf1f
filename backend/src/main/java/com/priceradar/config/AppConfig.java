package com.priceradar.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Application-wide beans: the UTC clock shared by the cache, the rate limiter and snapshot timestamps.
 */
@Configuration
@EnableConfigurationProperties(ServiceProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
