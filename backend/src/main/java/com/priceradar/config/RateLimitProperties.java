package com.priceradar.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per-client request quota. Documented in application.yml under priceradar.rate-limit.
 */
@ConfigurationProperties(prefix = "priceradar.rate-limit")
@Getter
@Setter
public class RateLimitProperties {

    /**
     * Admitted calls per client per window (env RATE_LIMIT).
     */
    private int quota = 30;

    /**
     * Sliding window length in seconds.
     */
    private long windowSeconds = 3600;

    /**
     * Identify clients by the first X-Forwarded-For entry instead of the socket address.
     * Enable only behind a proxy that overwrites the header.
     */
    private boolean trustForwardedFor = false;
}
