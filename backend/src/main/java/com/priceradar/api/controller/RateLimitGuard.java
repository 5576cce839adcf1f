package com.priceradar.api.controller;

import com.priceradar.api.dto.RateLimitedBody;
import com.priceradar.common.ClientRateLimiter;
import com.priceradar.config.RateLimitProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * Charges one unit of the calling client's quota per data request and builds the 429 rejection.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitGuard {

    static final String FORWARDED_FOR = "X-Forwarded-For";
    static final String UNKNOWN_CLIENT = "unknown";

    private final ClientRateLimiter rateLimiter;
    private final RateLimitProperties properties;

    public boolean admit(ServerHttpRequest request) {
        String clientId = clientId(request);
        boolean admitted = rateLimiter.admit(clientId);
        if (!admitted) {
            log.debug("Rate limited client {} on {}", clientId, request.getPath());
        }
        return admitted;
    }

    public ResponseEntity<Object> rejection() {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .body(new RateLimitedBody("Rate limited", rateLimiter.getQuota(), describe(rateLimiter.getWindow())));
    }

    String clientId(ServerHttpRequest request) {
        if (properties.isTrustForwardedFor()) {
            String forwarded = request.getHeaders().getFirst(FORWARDED_FOR);
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.split(",")[0].strip();
            }
        }
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote == null) {
            return UNKNOWN_CLIENT;
        }
        return remote.getAddress() != null ? remote.getAddress().getHostAddress() : remote.getHostString();
    }

    /** "1 hour", "2 hours", "15 minutes"; falls back to seconds. */
    static String describe(Duration window) {
        long seconds = window.getSeconds();
        if (seconds % 3600 == 0) {
            long hours = seconds / 3600;
            return hours + (hours == 1 ? " hour" : " hours");
        }
        if (seconds % 60 == 0) {
            long minutes = seconds / 60;
            return minutes + (minutes == 1 ? " minute" : " minutes");
        }
        return seconds + " seconds";
    }
}
