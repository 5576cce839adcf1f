package com.priceradar.api.dto;

import java.time.Instant;

/**
 * Standard error response body: error (human readable), timestamp (ISO 8601).
 * Also the "unavailable" marker for degraded market data endpoints.
 */
public record ErrorBody(String error, Instant timestamp) {

    public static final String UNAVAILABLE = "Unavailable";

    public static ErrorBody of(String error) {
        return new ErrorBody(error, Instant.now());
    }
}
