package com.priceradar.api.dto;

/**
 * 429 body: the client's quota and the window it applies to, e.g. 30 / "1 hour".
 */
public record RateLimitedBody(String error, int limit, String window) {
}
