package com.priceradar.api.dto;

/**
 * GET /health response. cacheAge is null until the first snapshot has been cached.
 */
public record HealthResponse(String status, double uptime, Long cacheAge, String timestamp) {
}
