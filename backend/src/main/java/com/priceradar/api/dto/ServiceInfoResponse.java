package com.priceradar.api.dto;

import java.util.Map;

/**
 * GET / response: service identity and endpoint catalogue.
 */
public record ServiceInfoResponse(
        String name,
        String version,
        String description,
        String verification,
        Map<String, String> endpoints,
        String rateLimit,
        String attestation
) {
}
