package com.priceradar.api.dto;

import com.priceradar.domain.ReconciledPrice;

import java.util.Map;

/**
 * GET /prices response (no hashes).
 */
public record PricesResponse(long timestamp, String iso, Map<String, ReconciledPrice> prices) {
}
