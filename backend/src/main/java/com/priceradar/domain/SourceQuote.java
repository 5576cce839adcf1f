package com.priceradar.domain;

/**
 * One provider's USD observation for one asset, valid only within a single aggregation cycle.
 * Ancillary fields are null when the provider does not expose them.
 */
public record SourceQuote(
        String source,
        double price,
        Double change24h,
        Double marketCap,
        Double reportedConfidence
) {

    public static SourceQuote of(String source, double price) {
        return new SourceQuote(source, price, null, null, null);
    }
}
