package com.priceradar.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merged price for one asset. sources.size() == sourceCount; divergenceBps is 0 for a single source.
 * sourcePrices is only populated when two sources contributed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReconciledPrice(
        double price,
        int sourceCount,
        List<String> sources,
        int confidence,
        int divergenceBps,
        String warning,
        Double change24h,
        Double marketCap,
        Map<String, Double> sourcePrices
) {

    public ReconciledPrice {
        sources = List.copyOf(sources);
        sourcePrices = sourcePrices == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(sourcePrices));
    }
}
