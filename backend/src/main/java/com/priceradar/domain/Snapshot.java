package com.priceradar.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Full aggregated payload of one aggregation cycle. Immutable; prices keep the requested asset order.
 * Each domain block is null when its source degraded.
 */
public record Snapshot(
        long timestamp,
        String iso,
        Map<String, ReconciledPrice> prices,
        FearGreedIndex fearGreed,
        ChainTvlRanking tvl,
        StablecoinRanking stablecoins,
        GasPrices gas
) {

    public Snapshot {
        prices = Collections.unmodifiableMap(new LinkedHashMap<>(prices));
    }
}
