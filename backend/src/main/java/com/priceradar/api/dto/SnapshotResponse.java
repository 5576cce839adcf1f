package com.priceradar.api.dto;

import com.priceradar.domain.ChainTvlRanking;
import com.priceradar.domain.FearGreedIndex;
import com.priceradar.domain.GasPrices;
import com.priceradar.domain.StablecoinRanking;

import java.util.Map;

/**
 * GET /snapshot response. Domain blocks are null when their source degraded.
 */
public record SnapshotResponse(
        long timestamp,
        String iso,
        String verification,
        Map<String, HashedPrice> prices,
        FearGreedIndex fearGreed,
        ChainTvlRanking tvl,
        StablecoinRanking stablecoins,
        GasPrices gas
) {
}
