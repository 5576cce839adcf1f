package com.priceradar.domain;

import java.util.List;

/**
 * Stablecoins ordered by circulating USD value, descending.
 */
public record StablecoinRanking(List<StablecoinSupply> stablecoins, String source) {

    public StablecoinRanking {
        stablecoins = List.copyOf(stablecoins);
    }
}
