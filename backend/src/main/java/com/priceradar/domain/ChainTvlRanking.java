package com.priceradar.domain;

import java.util.List;

/**
 * Chains ordered by total value locked, descending.
 */
public record ChainTvlRanking(List<ChainTvl> chains, String source) {

    public ChainTvlRanking {
        chains = List.copyOf(chains);
    }
}
