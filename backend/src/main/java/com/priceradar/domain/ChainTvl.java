package com.priceradar.domain;

public record ChainTvl(String chain, double tvl) {
}
