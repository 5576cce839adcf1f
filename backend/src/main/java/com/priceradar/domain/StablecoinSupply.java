package com.priceradar.domain;

/**
 * Circulating USD supply of one stablecoin. price is null when the provider did not report one.
 */
public record StablecoinSupply(String name, String symbol, double circulating, Double price) {
}
