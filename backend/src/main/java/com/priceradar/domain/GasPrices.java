package com.priceradar.domain;

/**
 * Ethereum gas price tiers in gwei.
 */
public record GasPrices(int low, int standard, int fast, String source) {
}
