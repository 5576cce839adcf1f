package com.priceradar.domain;

/**
 * Crypto Fear &amp; Greed index: value 0-100, textual classification, the index's own epoch-second timestamp.
 */
public record FearGreedIndex(int value, String label, long timestamp, String source) {
}
