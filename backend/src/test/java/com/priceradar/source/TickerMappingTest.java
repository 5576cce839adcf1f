package com.priceradar.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TickerMappingTest {

    @Test
    @DisplayName("resolves case-insensitively, drops unmapped and duplicates, keeps request order")
    void resolve() {
        Map<String, String> mapped = TickerMapping.resolve(
                Arrays.asList("eth", "BTC", null, " ", "DOGE", "Btc"),
                Map.of("btc", "bitcoin", "ETH", "ethereum", "SOL", "solana"));

        assertThat(mapped).containsExactly(Map.entry("ETH", "ethereum"), Map.entry("BTC", "bitcoin"));
    }

    @Test
    @DisplayName("blank provider ids are treated as unmapped")
    void blankId() {
        assertThat(TickerMapping.resolve(List.of("BTC"), Map.of("BTC", " "))).isEmpty();
        assertThat(TickerMapping.resolve(null, Map.of())).isEmpty();
    }
}
