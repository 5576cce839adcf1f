package com.priceradar.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceradar.domain.SourceQuote;
import com.priceradar.source.config.SourceProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spot prices via DeFiLlama /prices/current. Carries the provider's own confidence (default 0.99), which is
 * informational only.
 */
@Component
public class DefiLlamaSpotPriceSource extends UpstreamSource implements SpotPriceSource {

    public static final String SOURCE_ID = "defillama";
    static final double DEFAULT_CONFIDENCE = 0.99;

    public DefiLlamaSpotPriceSource(WebClient sourceWebClient, ObjectMapper objectMapper, SourceProperties properties) {
        super("defillama-prices", sourceWebClient, objectMapper, properties);
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public Mono<Map<String, SourceQuote>> fetchQuotes(Collection<String> tickers) {
        Map<String, String> mapped = TickerMapping.resolve(tickers, properties.getDefillamaIds());
        if (mapped.isEmpty()) {
            return Mono.just(Map.of());
        }
        String url = properties.getDefillamaCoinsBaseUrl() + "/prices/current/" + String.join(",", mapped.values());
        return getJson(url)
                .map(root -> parseQuotes(root, mapped))
                .onErrorResume(this::unavailable)
                .defaultIfEmpty(Map.of());
    }

    static Map<String, SourceQuote> parseQuotes(JsonNode root, Map<String, String> tickerToLlamaId) {
        Map<String, SourceQuote> result = new LinkedHashMap<>();
        JsonNode coins = root.path("coins");
        for (Map.Entry<String, String> e : tickerToLlamaId.entrySet()) {
            JsonNode coin = coins.path(e.getValue());
            JsonNode price = coin.path("price");
            if (!price.isNumber() || price.asDouble() <= 0) {
                continue;
            }
            Double confidence = numberOrNull(coin.path("confidence"));
            result.put(e.getKey(), new SourceQuote(
                    SOURCE_ID,
                    price.asDouble(),
                    null,
                    null,
                    confidence != null && confidence > 0 ? confidence : DEFAULT_CONFIDENCE));
        }
        return result;
    }
}
