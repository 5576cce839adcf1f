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
 * Spot prices via CoinGecko /simple/price, with 24h change and market cap.
 */
@Component
public class CoinGeckoSpotPriceSource extends UpstreamSource implements SpotPriceSource {

    public static final String SOURCE_ID = "coingecko";

    public CoinGeckoSpotPriceSource(WebClient sourceWebClient, ObjectMapper objectMapper, SourceProperties properties) {
        super("coingecko-prices", sourceWebClient, objectMapper, properties);
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public Mono<Map<String, SourceQuote>> fetchQuotes(Collection<String> tickers) {
        Map<String, String> mapped = TickerMapping.resolve(tickers, properties.getCoingeckoIds());
        if (mapped.isEmpty()) {
            return Mono.just(Map.of());
        }
        String url = properties.getCoingeckoBaseUrl() + "/simple/price?ids=" + String.join(",", mapped.values())
                + "&vs_currencies=usd&include_24hr_change=true&include_market_cap=true";
        return getJson(url)
                .map(root -> parseQuotes(root, mapped))
                .onErrorResume(this::unavailable)
                .defaultIfEmpty(Map.of());
    }

    static Map<String, SourceQuote> parseQuotes(JsonNode root, Map<String, String> tickerToCoinId) {
        Map<String, SourceQuote> result = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : tickerToCoinId.entrySet()) {
            JsonNode coin = root.path(e.getValue());
            JsonNode usd = coin.path("usd");
            if (!usd.isNumber() || usd.asDouble() <= 0) {
                continue;
            }
            result.put(e.getKey(), new SourceQuote(
                    SOURCE_ID,
                    usd.asDouble(),
                    numberOrNull(coin.path("usd_24h_change")),
                    numberOrNull(coin.path("usd_market_cap")),
                    null));
        }
        return result;
    }
}
