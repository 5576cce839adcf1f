package com.priceradar.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceradar.domain.StablecoinRanking;
import com.priceradar.domain.StablecoinSupply;
import com.priceradar.source.config.SourceProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Top stablecoins by circulating USD from DeFiLlama /stablecoins. Completes empty when unavailable.
 */
@Component
public class StablecoinSource extends UpstreamSource {

    public static final String SOURCE_ID = "defillama";

    public StablecoinSource(WebClient sourceWebClient, ObjectMapper objectMapper, SourceProperties properties) {
        super("defillama-stablecoins", sourceWebClient, objectMapper, properties);
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    public Mono<StablecoinRanking> fetch() {
        return getJson(properties.getStablecoinsBaseUrl() + "/stablecoins?includePrices=true")
                .map(root -> parse(root, properties.getStablecoinTopN()))
                .onErrorResume(this::unavailable);
    }

    static StablecoinRanking parse(JsonNode root, int topN) {
        JsonNode assets = root.path("peggedAssets");
        if (!assets.isArray()) {
            throw new SourceUnavailableException("Stablecoin response has no peggedAssets");
        }
        List<StablecoinSupply> supplies = new ArrayList<>();
        for (JsonNode asset : assets) {
            Double circulating = numberOrNull(asset.path("circulating").path("peggedUSD"));
            supplies.add(new StablecoinSupply(
                    asset.path("name").asText(null),
                    asset.path("symbol").asText(null),
                    circulating != null ? circulating : 0,
                    numberOrNull(asset.path("price"))));
        }
        List<StablecoinSupply> top = supplies.stream()
                .sorted(Comparator.comparingDouble(StablecoinSupply::circulating).reversed())
                .limit(Math.max(0, topN))
                .toList();
        return new StablecoinRanking(top, SOURCE_ID);
    }
}
