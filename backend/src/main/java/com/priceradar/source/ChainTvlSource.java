package com.priceradar.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceradar.domain.ChainTvl;
import com.priceradar.domain.ChainTvlRanking;
import com.priceradar.source.config.SourceProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Top chains by TVL from DeFiLlama /v2/chains. Completes empty when unavailable.
 */
@Component
public class ChainTvlSource extends UpstreamSource {

    public static final String SOURCE_ID = "defillama";

    public ChainTvlSource(WebClient sourceWebClient, ObjectMapper objectMapper, SourceProperties properties) {
        super("defillama-tvl", sourceWebClient, objectMapper, properties);
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    public Mono<ChainTvlRanking> fetch() {
        return getJson(properties.getDefillamaApiBaseUrl() + "/v2/chains")
                .map(root -> parse(root, properties.getTvlTopN()))
                .onErrorResume(this::unavailable);
    }

    static ChainTvlRanking parse(JsonNode root, int topN) {
        if (!root.isArray()) {
            throw new SourceUnavailableException("TVL response is not an array");
        }
        List<ChainTvl> chains = new ArrayList<>();
        for (JsonNode chain : root) {
            String name = chain.path("name").asText(null);
            if (name == null) {
                continue;
            }
            Double tvl = numberOrNull(chain.path("tvl"));
            chains.add(new ChainTvl(name, tvl != null ? tvl : 0));
        }
        List<ChainTvl> top = chains.stream()
                .sorted(Comparator.comparingDouble(ChainTvl::tvl).reversed())
                .limit(Math.max(0, topN))
                .toList();
        return new ChainTvlRanking(top, SOURCE_ID);
    }
}
