package com.priceradar.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceradar.domain.FearGreedIndex;
import com.priceradar.source.config.SourceProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Current Crypto Fear &amp; Greed index from alternative.me. Completes empty when unavailable.
 */
@Component
public class FearGreedSource extends UpstreamSource {

    public static final String SOURCE_ID = "alternative.me";

    public FearGreedSource(WebClient sourceWebClient, ObjectMapper objectMapper, SourceProperties properties) {
        super("fear-greed", sourceWebClient, objectMapper, properties);
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    public Mono<FearGreedIndex> fetch() {
        return getJson(properties.getFearGreedBaseUrl() + "/fng/?limit=1")
                .map(FearGreedSource::parse)
                .onErrorResume(this::unavailable);
    }

    static FearGreedIndex parse(JsonNode root) {
        JsonNode latest = root.path("data").path(0);
        if (latest.isMissingNode()) {
            throw new SourceUnavailableException("Fear & Greed response has no data");
        }
        int value;
        long timestamp;
        try {
            value = Integer.parseInt(latest.path("value").asText().strip());
            timestamp = Long.parseLong(latest.path("timestamp").asText().strip());
        } catch (NumberFormatException e) {
            throw new SourceUnavailableException("Fear & Greed value is not numeric", e);
        }
        if (value < 0 || value > 100) {
            throw new SourceUnavailableException("Fear & Greed value out of range: " + value);
        }
        return new FearGreedIndex(value, latest.path("value_classification").asText(null), timestamp, SOURCE_ID);
    }
}
