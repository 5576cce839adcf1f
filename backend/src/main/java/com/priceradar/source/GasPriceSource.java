package com.priceradar.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceradar.domain.GasPrices;
import com.priceradar.source.config.SourceProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Ethereum gas tiers from the Etherscan gas oracle. Completes empty when unavailable or when Etherscan reports
 * a status other than "1".
 */
@Component
public class GasPriceSource extends UpstreamSource {

    public static final String SOURCE_ID = "etherscan";
    static final String SUCCESS_STATUS = "1";

    public GasPriceSource(WebClient sourceWebClient, ObjectMapper objectMapper, SourceProperties properties) {
        super("etherscan-gas", sourceWebClient, objectMapper, properties);
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    public Mono<GasPrices> fetch() {
        String url = properties.getEtherscanBaseUrl() + "?module=gastracker&action=gasoracle";
        String apiKey = properties.getEtherscanApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            url += "&apikey=" + apiKey.strip();
        }
        return getJson(url)
                .map(GasPriceSource::parse)
                .onErrorResume(this::unavailable);
    }

    static GasPrices parse(JsonNode root) {
        String status = root.path("status").asText("");
        if (!SUCCESS_STATUS.equals(status)) {
            throw new SourceUnavailableException("Etherscan status " + status + ": " + root.path("message").asText(""));
        }
        JsonNode result = root.path("result");
        return new GasPrices(
                gwei(result, "SafeGasPrice"),
                gwei(result, "ProposeGasPrice"),
                gwei(result, "FastGasPrice"),
                SOURCE_ID);
    }

    /** Whole gwei, truncated; Etherscan may report fractional values such as "0.42". */
    private static int gwei(JsonNode result, String field) {
        String text = result.path(field).asText("").strip();
        try {
            return (int) Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new SourceUnavailableException("Etherscan " + field + " is not numeric: " + text, e);
        }
    }
}
