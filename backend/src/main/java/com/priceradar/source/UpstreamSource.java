package com.priceradar.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceradar.source.config.SourceProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Base for adapters that read one JSON document from a public HTTP API. Each fetch is bounded by the configured
 * request timeout and by a local per-source request budget; neither waits nor retries.
 */
@Slf4j
public abstract class UpstreamSource {

    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;
    protected final SourceProperties properties;

    private final String name;
    private final RateLimiter requestBudget;

    protected UpstreamSource(String name, WebClient webClient, ObjectMapper objectMapper, SourceProperties properties) {
        this.name = name;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, properties.getUpstreamRequestsPerMinute()))
                .timeoutDuration(Duration.ZERO)
                .build();
        this.requestBudget = RateLimiter.of(name, config);
    }

    /**
     * Source identifier reported in results, e.g. "coingecko".
     */
    public abstract String sourceId();

    /**
     * Adapter name used for logs and the request budget, e.g. "defillama-tvl".
     */
    public String name() {
        return name;
    }

    protected Mono<JsonNode> getJson(String url) {
        return Mono.defer(() -> {
                    if (!requestBudget.acquirePermission()) {
                        return Mono.error(new SourceUnavailableException("local request budget exhausted"));
                    }
                    return webClient.get()
                            .uri(url)
                            .retrieve()
                            .bodyToMono(String.class);
                })
                .switchIfEmpty(Mono.error(new SourceUnavailableException("empty response body")))
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .map(this::readTree);
    }

    /**
     * Logs the failure and completes empty, so a flaky upstream never fails the caller.
     */
    protected <T> Mono<T> unavailable(Throwable e) {
        log.warn("Source {} unavailable: {}", name, e.toString());
        return Mono.empty();
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SourceUnavailableException("Parse error from " + name + ": " + e.getOriginalMessage(), e);
        }
    }

    protected static Double numberOrNull(JsonNode node) {
        return node != null && node.isNumber() ? node.asDouble() : null;
    }
}
