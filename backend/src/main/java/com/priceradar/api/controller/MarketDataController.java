package com.priceradar.api.controller;

import com.priceradar.api.dto.ErrorBody;
import com.priceradar.source.ChainTvlSource;
import com.priceradar.source.FearGreedSource;
import com.priceradar.source.GasPriceSource;
import com.priceradar.source.StablecoinSource;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

/**
 * GET /fear-greed, /tvl, /stablecoins, /gas. Fetched fresh per request, bypassing the snapshot cache.
 * A degraded source answers {"error":"Unavailable"}.
 */
@RestController
@RequiredArgsConstructor
public class MarketDataController {

    private final FearGreedSource fearGreedSource;
    private final ChainTvlSource chainTvlSource;
    private final StablecoinSource stablecoinSource;
    private final GasPriceSource gasPriceSource;
    private final RateLimitGuard rateLimitGuard;

    @GetMapping("/fear-greed")
    public Mono<ResponseEntity<Object>> fearGreed(ServerHttpRequest request) {
        return fetch(request, fearGreedSource::fetch);
    }

    @GetMapping("/tvl")
    public Mono<ResponseEntity<Object>> tvl(ServerHttpRequest request) {
        return fetch(request, chainTvlSource::fetch);
    }

    @GetMapping("/stablecoins")
    public Mono<ResponseEntity<Object>> stablecoins(ServerHttpRequest request) {
        return fetch(request, stablecoinSource::fetch);
    }

    @GetMapping("/gas")
    public Mono<ResponseEntity<Object>> gas(ServerHttpRequest request) {
        return fetch(request, gasPriceSource::fetch);
    }

    private Mono<ResponseEntity<Object>> fetch(ServerHttpRequest request, Supplier<? extends Mono<?>> source) {
        if (!rateLimitGuard.admit(request)) {
            return Mono.just(rateLimitGuard.rejection());
        }
        return source.get()
                .map(body -> ResponseEntity.<Object>ok(body))
                .defaultIfEmpty(ResponseEntity.ok(ErrorBody.of(ErrorBody.UNAVAILABLE)));
    }
}
