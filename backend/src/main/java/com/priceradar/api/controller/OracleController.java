package com.priceradar.api.controller;

import com.priceradar.api.dto.ErrorBody;
import com.priceradar.domain.ReconciledPrice;
import com.priceradar.snapshot.SnapshotCache;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * GET /snapshot, /price/{asset}, /prices. All served from the shared snapshot cache; each call costs one unit
 * of the client's quota.
 */
@RestController
@RequiredArgsConstructor
public class OracleController {

    private final SnapshotCache snapshotCache;
    private final SnapshotResponseAssembler assembler;
    private final RateLimitGuard rateLimitGuard;

    @GetMapping("/snapshot")
    public Mono<ResponseEntity<Object>> snapshot(ServerHttpRequest request) {
        if (!rateLimitGuard.admit(request)) {
            return Mono.just(rateLimitGuard.rejection());
        }
        return snapshotCache.getSnapshot()
                .<ResponseEntity<Object>>map(snapshot -> ResponseEntity.ok(assembler.toSnapshotResponse(snapshot)));
    }

    @GetMapping("/price/{asset}")
    public Mono<ResponseEntity<Object>> price(@PathVariable("asset") String asset, ServerHttpRequest request) {
        if (!rateLimitGuard.admit(request)) {
            return Mono.just(rateLimitGuard.rejection());
        }
        String ticker = asset.strip().toUpperCase(Locale.ROOT);
        return snapshotCache.getSnapshot()
                .<ResponseEntity<Object>>map(snapshot -> {
                    ReconciledPrice price = snapshot.prices().get(ticker);
                    if (price == null) {
                        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                                .body(ErrorBody.of("Asset " + ticker + " not tracked"));
                    }
                    return ResponseEntity.ok(assembler.toPriceResponse(ticker, price, snapshot));
                });
    }

    @GetMapping("/prices")
    public Mono<ResponseEntity<Object>> prices(ServerHttpRequest request) {
        if (!rateLimitGuard.admit(request)) {
            return Mono.just(rateLimitGuard.rejection());
        }
        return snapshotCache.getSnapshot()
                .<ResponseEntity<Object>>map(snapshot -> ResponseEntity.ok(assembler.toPricesResponse(snapshot)));
    }
}
