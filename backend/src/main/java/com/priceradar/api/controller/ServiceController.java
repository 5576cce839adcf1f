package com.priceradar.api.controller;

import com.priceradar.api.dto.HealthResponse;
import com.priceradar.api.dto.ServiceInfoResponse;
import com.priceradar.common.ClientRateLimiter;
import com.priceradar.config.ServiceProperties;
import com.priceradar.snapshot.SnapshotCache;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GET / (service description) and GET /health. Neither is rate limited.
 */
@RestController
@RequiredArgsConstructor
public class ServiceController {

    private static final Map<String, String> ENDPOINTS = endpoints();

    private final ServiceProperties serviceProperties;
    private final SnapshotCache snapshotCache;
    private final ClientRateLimiter rateLimiter;
    private final Clock clock;

    @GetMapping("/")
    public ServiceInfoResponse index() {
        ServiceProperties.Service service = serviceProperties.getService();
        return new ServiceInfoResponse(
                service.getName(),
                service.getVersion(),
                service.getDescription(),
                "Cross-sourced from CoinGecko + DeFiLlama. Every price includes a confidence score and divergence metrics.",
                ENDPOINTS,
                rateLimiter.getQuota() + " calls per " + RateLimitGuard.describe(rateLimiter.getWindow()),
                serviceProperties.getAttestation().getNetwork() + " (on-chain verification)");
    }

    @GetMapping("/health")
    public HealthResponse health() {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        double uptimeSeconds = ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0;
        return new HealthResponse(
                "ok",
                uptimeSeconds,
                snapshotCache.cacheAgeSeconds().orElse(null),
                DateTimeFormatter.ISO_INSTANT.format(now));
    }

    private static Map<String, String> endpoints() {
        Map<String, String> e = new LinkedHashMap<>();
        e.put("/snapshot", "Full market snapshot (prices, TVL, stablecoins, gas, fear & greed)");
        e.put("/price/:asset", "Single asset price with cross-verification");
        e.put("/prices", "All tracked asset prices");
        e.put("/fear-greed", "Crypto Fear & Greed Index");
        e.put("/tvl", "Chain TVL rankings");
        e.put("/stablecoins", "Stablecoin market caps");
        e.put("/gas", "Ethereum gas prices");
        e.put("/verify/:hash", "Verify a data point hash");
        e.put("/health", "Service health");
        return Collections.unmodifiableMap(e);
    }
}
