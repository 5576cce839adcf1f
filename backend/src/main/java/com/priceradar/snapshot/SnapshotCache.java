package com.priceradar.snapshot;

import com.priceradar.domain.Snapshot;
import com.priceradar.snapshot.config.SnapshotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared single-slot snapshot cache for the configured asset list.
 *
 * <p>A snapshot younger than the TTL is served as is. Otherwise one aggregation cycle runs and replaces the
 * slot; callers arriving while it is in flight join the same refresh (single-flight), so at most one upstream
 * fan-out happens per expiry. A waiter that cancels does not cancel the shared refresh.
 */
@Component
@Slf4j
public class SnapshotCache {

    private final SnapshotAggregator aggregator;
    private final SnapshotProperties properties;
    private final Clock clock;

    private final AtomicReference<CachedSnapshot> slot = new AtomicReference<>();
    private final AtomicReference<CompletableFuture<Snapshot>> inFlight = new AtomicReference<>();

    public SnapshotCache(SnapshotAggregator aggregator, SnapshotProperties properties, Clock clock) {
        this.aggregator = aggregator;
        this.properties = properties;
        this.clock = clock;
    }

    public Mono<Snapshot> getSnapshot() {
        return Mono.defer(() -> {
            CachedSnapshot current = slot.get();
            if (isFresh(current)) {
                log.debug("Snapshot cache hit, age {}s", ageSeconds(current));
                return Mono.just(current.snapshot());
            }
            return Mono.fromFuture(refresh(), true);
        });
    }

    /**
     * Whole seconds since the slot was last replaced; empty if it was never populated.
     */
    public Optional<Long> cacheAgeSeconds() {
        CachedSnapshot current = slot.get();
        return current == null ? Optional.empty() : Optional.of(ageSeconds(current));
    }

    private CompletableFuture<Snapshot> refresh() {
        CompletableFuture<Snapshot> created = new CompletableFuture<>();
        CompletableFuture<Snapshot> existing = inFlight.compareAndExchange(null, created);
        if (existing != null) {
            return existing;
        }
        // another refresh may have completed between the freshness check and winning the CAS
        CachedSnapshot current = slot.get();
        if (isFresh(current)) {
            inFlight.set(null);
            created.complete(current.snapshot());
            return created;
        }
        log.debug("Snapshot cache miss, refreshing {} assets", properties.getAssets().size());
        // aggregate may throw before returning a Mono; that must still reach the error callback
        Mono.defer(() -> aggregator.aggregate(properties.getAssets())).subscribe(
                snapshot -> {
                    slot.set(new CachedSnapshot(snapshot, clock.instant()));
                    inFlight.set(null);
                    created.complete(snapshot);
                },
                error -> {
                    log.error("Snapshot refresh failed", error);
                    inFlight.set(null);
                    created.completeExceptionally(error);
                },
                () -> {
                    if (!created.isDone()) {
                        inFlight.set(null);
                        created.completeExceptionally(new IllegalStateException("Aggregation completed without a snapshot"));
                    }
                });
        return created;
    }

    private boolean isFresh(CachedSnapshot cached) {
        if (cached == null) {
            return false;
        }
        Duration age = Duration.between(cached.storedAt(), clock.instant());
        return age.compareTo(Duration.ofSeconds(properties.getTtlSeconds())) < 0;
    }

    private long ageSeconds(CachedSnapshot cached) {
        return Math.max(0, Duration.between(cached.storedAt(), clock.instant()).getSeconds());
    }
}
