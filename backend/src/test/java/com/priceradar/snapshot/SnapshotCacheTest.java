package com.priceradar.snapshot;

import com.priceradar.MutableClock;
import com.priceradar.domain.Snapshot;
import com.priceradar.snapshot.config.SnapshotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SnapshotCacheTest {

    @Mock
    SnapshotAggregator aggregator;

    private MutableClock clock;
    private SnapshotCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-06-01T12:00:00Z"));
        SnapshotProperties properties = new SnapshotProperties();
        properties.setTtlSeconds(60);
        properties.setAssets(List.of("BTC", "ETH"));
        cache = new SnapshotCache(aggregator, properties, clock);
    }

    private static Snapshot snapshot(long ts) {
        return new Snapshot(ts, Instant.ofEpochSecond(ts).toString(), Map.of(), null, null, null, null);
    }

    @Test
    @DisplayName("fresh snapshot is served without a second aggregation")
    void hitWithinTtl() {
        when(aggregator.aggregate(anyList())).thenReturn(Mono.just(snapshot(1)));

        Snapshot first = cache.getSnapshot().block();
        clock.advance(Duration.ofSeconds(59));
        Snapshot second = cache.getSnapshot().block();

        assertThat(second).isSameAs(first);
        verify(aggregator, times(1)).aggregate(List.of("BTC", "ETH"));
    }

    @Test
    @DisplayName("expired snapshot triggers exactly one refresh")
    void refreshAfterTtl() {
        AtomicInteger cycles = new AtomicInteger();
        when(aggregator.aggregate(anyList())).thenAnswer(inv -> Mono.fromSupplier(() -> snapshot(cycles.incrementAndGet())));

        assertThat(cache.getSnapshot().block().timestamp()).isEqualTo(1);
        clock.advance(Duration.ofSeconds(60));
        assertThat(cache.getSnapshot().block().timestamp()).isEqualTo(2);
        assertThat(cache.getSnapshot().block().timestamp()).isEqualTo(2);

        verify(aggregator, times(2)).aggregate(anyList());
    }

    @Test
    @DisplayName("callers arriving during a refresh share it")
    void singleFlight() throws Exception {
        Sinks.One<Snapshot> pending = Sinks.one();
        when(aggregator.aggregate(anyList())).thenReturn(pending.asMono());

        CompletableFuture<Snapshot> a = cache.getSnapshot().toFuture();
        CompletableFuture<Snapshot> b = cache.getSnapshot().toFuture();
        CompletableFuture<Snapshot> c = cache.getSnapshot().toFuture();
        assertThat(a).isNotDone();

        Snapshot built = snapshot(42);
        pending.tryEmitValue(built);

        assertThat(a.get(1, TimeUnit.SECONDS)).isSameAs(built);
        assertThat(b.get(1, TimeUnit.SECONDS)).isSameAs(built);
        assertThat(c.get(1, TimeUnit.SECONDS)).isSameAs(built);
        verify(aggregator, times(1)).aggregate(anyList());
    }

    @Test
    @DisplayName("a cancelled waiter does not cancel the shared refresh")
    void cancelledWaiter() {
        Sinks.One<Snapshot> pending = Sinks.one();
        when(aggregator.aggregate(anyList())).thenReturn(pending.asMono());

        cache.getSnapshot().subscribe().dispose();
        CompletableFuture<Snapshot> other = cache.getSnapshot().toFuture();
        pending.tryEmitValue(snapshot(7));

        assertThat(other.join().timestamp()).isEqualTo(7);
        assertThat(cache.cacheAgeSeconds()).contains(0L);
        verify(aggregator, times(1)).aggregate(anyList());
    }

    @Test
    @DisplayName("cache age is empty before the first snapshot, then counts whole seconds")
    void cacheAge() {
        when(aggregator.aggregate(anyList())).thenReturn(Mono.just(snapshot(1)));

        assertThat(cache.cacheAgeSeconds()).isEmpty();
        cache.getSnapshot().block();
        assertThat(cache.cacheAgeSeconds()).contains(0L);
        clock.advance(Duration.ofMillis(12_900));
        assertThat(cache.cacheAgeSeconds()).contains(12L);
    }

    @Test
    @DisplayName("failed refresh propagates and the next call retries")
    void failureClearsInFlight() {
        when(aggregator.aggregate(anyList()))
                .thenReturn(Mono.error(new IllegalStateException("boom")))
                .thenReturn(Mono.just(snapshot(3)));

        StepVerifier.create(cache.getSnapshot())
                .expectErrorMessage("boom")
                .verify();
        assertThat(cache.cacheAgeSeconds()).isEmpty();

        StepVerifier.create(cache.getSnapshot())
                .assertNext(s -> assertThat(s.timestamp()).isEqualTo(3))
                .verifyComplete();
    }

    @Test
    @DisplayName("aggregator throwing before returning a Mono still clears the in-flight refresh")
    void synchronousThrowClearsInFlight() {
        when(aggregator.aggregate(anyList()))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(Mono.just(snapshot(3)));

        StepVerifier.create(cache.getSnapshot())
                .expectErrorMessage("boom")
                .verify(Duration.ofSeconds(2));

        StepVerifier.create(cache.getSnapshot())
                .assertNext(s -> assertThat(s.timestamp()).isEqualTo(3))
                .expectComplete()
                .verify(Duration.ofSeconds(2));
        verify(aggregator, times(2)).aggregate(anyList());
    }

    @Test
    @DisplayName("getSnapshot does nothing until subscribed")
    void lazy() {
        cache.getSnapshot();

        verify(aggregator, times(0)).aggregate(anyList());
    }
}
