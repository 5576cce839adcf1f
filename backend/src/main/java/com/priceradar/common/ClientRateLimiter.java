package com.priceradar.common;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

/**
 * Per-client sliding-window limiter: at most {@code quota} admitted calls per client within the trailing window.
 * Rejected attempts are not recorded. Idle client windows are dropped from memory after one window.
 */
public class ClientRateLimiter {

    private final int quota;
    private final Duration window;
    private final Clock clock;
    private final Cache<String, Deque<Long>> windows;

    /**
     * @param quota  admitted calls per client per window, e.g. 30
     * @param window trailing window length, e.g. 1 hour
     */
    public ClientRateLimiter(int quota, Duration window, Clock clock) {
        if (quota <= 0) {
            throw new IllegalArgumentException("quota must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.quota = quota;
        this.window = window;
        this.clock = clock;
        this.windows = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .expireAfterAccess(window)
                .build();
    }

    /**
     * Returns true and records the call if the client is under quota; false otherwise.
     */
    public boolean admit(String clientId) {
        Deque<Long> calls = windows.get(clientId, k -> new ArrayDeque<>());
        long now = clock.millis();
        long cutoff = now - window.toMillis();
        synchronized (calls) {
            while (!calls.isEmpty() && calls.peekFirst() <= cutoff) {
                calls.pollFirst();
            }
            if (calls.size() >= quota) {
                return false;
            }
            calls.addLast(now);
            return true;
        }
    }

    /** Clients with a live window, after evicting idle ones. */
    long trackedClients() {
        windows.cleanUp();
        return windows.estimatedSize();
    }

    public int getQuota() {
        return quota;
    }

    public Duration getWindow() {
        return window;
    }
}
