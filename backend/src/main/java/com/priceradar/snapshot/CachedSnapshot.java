package com.priceradar.snapshot;

import com.priceradar.domain.Snapshot;

import java.time.Instant;

/**
 * The single cache slot: a snapshot and the instant it was stored.
 */
record CachedSnapshot(Snapshot snapshot, Instant storedAt) {
}
