package com.priceradar.snapshot.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot cache configuration. Documented in application.yml under priceradar.snapshot.
 */
@ConfigurationProperties(prefix = "priceradar.snapshot")
@Getter
@Setter
public class SnapshotProperties {

    /**
     * Age in seconds below which the cached snapshot is served without contacting upstreams.
     */
    private int ttlSeconds = 60;

    /**
     * Tracked tickers, in the order they appear in the snapshot.
     */
    private List<String> assets = new ArrayList<>(List.of(
            "BTC", "ETH", "SOL", "BNB", "XRP", "LINK", "AAVE", "ARB", "OP", "UNI"));
}
