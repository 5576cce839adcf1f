package com.priceradar.source.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Upstream data source configuration. Documented in application.yml under priceradar.sources.
 */
@ConfigurationProperties(prefix = "priceradar.sources")
@Getter
@Setter
public class SourceProperties {

    /**
     * CoinGecko API base URL (free: https://api.coingecko.com/api/v3).
     */
    private String coingeckoBaseUrl = "https://api.coingecko.com/api/v3";

    /**
     * DeFiLlama coins (price) API base URL.
     */
    private String defillamaCoinsBaseUrl = "https://coins.llama.fi";

    /**
     * DeFiLlama main API base URL (chain TVL).
     */
    private String defillamaApiBaseUrl = "https://api.llama.fi";

    /**
     * DeFiLlama stablecoins API base URL.
     */
    private String stablecoinsBaseUrl = "https://stablecoins.llama.fi";

    /**
     * alternative.me Fear &amp; Greed API base URL.
     */
    private String fearGreedBaseUrl = "https://api.alternative.me";

    /**
     * Etherscan API endpoint (gas oracle).
     */
    private String etherscanBaseUrl = "https://api.etherscan.io/api";

    /**
     * Optional Etherscan API key; appended as apikey when set.
     */
    private String etherscanApiKey = "";

    private String userAgent = "PriceRadar/1.0";

    /**
     * Connect timeout in seconds for the upstream HTTP client.
     */
    private int connectTimeoutSeconds = 5;

    /**
     * Upper bound in seconds for one upstream fetch, connect to last byte. A timed-out fetch counts as unavailable.
     */
    private int requestTimeoutSeconds = 10;

    /**
     * Largest upstream response body buffered in memory. The stablecoin listing is several MB.
     */
    private int maxResponseBytes = 16 * 1024 * 1024;

    /**
     * Local outbound budget per source. Calls beyond it degrade to no data; they are not queued.
     */
    private int upstreamRequestsPerMinute = 30;

    private int tvlTopN = 15;

    private int stablecoinTopN = 10;

    /**
     * Ticker (uppercase) -> CoinGecko coin id, e.g. BTC -> bitcoin. Unmapped tickers are skipped.
     */
    private Map<String, String> coingeckoIds = new LinkedHashMap<>();

    /**
     * Ticker (uppercase) -> DeFiLlama coin key, e.g. BTC -> coingecko:bitcoin. Unmapped tickers are skipped.
     */
    private Map<String, String> defillamaIds = new LinkedHashMap<>();
}
