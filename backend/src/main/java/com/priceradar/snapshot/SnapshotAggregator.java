package com.priceradar.snapshot;

import com.priceradar.domain.ChainTvlRanking;
import com.priceradar.domain.FearGreedIndex;
import com.priceradar.domain.GasPrices;
import com.priceradar.domain.ReconciledPrice;
import com.priceradar.domain.Snapshot;
import com.priceradar.domain.SourceQuote;
import com.priceradar.domain.StablecoinRanking;
import com.priceradar.reconciliation.ReconciliationEngine;
import com.priceradar.source.ChainTvlSource;
import com.priceradar.source.CoinGeckoSpotPriceSource;
import com.priceradar.source.DefiLlamaSpotPriceSource;
import com.priceradar.source.FearGreedSource;
import com.priceradar.source.GasPriceSource;
import com.priceradar.source.StablecoinSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * One aggregation cycle: fetch every source concurrently, wait for all of them to settle, then reconcile
 * the two spot price sources per requested ticker.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SnapshotAggregator {

    private final CoinGeckoSpotPriceSource coinGecko;
    private final DefiLlamaSpotPriceSource defiLlama;
    private final FearGreedSource fearGreedSource;
    private final ChainTvlSource chainTvlSource;
    private final StablecoinSource stablecoinSource;
    private final GasPriceSource gasPriceSource;
    private final ReconciliationEngine reconciliationEngine;
    private final Clock clock;

    /**
     * Runs one cycle for {@code assets}. Sources never error, so the join always completes; a degraded domain
     * source leaves its block null and a ticker no source quoted is left out of prices.
     */
    public Mono<Snapshot> aggregate(List<String> assets) {
        List<String> tickers = assets.stream()
                .map(a -> a.strip().toUpperCase(Locale.ROOT))
                .distinct()
                .toList();
        return Mono.zip(
                        coinGecko.fetchQuotes(tickers),
                        defiLlama.fetchQuotes(tickers),
                        optional(fearGreedSource.fetch()),
                        optional(chainTvlSource.fetch()),
                        optional(stablecoinSource.fetch()),
                        optional(gasPriceSource.fetch()))
                .map(t -> build(tickers, t.getT1(), t.getT2(),
                        t.getT3().orElse(null), t.getT4().orElse(null), t.getT5().orElse(null), t.getT6().orElse(null)));
    }

    private Snapshot build(List<String> tickers,
                           Map<String, SourceQuote> first,
                           Map<String, SourceQuote> second,
                           FearGreedIndex fearGreed,
                           ChainTvlRanking tvl,
                           StablecoinRanking stablecoins,
                           GasPrices gas) {
        Map<String, ReconciledPrice> prices = new LinkedHashMap<>();
        for (String ticker : tickers) {
            reconciliationEngine.reconcile(first, second, ticker)
                    .ifPresent(p -> prices.put(ticker, p));
        }
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Snapshot snapshot = new Snapshot(
                now.getEpochSecond(),
                DateTimeFormatter.ISO_INSTANT.format(now),
                prices,
                fearGreed,
                tvl,
                stablecoins,
                gas);
        log.info("Snapshot built at {}: {}/{} assets priced (coingecko={}, defillama={}), degraded blocks: {}",
                snapshot.iso(), prices.size(), tickers.size(), first.size(), second.size(), degradedBlocks(snapshot));
        return snapshot;
    }

    private static <T> Mono<Optional<T>> optional(Mono<T> source) {
        return source.map(Optional::of).defaultIfEmpty(Optional.empty());
    }

    private static List<String> degradedBlocks(Snapshot s) {
        Map<String, Object> blocks = new LinkedHashMap<>();
        blocks.put("fearGreed", s.fearGreed());
        blocks.put("tvl", s.tvl());
        blocks.put("stablecoins", s.stablecoins());
        blocks.put("gas", s.gas());
        return blocks.entrySet().stream()
                .filter(e -> e.getValue() == null)
                .map(Map.Entry::getKey)
                .toList();
    }
}
