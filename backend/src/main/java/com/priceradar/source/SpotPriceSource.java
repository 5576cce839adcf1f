package com.priceradar.source;

import com.priceradar.domain.SourceQuote;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Map;

/**
 * A provider of current USD prices. Implementations never signal an error: a failed fetch yields an empty map.
 */
public interface SpotPriceSource {

    String sourceId();

    /**
     * Quotes for the requested tickers, keyed by uppercase ticker. Tickers without a provider id are skipped.
     */
    Mono<Map<String, SourceQuote>> fetchQuotes(Collection<String> tickers);
}
