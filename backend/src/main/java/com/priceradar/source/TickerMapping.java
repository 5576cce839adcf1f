package com.priceradar.source;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves requested tickers against a static ticker -&gt; provider id table. Matching ignores case.
 */
final class TickerMapping {

    private TickerMapping() {}

    /**
     * Uppercased, de-duplicated tickers that have a provider id, in request order.
     */
    static Map<String, String> resolve(Collection<String> tickers, Map<String, String> idTable) {
        Map<String, String> mapped = new LinkedHashMap<>();
        if (tickers == null || idTable == null) {
            return mapped;
        }
        Map<String, String> table = new LinkedHashMap<>();
        idTable.forEach((k, v) -> table.put(k.strip().toUpperCase(Locale.ROOT), v));
        for (String ticker : tickers) {
            if (ticker == null || ticker.isBlank()) {
                continue;
            }
            String key = ticker.strip().toUpperCase(Locale.ROOT);
            String id = table.get(key);
            if (id != null && !id.isBlank()) {
                mapped.putIfAbsent(key, id.strip());
            }
        }
        return mapped;
    }
}
