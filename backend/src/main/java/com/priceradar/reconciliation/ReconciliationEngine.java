package com.priceradar.reconciliation;

import com.priceradar.domain.ReconciledPrice;
import com.priceradar.domain.SourceQuote;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Cross-verifies the two spot price sources for one ticker: mean price, divergence in basis points and a
 * confidence score from a fixed table. Pure; no I/O.
 */
@Component
public class ReconciliationEngine {

    public static final int SINGLE_SOURCE_CONFIDENCE = 60;
    public static final int WARNING_THRESHOLD_BPS = 300;

    /** Upper divergence bound (inclusive) to confidence, ascending. Anything above the last bound scores {@link #FLOOR_CONFIDENCE}. */
    private static final int[][] CONFIDENCE_TABLE = {
            {10, 99},
            {50, 95},
            {100, 85},
            {300, 70}
    };
    private static final int FLOOR_CONFIDENCE = 40;

    /**
     * Reconcile the quotes both sources produced for {@code ticker}. Empty when neither source quoted it.
     *
     * @param first  quotes of the first price source, keyed by uppercase ticker
     * @param second quotes of the second price source, keyed by uppercase ticker
     */
    public Optional<ReconciledPrice> reconcile(Map<String, SourceQuote> first,
                                               Map<String, SourceQuote> second,
                                               String ticker) {
        if (ticker == null || ticker.isBlank()) {
            return Optional.empty();
        }
        String key = ticker.strip().toUpperCase(Locale.ROOT);
        SourceQuote a = first == null ? null : first.get(key);
        SourceQuote b = second == null ? null : second.get(key);
        return reconcile(a, b);
    }

    /**
     * Reconcile two optional quotes for the same asset; either may be null.
     */
    public Optional<ReconciledPrice> reconcile(SourceQuote a, SourceQuote b) {
        if (a == null && b == null) {
            return Optional.empty();
        }
        if (a == null || b == null) {
            SourceQuote only = a != null ? a : b;
            return Optional.of(new ReconciledPrice(
                    only.price(),
                    1,
                    List.of(only.source()),
                    SINGLE_SOURCE_CONFIDENCE,
                    0,
                    null,
                    only.change24h(),
                    only.marketCap(),
                    null));
        }

        double mean = (a.price() + b.price()) / 2;
        int bps = divergenceBps(a.price(), b.price());
        String warning = bps > WARNING_THRESHOLD_BPS
                ? "HIGH DIVERGENCE: " + bps + "bps between sources"
                : null;

        // ancillary fields come from whichever quote carries them; they are never averaged
        SourceQuote ancillary = a.change24h() != null || a.marketCap() != null ? a : b;

        Map<String, Double> sourcePrices = new LinkedHashMap<>();
        sourcePrices.put(a.source(), a.price());
        sourcePrices.put(b.source(), b.price());

        return Optional.of(new ReconciledPrice(
                mean,
                2,
                List.of(a.source(), b.source()),
                confidenceFor(bps),
                bps,
                warning,
                ancillary.change24h(),
                ancillary.marketCap(),
                sourcePrices));
    }

    /**
     * |a - b| relative to their mean, in basis points, rounded half up.
     */
    public static int divergenceBps(double a, double b) {
        double mean = (a + b) / 2;
        if (mean == 0) {
            return 0;
        }
        return (int) Math.round(Math.abs(a - b) / mean * 10_000);
    }

    /**
     * Confidence for a two-source divergence. Monotonically non-increasing in {@code divergenceBps}.
     */
    public static int confidenceFor(int divergenceBps) {
        for (int[] row : CONFIDENCE_TABLE) {
            if (divergenceBps <= row[0]) {
                return row[1];
            }
        }
        return FLOOR_CONFIDENCE;
    }
}
