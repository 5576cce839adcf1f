package com.priceradar.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.priceradar.domain.ReconciledPrice;

import java.util.List;
import java.util.Map;

/**
 * GET /price/{asset} response: the reconciled price plus hash, ticker and snapshot time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PriceResponse(
        String asset,
        double price,
        int sourceCount,
        List<String> sources,
        int confidence,
        int divergenceBps,
        String warning,
        Double change24h,
        Double marketCap,
        Map<String, Double> sourcePrices,
        String dataHash,
        long timestamp,
        String iso
) {

    public static PriceResponse of(String asset, ReconciledPrice p, String dataHash, long timestamp, String iso) {
        return new PriceResponse(asset, p.price(), p.sourceCount(), p.sources(), p.confidence(), p.divergenceBps(),
                p.warning(), p.change24h(), p.marketCap(), p.sourcePrices(), dataHash, timestamp, iso);
    }
}
