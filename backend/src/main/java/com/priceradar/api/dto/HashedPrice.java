package com.priceradar.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.priceradar.domain.ReconciledPrice;

import java.util.List;
import java.util.Map;

/**
 * A reconciled price as served inside GET /snapshot, with its data hash attached.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HashedPrice(
        double price,
        int sourceCount,
        List<String> sources,
        int confidence,
        int divergenceBps,
        String warning,
        Double change24h,
        Double marketCap,
        Map<String, Double> sourcePrices,
        String dataHash
) {

    public static HashedPrice of(ReconciledPrice p, String dataHash) {
        return new HashedPrice(p.price(), p.sourceCount(), p.sources(), p.confidence(), p.divergenceBps(),
                p.warning(), p.change24h(), p.marketCap(), p.sourcePrices(), dataHash);
    }
}
