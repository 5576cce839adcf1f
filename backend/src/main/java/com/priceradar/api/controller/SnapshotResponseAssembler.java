package com.priceradar.api.controller;

import com.priceradar.api.dto.HashedPrice;
import com.priceradar.api.dto.PriceResponse;
import com.priceradar.api.dto.PricesResponse;
import com.priceradar.api.dto.SnapshotResponse;
import com.priceradar.domain.ReconciledPrice;
import com.priceradar.domain.Snapshot;
import com.priceradar.reconciliation.DataHasher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds per-request response views over a cached snapshot. Hashes are computed here on every call and
 * written only into the new view, never into the shared snapshot.
 */
@Component
@RequiredArgsConstructor
public class SnapshotResponseAssembler {

    static final String VERIFICATION = "cross-sourced";

    private final DataHasher dataHasher;

    public SnapshotResponse toSnapshotResponse(Snapshot snapshot) {
        Map<String, HashedPrice> prices = new LinkedHashMap<>();
        snapshot.prices().forEach((asset, price) ->
                prices.put(asset, HashedPrice.of(price, hash(asset, price, snapshot))));
        return new SnapshotResponse(
                snapshot.timestamp(),
                snapshot.iso(),
                VERIFICATION,
                prices,
                snapshot.fearGreed(),
                snapshot.tvl(),
                snapshot.stablecoins(),
                snapshot.gas());
    }

    public PriceResponse toPriceResponse(String asset, ReconciledPrice price, Snapshot snapshot) {
        return PriceResponse.of(asset, price, hash(asset, price, snapshot), snapshot.timestamp(), snapshot.iso());
    }

    public PricesResponse toPricesResponse(Snapshot snapshot) {
        return new PricesResponse(snapshot.timestamp(), snapshot.iso(), snapshot.prices());
    }

    private String hash(String asset, ReconciledPrice price, Snapshot snapshot) {
        return dataHasher.dataHash(asset, price.price(), price.sources(), snapshot.timestamp());
    }
}
