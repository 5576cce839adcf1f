package com.priceradar.api.dto;

/**
 * GET /verify/{hash} response: instructions for checking a hash against the attestation contract.
 */
public record VerifyResponse(
        String hash,
        boolean wellFormed,
        String note,
        String contract,
        String network,
        String howToVerify
) {
}
