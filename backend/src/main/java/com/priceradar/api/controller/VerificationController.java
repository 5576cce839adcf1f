package com.priceradar.api.controller;

import com.priceradar.api.dto.VerifyResponse;
import com.priceradar.config.ServiceProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.regex.Pattern;

/**
 * GET /verify/{hash}. Echoes the hash with instructions for checking it against the attestation contract;
 * the ledger itself is never queried here.
 */
@RestController
@RequiredArgsConstructor
public class VerificationController {

    private static final Pattern DATA_HASH = Pattern.compile("^0x[0-9a-f]{64}$");

    private final ServiceProperties serviceProperties;

    @GetMapping("/verify/{hash}")
    public VerifyResponse verify(@PathVariable("hash") String hash) {
        ServiceProperties.Attestation attestation = serviceProperties.getAttestation();
        return new VerifyResponse(
                hash,
                DATA_HASH.matcher(hash).matches(),
                "Verify this hash against the attestation contract on " + attestation.getNetwork(),
                attestation.getContractAddress(),
                attestation.getNetwork(),
                "Call attestations(id).dataHash and compare with this hash");
    }
}
