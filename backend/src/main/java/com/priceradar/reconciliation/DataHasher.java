package com.priceradar.reconciliation;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Deterministic content hash binding asset, merged price, ordered sources and snapshot timestamp.
 * Format: "0x" + lowercase hex SHA-256 of {"asset":..,"price":..,"sources":[..],"timestamp":..},
 * whole-number prices written as integers.
 * The same value is what an operator later publishes to the attestation contract.
 */
@Component
public class DataHasher {

    public static final String PREFIX = "0x";

    private static final ObjectMapper CANONICAL = new ObjectMapper();

    public String dataHash(String asset, double price, List<String> sources, long timestamp) {
        byte[] payload = canonicalJson(asset, price, sources, timestamp).getBytes(StandardCharsets.UTF_8);
        return PREFIX + HexFormat.of().formatHex(sha256().digest(payload));
    }

    static String canonicalJson(String asset, double price, List<String> sources, long timestamp) {
        try {
            return CANONICAL.writeValueAsString(
                    new HashPayload(asset, canonicalNumber(price), List.copyOf(sources), timestamp));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize hash payload for " + asset, e);
        }
    }

    /**
     * Whole prices are written without a fractional part ("67000", not "67000.0"), the way JavaScript
     * clients serialize the same payload when recomputing the hash.
     */
    static Number canonicalNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return (long) value;
        }
        return value;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @JsonPropertyOrder({"asset", "price", "sources", "timestamp"})
    record HashPayload(String asset, Number price, List<String> sources, long timestamp) {
    }
}
