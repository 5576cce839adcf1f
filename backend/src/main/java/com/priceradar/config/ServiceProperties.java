package com.priceradar.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Public service identity and attestation details served by / and /verify. Documented in application.yml
 * under priceradar.service and priceradar.attestation.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "priceradar")
public class ServiceProperties {

    private Service service = new Service();
    private Attestation attestation = new Attestation();

    @Getter
    @Setter
    public static class Service {
        private String name = "PriceRadar";
        private String version = "1.0.0";
        private String description = "Cross-verified crypto price oracle";
    }

    @Getter
    @Setter
    public static class Attestation {
        /** Attestation contract the operator publishes data hashes to (env CONTRACT_ADDRESS). */
        private String contractAddress = "0xF30C7624f5d759e3695738374Ff2D1618E92F12C";
        private String network = "Base Sepolia";
    }
}
