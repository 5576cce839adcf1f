package com.priceradar.source;

import com.priceradar.domain.GasPrices;
import com.priceradar.source.config.SourceProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GasPriceSourceTest {

    private static final String OK_BODY = """
            {"status": "1", "message": "OK",
             "result": {"LastBlock": "20000000", "SafeGasPrice": "4.21", "ProposeGasPrice": "5", "FastGasPrice": "7.9"}}
            """;

    @Test
    @DisplayName("reads low/standard/fast tiers as whole gwei")
    void fetch() {
        List<URI> requested = new ArrayList<>();
        GasPriceSource source = new GasPriceSource(
                StubWebClients.ok(OK_BODY, requested), StubWebClients.MAPPER, StubWebClients.properties());

        StepVerifier.create(source.fetch())
                .expectNext(new GasPrices(4, 5, 7, "etherscan"))
                .verifyComplete();
        assertThat(requested).extracting(URI::toString)
                .containsExactly("https://etherscan.test/api?module=gastracker&action=gasoracle");
    }

    @Test
    @DisplayName("API key is appended when configured")
    void apiKey() {
        List<URI> requested = new ArrayList<>();
        SourceProperties properties = StubWebClients.properties();
        properties.setEtherscanApiKey(" KEY123 ");
        GasPriceSource source = new GasPriceSource(StubWebClients.ok(OK_BODY, requested), StubWebClients.MAPPER, properties);

        source.fetch().block();

        assertThat(requested.get(0).toString()).endsWith("&apikey=KEY123");
    }

    @Test
    @DisplayName("status other than 1 completes empty")
    void notOk() {
        String body = """
                {"status": "0", "message": "NOTOK", "result": "Max rate limit reached"}
                """;
        GasPriceSource source = new GasPriceSource(
                StubWebClients.ok(body, new ArrayList<>()), StubWebClients.MAPPER, StubWebClients.properties());

        StepVerifier.create(source.fetch()).verifyComplete();
    }
}
