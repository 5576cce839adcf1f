package com.priceradar.source;

import com.priceradar.domain.ChainTvl;
import com.priceradar.domain.ChainTvlRanking;
import com.priceradar.source.config.SourceProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChainTvlSourceTest {

    @Test
    @DisplayName("ranks chains by TVL descending and keeps the top N")
    void fetchTopN() {
        List<URI> requested = new ArrayList<>();
        String body = """
                [
                  {"name": "Arbitrum", "tvl": 2.5e9},
                  {"name": "Ethereum", "tvl": 6.0e10},
                  {"name": "Tron", "tvl": 8.1e9},
                  {"name": "NoTvl"},
                  {"tvl": 9e12}
                ]
                """;
        SourceProperties properties = StubWebClients.properties();
        properties.setTvlTopN(3);
        ChainTvlSource source = new ChainTvlSource(StubWebClients.ok(body, requested), StubWebClients.MAPPER, properties);

        StepVerifier.create(source.fetch())
                .assertNext(ranking -> {
                    assertThat(ranking.source()).isEqualTo("defillama");
                    assertThat(ranking.chains()).extracting(ChainTvl::chain)
                            .containsExactly("Ethereum", "Tron", "Arbitrum");
                })
                .verifyComplete();
        assertThat(requested).extracting(URI::toString).containsExactly("https://llama.test/v2/chains");
    }

    @Test
    @DisplayName("chains without tvl count as zero")
    void missingTvl() throws Exception {
        ChainTvlRanking ranking = ChainTvlSource.parse(StubWebClients.MAPPER.readTree("""
                [{"name": "NoTvl"}, {"name": "Base", "tvl": 1.0}]
                """), 15);

        assertThat(ranking.chains()).containsExactly(new ChainTvl("Base", 1.0), new ChainTvl("NoTvl", 0));
    }

    @Test
    @DisplayName("non-array body completes empty")
    void notAnArray() {
        ChainTvlSource source = new ChainTvlSource(
                StubWebClients.ok("{\"message\": \"rate limited\"}", new ArrayList<>()),
                StubWebClients.MAPPER, StubWebClients.properties());

        StepVerifier.create(source.fetch()).verifyComplete();
    }
}
