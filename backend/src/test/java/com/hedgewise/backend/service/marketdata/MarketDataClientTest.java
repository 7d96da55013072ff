package com.hedgewise.backend.service.marketdata;

import com.hedgewise.backend.config.MarketDataProperties;
import com.hedgewise.backend.exception.DataUnavailableException;
import com.hedgewise.backend.util.FakeMarketDataProvider;
import com.hedgewise.backend.util.RiskFixtures;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MarketDataClientTest {

    private final FakeMarketDataProvider provider = new FakeMarketDataProvider()
            .withRate("EUR", "USD", 1.1)
            .withRate("CHF", "USD", -1.0)
            .withHistory("EUR", List.of(1.0, 1.01, 1.02))
            .withHistory("GBP", List.of());

    @Test
    void sameCurrencyNeedsNoLookup() {
        MarketDataClient client = RiskFixtures.client(provider);

        assertThat(client.getExchangeRate("USD", "USD")).isEqualTo(1.0);
        assertThat(client.getExchangeRate("EUR", "USD")).isEqualTo(1.1);
    }

    @Test
    void providerFailureBecomesDataUnavailable() {
        MarketDataClient client = RiskFixtures.client(provider);

        assertThatThrownBy(() -> client.getExchangeRate("BRL", "USD"))
                .isInstanceOf(DataUnavailableException.class)
                .hasMessageContaining("BRL");
        assertThatThrownBy(() -> client.getExchangeRate("CHF", "USD"))
                .isInstanceOf(DataUnavailableException.class)
                .hasMessageContaining("unusable rate");
    }

    @Test
    void emptyHistoryIsUnavailable() {
        MarketDataClient client = RiskFixtures.client(provider);

        assertThat(client.fetchHistoricalPrices("EUR", "USD", 90).join()).hasSize(3);
        assertThatThrownBy(() -> client.fetchHistoricalPrices("GBP", "USD", 90).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(DataUnavailableException.class);
    }

    @Test
    void openCircuitRejectsCallsWithoutReachingProvider() {
        CircuitBreaker breaker = CircuitBreaker.ofDefaults("market-data-test");
        breaker.transitionToOpenState();
        MarketDataClient client = new MarketDataClient(provider, breaker, RiskFixtures.DIRECT, new MarketDataProperties());

        assertThatThrownBy(() -> client.getExchangeRate("EUR", "USD"))
                .isInstanceOf(DataUnavailableException.class)
                .hasMessageContaining("market data circuit open");
        assertThatThrownBy(() -> client.fetchHistoricalPrices("EUR", "USD", 90).join())
                .hasCauseInstanceOf(DataUnavailableException.class)
                .hasMessageContaining("market data circuit open");
        assertThat(provider.historyCalls()).isZero();
    }

    @Test
    void slowProviderTimesOut() {
        MarketDataProvider slow = new FakeMarketDataProvider() {
            @Override
            public double getExchangeRate(String from, String to) {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return 1.0;
            }
        };
        MarketDataProperties properties = new MarketDataProperties();
        properties.setTimeoutMs(50);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            MarketDataClient client = new MarketDataClient(slow, CircuitBreaker.ofDefaults("slow"), pool, properties);

            assertThatThrownBy(() -> client.getExchangeRate("EUR", "USD"))
                    .isInstanceOf(DataUnavailableException.class)
                    .hasMessageContaining("timed out after 50 ms");
        } finally {
            pool.shutdownNow();
        }
    }
}
