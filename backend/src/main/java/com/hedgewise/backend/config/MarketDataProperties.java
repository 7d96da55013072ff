package com.hedgewise.backend.config;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "market-data")
@Data
@Validated
public class MarketDataProperties {

    @Positive
    private long timeoutMs = 5_000L;

    private Resilience resilience = new Resilience();

    /**
     * Reference rates keyed "FROM-TO", consumed by the bundled static provider.
     */
    private Map<String, Double> referenceRates = defaultRates();

    private long syntheticSeed = 42L;

    @Data
    public static class Resilience {
        @Positive
        private float failureRateThreshold = 50.0f;

        @Positive
        private long waitOpenSeconds = 30L;

        @Positive
        private int slidingWindowSize = 20;
    }

    private static Map<String, Double> defaultRates() {
        Map<String, Double> rates = new LinkedHashMap<>();
        rates.put("EUR-USD", 1.08);
        rates.put("GBP-USD", 1.25);
        rates.put("JPY-USD", 0.0067);
        rates.put("CAD-USD", 0.74);
        rates.put("AUD-USD", 0.66);
        rates.put("CHF-USD", 1.09);
        return rates;
    }
}
