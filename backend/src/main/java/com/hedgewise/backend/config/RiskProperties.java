package com.hedgewise.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "risk")
@Data
@Validated
public class RiskProperties {

    @NotEmpty
    private List<@DecimalMin("0.5") @DecimalMax("0.9999") Double> confidenceLevels = new ArrayList<>(List.of(0.95, 0.99));

    @Valid
    private Lookback lookback = new Lookback();

    @Min(2)
    private int retainedReturns = 30;

    @Positive
    private double defaultAnnualVolatility = 0.15;

    @Valid
    private MonteCarlo monteCarlo = new MonteCarlo();

    @Positive
    @Max(1)
    private double correlationThreshold = 0.7;

    @Positive
    @Max(1)
    private double highCorrelationThreshold = 0.8;

    @Positive
    @Max(1)
    private double concentrationThreshold = 0.25;

    @Positive
    private double highVolatilityThreshold = 0.20;

    @Valid
    private Alerts alerts = new Alerts();

    @Valid
    private Staleness staleness = new Staleness();

    @Valid
    private List<StressScenario> stressScenarios = defaultStressScenarios();

    @Data
    public static class Lookback {
        @Min(3)
        private int shortDays = 30;

        @Min(3)
        private int mediumDays = 90;

        @Min(3)
        private int longDays = 252;

        private Window window = Window.MEDIUM;

        public int selectedDays() {
            return switch (window) {
                case SHORT -> shortDays;
                case MEDIUM -> mediumDays;
                case LONG -> longDays;
            };
        }
    }

    public enum Window {
        SHORT,
        MEDIUM,
        LONG
    }

    @Data
    public static class MonteCarlo {
        @Min(100)
        private int trials = 10_000;

        @Min(1)
        private int batchSize = 1_000;

        /**
         * Fixed seed for reproducible simulations; a time-based seed is used when unset.
         */
        private Long seed;

        private boolean correlated = false;
    }

    @Data
    public static class Alerts {
        private boolean enabled = true;

        @Positive
        private double varThreshold = 100_000.0;

        @Positive
        private double concentrationThreshold = 0.4;
    }

    @Data
    public static class Staleness {
        private boolean enabled = true;

        @Positive
        private long maxAgeMs = 300_000L;
    }

    @Data
    public static class StressScenario {
        @NotBlank
        private String name;

        private Map<String, Double> shocks = new LinkedHashMap<>();

        public static StressScenario of(String name, Map<String, Double> shocks) {
            StressScenario scenario = new StressScenario();
            scenario.setName(name);
            scenario.setShocks(new LinkedHashMap<>(shocks));
            return scenario;
        }
    }

    private static List<StressScenario> defaultStressScenarios() {
        List<StressScenario> scenarios = new ArrayList<>();
        scenarios.add(StressScenario.of("2008 Financial Crisis", Map.of("EUR", -0.15, "GBP", -0.20, "JPY", 0.10)));
        scenarios.add(StressScenario.of("COVID-19 Pandemic", Map.of("EUR", -0.12, "GBP", -0.18, "AUD", -0.25)));
        scenarios.add(StressScenario.of("Brexit Referendum", Map.of("GBP", -0.30, "EUR", -0.08)));
        scenarios.add(StressScenario.of("Emerging Market Crisis", Map.of("BRL", -0.40, "TRY", -0.35, "ZAR", -0.30)));
        scenarios.add(StressScenario.of("USD Strength", Map.of("EUR", -0.10, "GBP", -0.12, "JPY", -0.08, "CAD", -0.15)));
        return scenarios;
    }
}
