package com.hedgewise.backend.config;

import com.hedgewise.backend.model.HedgeInstrument;
import com.hedgewise.backend.model.InstrumentType;
import com.hedgewise.backend.model.LiquidityTier;
import com.hedgewise.backend.model.StrategyProfile;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Configuration
@ConfigurationProperties(prefix = "hedging")
@Data
@Validated
public class HedgingProperties {

    @Valid
    private Needs needs = new Needs();

    @Valid
    private Combination combination = new Combination();

    @Valid
    private Basket basket = new Basket();

    @Valid
    private NaturalHedge naturalHedge = new NaturalHedge();

    @Valid
    private Optimizer optimizer = new Optimizer();

    @Valid
    private Cost cost = new Cost();

    @Valid
    private Ranking ranking = new Ranking();

    @Valid
    private Pricing pricing = new Pricing();

    @Valid
    private List<MacroScenario> scenarios = defaultScenarios();

    private Map<StrategyProfile, Profile> profiles = defaultProfiles();

    @Valid
    @NotEmpty
    private List<HedgeInstrument> instruments = defaultCatalog();

    public Optional<HedgeInstrument> instrument(InstrumentType type) {
        return instruments.stream().filter(instrument -> instrument.getType() == type).findFirst();
    }

    @Data
    public static class Needs {
        @Positive
        private double highConcentration = 0.25;
        private double highRatioMultiplier = 2.0;
        private double highMaxRatio = 0.8;
        @Min(1)
        private int highHorizonDays = 90;

        @Positive
        private double mediumVolatility = 0.20;
        private double mediumRatioMultiplier = 2.0;
        private double mediumMaxRatio = 0.6;
        @Min(1)
        private int mediumHorizonDays = 180;

        @Positive
        private double lowConcentration = 0.15;
        @Positive
        private double lowVolatility = 0.15;
        private double lowRatioMultiplier = 1.5;
        private double lowMaxRatio = 0.4;
        @Min(1)
        private int lowHorizonDays = 365;
    }

    @Data
    public static class Combination {
        private boolean enabled = true;

        @PositiveOrZero
        private double minExposure = 100_000.0;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double forwardPortion = 0.7;
    }

    @Data
    public static class Basket {
        private boolean enabled = true;

        @Min(2)
        private int minNeeds = 3;

        /**
         * Fraction of the swap cost charged on the combined basket notional. 0.2 is an 80% discount.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double costMultiplier = 0.2;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double effectiveness = 0.75;
    }

    @Data
    public static class NaturalHedge {
        private boolean enabled = true;

        /**
         * Pairs correlated below this value qualify as natural hedges.
         */
        @DecimalMax("0.0")
        private double maxCorrelation = 0.0;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double effectiveness = 0.7;

        /**
         * Used only for currencies without computed correlation data, as "CCY/CCY".
         */
        private List<String> fallbackPairs = new ArrayList<>(List.of("JPY/AUD", "CHF/AUD", "JPY/BRL"));
    }

    @Data
    public static class Optimizer {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minRatio = 0.25;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double maxRatio = 1.0;

        @Positive
        private double gridStep = 0.1;

        @Positive
        private double epsilon = 0.001;

        @Positive
        private double learningRate = 0.05;

        @Positive
        private double convergenceThreshold = 0.0001;

        @Min(0)
        private int maxIterations = 1000;

        @PositiveOrZero
        private double moderationPenalty = 0.0;

        @Positive
        private double costNormalization = 0.05;

        private double riskReductionWeight = 0.6;
        private double costWeight = 0.3;
        private double effectivenessWeight = 0.1;
    }

    @Data
    public static class Cost {
        @PositiveOrZero
        private double opportunityRate = 0.02;

        @PositiveOrZero
        private double transactionFixedFee = 25.0;

        @PositiveOrZero
        private double transactionVariableBps = 1.0;
    }

    @Data
    public static class Ranking {
        private double benefitCostWeight = 0.3;
        private double riskReductionWeight = 0.3;
        private double effectivenessWeight = 0.2;
        private double liquidityWeight = 0.1;
        private double simplicityWeight = 0.1;
    }

    @Data
    public static class Pricing {
        private PricingModel model = PricingModel.BASIS_POINTS;

        @PositiveOrZero
        private double riskFreeRate = 0.02;

        @PositiveOrZero
        @Max(1)
        private double strikeOffset = 0.02;
    }

    public enum PricingModel {
        BASIS_POINTS,
        OPTION_PREMIUM
    }

    @Data
    public static class MacroScenario {
        @NotBlank
        private String name;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double probability;

        private double marketMove;

        public static MacroScenario of(String name, double probability, double marketMove) {
            MacroScenario scenario = new MacroScenario();
            scenario.setName(name);
            scenario.setProbability(probability);
            scenario.setMarketMove(marketMove);
            return scenario;
        }
    }

    @Data
    public static class Profile {
        private Set<InstrumentType> instrumentTypes = EnumSet.allOf(InstrumentType.class);
        private double minRatio = 0.25;
        private double maxRatio = 1.0;

        public static Profile of(Set<InstrumentType> types, double minRatio, double maxRatio) {
            Profile profile = new Profile();
            profile.setInstrumentTypes(EnumSet.copyOf(types));
            profile.setMinRatio(minRatio);
            profile.setMaxRatio(maxRatio);
            return profile;
        }
    }

    private static List<MacroScenario> defaultScenarios() {
        List<MacroScenario> scenarios = new ArrayList<>();
        scenarios.add(MacroScenario.of("Base case", 0.50, -0.02));
        scenarios.add(MacroScenario.of("Adverse", 0.25, -0.10));
        scenarios.add(MacroScenario.of("Favorable", 0.20, 0.05));
        scenarios.add(MacroScenario.of("Extreme adverse", 0.05, -0.25));
        return scenarios;
    }

    private static Map<StrategyProfile, Profile> defaultProfiles() {
        Map<StrategyProfile, Profile> profiles = new EnumMap<>(StrategyProfile.class);
        profiles.put(StrategyProfile.CONSERVATIVE,
                Profile.of(EnumSet.of(InstrumentType.FORWARD_CONTRACT, InstrumentType.CURRENCY_SWAP), 0.6, 1.0));
        profiles.put(StrategyProfile.BALANCED,
                Profile.of(EnumSet.of(InstrumentType.FORWARD_CONTRACT, InstrumentType.CURRENCY_OPTION), 0.4, 0.8));
        profiles.put(StrategyProfile.AGGRESSIVE,
                Profile.of(EnumSet.of(InstrumentType.CURRENCY_OPTION), 0.25, 0.5));
        profiles.put(StrategyProfile.DYNAMIC,
                Profile.of(EnumSet.allOf(InstrumentType.class), 0.25, 1.0));
        return profiles;
    }

    private static List<HedgeInstrument> defaultCatalog() {
        List<HedgeInstrument> catalog = new ArrayList<>();
        catalog.add(HedgeInstrument.builder()
                .type(InstrumentType.FORWARD_CONTRACT)
                .costBasisPoints(10.0)
                .effectiveness(0.95)
                .minimumAmount(10_000.0)
                .maximumTenorDays(365)
                .liquidity(LiquidityTier.HIGH)
                .build());
        catalog.add(HedgeInstrument.builder()
                .type(InstrumentType.CURRENCY_OPTION)
                .costBasisPoints(150.0)
                .effectiveness(0.85)
                .minimumAmount(25_000.0)
                .maximumTenorDays(365)
                .liquidity(LiquidityTier.MEDIUM)
                .build());
        catalog.add(HedgeInstrument.builder()
                .type(InstrumentType.CURRENCY_SWAP)
                .costBasisPoints(20.0)
                .effectiveness(0.85)
                .minimumAmount(100_000.0)
                .maximumTenorDays(1825)
                .liquidity(LiquidityTier.MEDIUM)
                .build());
        return catalog;
    }
}
