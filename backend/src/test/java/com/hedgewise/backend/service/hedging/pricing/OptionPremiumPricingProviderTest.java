package com.hedgewise.backend.service.hedging.pricing;

import com.hedgewise.backend.config.HedgingProperties;
import com.hedgewise.backend.model.HedgeInstrument;
import com.hedgewise.backend.model.InstrumentType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.data.Offset.offset;

class OptionPremiumPricingProviderTest {

    private final HedgingProperties properties = new HedgingProperties();
    private final OptionPremiumPricingProvider provider = new OptionPremiumPricingProvider(properties.getPricing());

    @Test
    void nonOptionInstrumentsKeepCatalogCost() {
        HedgeInstrument forward = properties.instrument(InstrumentType.FORWARD_CONTRACT).orElseThrow();

        assertThat(provider.cost(forward, 100_000, 90, 0.3)).isCloseTo(100.0, offset(1e-9));
    }

    @Test
    void optionWithoutVolatilityIsWorthItsIntrinsicValue() {
        HedgeInstrument option = properties.instrument(InstrumentType.CURRENCY_OPTION).orElseThrow();

        assertThat(provider.premiumFraction(0.98, 0.0, 0.25)).isCloseTo(0.02, offset(1e-12));
        assertThat(provider.cost(option, 100_000, 90, 0.0)).isCloseTo(2_000.0, offset(1e-6));
    }

    @Test
    void premiumGrowsWithVolatilityAndTenor() {
        double calm = provider.premiumFraction(0.98, 0.05, 0.25);
        double stormy = provider.premiumFraction(0.98, 0.25, 0.25);
        double longer = provider.premiumFraction(0.98, 0.25, 1.0);

        assertThat(calm).isGreaterThan(0.02);
        assertThat(stormy).isGreaterThan(calm);
        assertThat(longer).isGreaterThan(stormy);
        assertThat(longer).isLessThan(1.0);
    }

    @Test
    void catalogCostIsTheFloor() {
        HedgeInstrument option = HedgeInstrument.builder()
                .type(InstrumentType.CURRENCY_OPTION)
                .costBasisPoints(1_000)
                .effectiveness(0.85)
                .minimumAmount(0)
                .maximumTenorDays(365)
                .build();

        assertThat(provider.cost(option, 100_000, 30, 0.05)).isCloseTo(10_000.0, offset(1e-9));
    }
}
