package com.hedgewise.backend.config;

import com.hedgewise.backend.service.hedging.pricing.BasisPointPricingProvider;
import com.hedgewise.backend.service.hedging.pricing.OptionPremiumPricingProvider;
import com.hedgewise.backend.service.hedging.pricing.PricingProvider;
import com.hedgewise.backend.service.marketdata.MarketDataProvider;
import com.hedgewise.backend.service.marketdata.StaticMarketDataProvider;
import com.hedgewise.backend.util.RandomSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public RandomSource monteCarloRandomSource(RiskProperties riskProperties) {
        Long seed = riskProperties.getMonteCarlo().getSeed();
        if (seed != null) {
            log.info("Monte Carlo simulations use fixed seed {}", seed);
        }
        return new RandomSource(seed);
    }

    @Bean
    @ConditionalOnMissingBean(MarketDataProvider.class)
    public MarketDataProvider staticMarketDataProvider(MarketDataProperties marketDataProperties) {
        log.info("No market data provider configured, serving {} static reference rates",
                marketDataProperties.getReferenceRates().size());
        return new StaticMarketDataProvider(marketDataProperties);
    }

    @Bean
    public PricingProvider pricingProvider(HedgingProperties hedgingProperties) {
        HedgingProperties.Pricing pricing = hedgingProperties.getPricing();
        if (pricing.getModel() == HedgingProperties.PricingModel.OPTION_PREMIUM) {
            return new OptionPremiumPricingProvider(pricing);
        }
        return new BasisPointPricingProvider();
    }
}
