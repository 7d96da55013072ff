package com.hedgewise.backend.service.hedging.pricing;

import com.hedgewise.backend.config.HedgingProperties;
import com.hedgewise.backend.model.HedgeInstrument;
import com.hedgewise.backend.model.InstrumentType;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Prices option legs at the larger of the catalog cost and a Black-Scholes premium on a unit
 * spot with a slightly in-the-money strike. Other instruments keep their catalog cost.
 */
public class OptionPremiumPricingProvider implements PricingProvider {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private final double riskFreeRate;
    private final double strikeOffset;

    public OptionPremiumPricingProvider(HedgingProperties.Pricing pricing) {
        this.riskFreeRate = pricing.getRiskFreeRate();
        this.strikeOffset = pricing.getStrikeOffset();
    }

    @Override
    public double cost(HedgeInstrument instrument, double notional, int tenorDays, double annualVolatility) {
        double catalogCost = instrument.costFor(notional);
        if (instrument.getType() != InstrumentType.CURRENCY_OPTION) {
            return catalogCost;
        }
        double premium = premiumFraction(1.0 - strikeOffset, annualVolatility, tenorDays / 365.0) * notional;
        return Math.max(catalogCost, premium);
    }

    /**
     * Call premium per unit of notional for spot 1.
     */
    public double premiumFraction(double strike, double volatility, double years) {
        if (volatility <= 0.0 || years <= 0.0) {
            return Math.max(0.0, 1.0 - strike);
        }
        double sqrtT = Math.sqrt(years);
        double d1 = (Math.log(1.0 / strike) + (riskFreeRate + 0.5 * volatility * volatility) * years) / (volatility * sqrtT);
        double d2 = d1 - volatility * sqrtT;
        return STANDARD_NORMAL.cumulativeProbability(d1)
                - strike * Math.exp(-riskFreeRate * years) * STANDARD_NORMAL.cumulativeProbability(d2);
    }
}
