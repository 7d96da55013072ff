package com.hedgewise.backend.service.hedging.pricing;

import com.hedgewise.backend.model.HedgeInstrument;

public class BasisPointPricingProvider implements PricingProvider {

    @Override
    public double cost(HedgeInstrument instrument, double notional, int tenorDays, double annualVolatility) {
        return instrument.costFor(notional);
    }
}
