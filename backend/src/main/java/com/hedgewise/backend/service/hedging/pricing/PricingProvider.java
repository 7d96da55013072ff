package com.hedgewise.backend.service.hedging.pricing;

import com.hedgewise.backend.model.HedgeInstrument;

/**
 * Prices the cost of hedging a notional amount with one catalog instrument.
 */
public interface PricingProvider {

    /**
     * @param notional         base-currency amount hedged in full
     * @param tenorDays        hedge horizon
     * @param annualVolatility volatility of the hedged currency
     */
    double cost(HedgeInstrument instrument, double notional, int tenorDays, double annualVolatility);
}
