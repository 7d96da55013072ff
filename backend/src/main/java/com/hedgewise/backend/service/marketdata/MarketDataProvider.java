package com.hedgewise.backend.service.marketdata;

import java.util.List;

/**
 * Source of exchange rates and price histories. Implementations may be slow or fail;
 * callers go through {@link MarketDataClient}, which treats every response as final.
 */
public interface MarketDataProvider {

    /**
     * Units of {@code to} per unit of {@code from}.
     */
    double getExchangeRate(String from, String to);

    /**
     * Daily prices of {@code currency} in {@code base}, oldest first.
     */
    List<Double> getHistoricalPrices(String currency, String base, int days);
}
