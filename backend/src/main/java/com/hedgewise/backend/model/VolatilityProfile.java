package com.hedgewise.backend.model;

import java.util.List;

/**
 * Volatility of one currency against the base currency.
 *
 * @param returns       full daily return history, empty when {@code fallback} is set
 * @param recentReturns trailing window reused for correlation
 * @param fallback      true when no price history was available and the default volatility was applied
 */
public record VolatilityProfile(
        String currency,
        double daily,
        double weekly,
        double monthly,
        double annual,
        List<Double> returns,
        List<Double> recentReturns,
        boolean fallback
) {

    public static final double TRADING_DAYS = 252.0;

    public VolatilityProfile {
        returns = returns == null ? List.of() : List.copyOf(returns);
        recentReturns = recentReturns == null ? List.of() : List.copyOf(recentReturns);
    }

    public static VolatilityProfile fromDaily(String currency, double daily, List<Double> returns,
                                              List<Double> recentReturns) {
        return new VolatilityProfile(currency, daily, daily * Math.sqrt(7), daily * Math.sqrt(30),
                daily * Math.sqrt(TRADING_DAYS), returns, recentReturns, false);
    }

    public static VolatilityProfile fallback(String currency, double annual) {
        double daily = annual / Math.sqrt(TRADING_DAYS);
        return new VolatilityProfile(currency, daily, daily * Math.sqrt(7), daily * Math.sqrt(30),
                annual, List.of(), List.of(), true);
    }
}
