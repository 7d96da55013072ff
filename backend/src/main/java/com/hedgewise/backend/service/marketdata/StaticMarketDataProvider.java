package com.hedgewise.backend.service.marketdata;

import com.hedgewise.backend.config.MarketDataProperties;
import com.hedgewise.backend.exception.DataUnavailableException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;

/**
 * Offline provider backed by configured reference rates. Price histories are synthetic
 * (monthly cycle, bounded random walk, mild mean reversion) and deterministic per currency pair.
 */
public class StaticMarketDataProvider implements MarketDataProvider {

    private static final String PIVOT = "USD";

    private final Map<String, Double> rates;
    private final long seed;

    public StaticMarketDataProvider(MarketDataProperties properties) {
        this.rates = Map.copyOf(properties.getReferenceRates());
        this.seed = properties.getSyntheticSeed();
    }

    @Override
    public double getExchangeRate(String from, String to) {
        if (from.equals(to)) {
            return 1.0;
        }
        Double direct = rates.get(from + "-" + to);
        if (direct != null) {
            return direct;
        }
        Double inverse = rates.get(to + "-" + from);
        if (inverse != null && inverse != 0.0) {
            return 1.0 / inverse;
        }
        if (!PIVOT.equals(from) && !PIVOT.equals(to)) {
            Double fromPivot = rateToPivot(from);
            Double toPivot = rateToPivot(to);
            if (fromPivot != null && toPivot != null) {
                return fromPivot / toPivot;
            }
        }
        throw new DataUnavailableException(from, "exchange-rate", "No reference rate for " + from + "/" + to);
    }

    @Override
    public List<Double> getHistoricalPrices(String currency, String base, int days) {
        double start = getExchangeRate(currency, base);
        SplittableRandom random = new SplittableRandom(seed ^ (currency + "/" + base).hashCode());
        double floor = start * 0.1;
        double price = start;
        List<Double> prices = new ArrayList<>(days);
        for (int i = 0; i < days; i++) {
            double trend = Math.sin(i / 30.0) * 0.001;
            double randomWalk = (random.nextDouble() - 0.5) * 0.015;
            double meanReversion = (start - price) / start * 0.01;
            price *= 1.0 + trend + randomWalk + meanReversion;
            price = Math.max(price, floor);
            prices.add(price);
        }
        return prices;
    }

    private Double rateToPivot(String currency) {
        Double direct = rates.get(currency + "-" + PIVOT);
        if (direct != null) {
            return direct;
        }
        Double inverse = rates.get(PIVOT + "-" + currency);
        return inverse == null || inverse == 0.0 ? null : 1.0 / inverse;
    }
}
