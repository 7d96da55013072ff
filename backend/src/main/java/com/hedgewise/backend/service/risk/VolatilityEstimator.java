package com.hedgewise.backend.service.risk;

import com.hedgewise.backend.config.RiskProperties;
import com.hedgewise.backend.model.VolatilityProfile;
import com.hedgewise.backend.service.MetricsService;
import com.hedgewise.backend.service.marketdata.MarketDataClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Estimates per-currency volatility from daily price history. Histories are fetched
 * concurrently; a currency whose history cannot be obtained gets the configured default
 * annual volatility and no return series.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VolatilityEstimator {

    private final MarketDataClient marketDataClient;
    private final RiskProperties riskProperties;
    private final MetricsService metricsService;

    public Map<String, VolatilityProfile> estimate(List<String> currencies, String baseCurrency) {
        int days = riskProperties.getLookback().selectedDays();
        Map<String, CompletableFuture<VolatilityProfile>> futures = new LinkedHashMap<>();
        for (String currency : currencies) {
            futures.put(currency, marketDataClient.fetchHistoricalPrices(currency, baseCurrency, days)
                    .thenApply(prices -> fromPrices(currency, prices))
                    .exceptionally(error -> fallback(currency, error)));
        }
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        Map<String, VolatilityProfile> profiles = new LinkedHashMap<>();
        futures.forEach((currency, future) -> profiles.put(currency, future.join()));
        return profiles;
    }

    public VolatilityProfile fromPrices(String currency, List<Double> prices) {
        List<Double> returns = dailyReturns(prices);
        if (returns.size() < 2) {
            return fallback(currency, new IllegalStateException("only " + prices.size() + " prices"));
        }
        double[] values = returns.stream().mapToDouble(Double::doubleValue).toArray();
        double daily = new StandardDeviation(true).evaluate(values);
        int retained = Math.min(riskProperties.getRetainedReturns(), returns.size());
        List<Double> recent = returns.subList(returns.size() - retained, returns.size());
        return VolatilityProfile.fromDaily(currency, daily, returns, recent);
    }

    public static List<Double> dailyReturns(List<Double> prices) {
        List<Double> returns = new ArrayList<>(Math.max(0, prices.size() - 1));
        for (int i = 1; i < prices.size(); i++) {
            double previous = prices.get(i - 1);
            if (previous == 0.0) {
                continue;
            }
            returns.add((prices.get(i) - previous) / previous);
        }
        return returns;
    }

    private VolatilityProfile fallback(String currency, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        double annual = riskProperties.getDefaultAnnualVolatility();
        log.warn("Using default volatility {} for {}: {}", annual, currency, cause.getMessage());
        metricsService.recordVolatilityFallback();
        return VolatilityProfile.fallback(currency, annual);
    }
}
