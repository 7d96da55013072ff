package com.hedgewise.backend.service.risk;

import com.hedgewise.backend.exception.DataUnavailableException;
import com.hedgewise.backend.model.Account;
import com.hedgewise.backend.model.CurrencyExposure;
import com.hedgewise.backend.model.Portfolio;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts account balances into base-currency exposures. Balances in the same foreign
 * currency are aggregated. A missing exchange rate aborts the calculation.
 */
@Slf4j
@Service
public class ExposureCalculator {

    public Result calculate(Portfolio portfolio, ExchangeRateLookup rates) {
        String base = portfolio.baseCurrency();
        Map<String, Double> balances = new LinkedHashMap<>();
        double baseBalance = 0.0;
        for (Account account : portfolio.accounts()) {
            if (base.equals(account.currency())) {
                baseBalance += account.balance();
            } else {
                balances.merge(account.currency(), account.balance(), Double::sum);
            }
        }

        Map<String, Double> rateByCurrency = new LinkedHashMap<>();
        Map<String, Double> valueByCurrency = new LinkedHashMap<>();
        double foreignTotal = 0.0;
        double portfolioTotal = Math.abs(baseBalance);
        for (Map.Entry<String, Double> entry : balances.entrySet()) {
            String currency = entry.getKey();
            double rate = rates.rate(currency, base);
            if (!Double.isFinite(rate) || rate <= 0.0) {
                throw new DataUnavailableException(currency, "exposure",
                        "No usable exchange rate for " + currency + "/" + base);
            }
            double value = Math.abs(entry.getValue() * rate);
            rateByCurrency.put(currency, rate);
            valueByCurrency.put(currency, value);
            foreignTotal += value;
            portfolioTotal += value;
        }

        List<CurrencyExposure> exposures = new ArrayList<>();
        if (foreignTotal > 0.0) {
            List<Map.Entry<String, Double>> ranked = new ArrayList<>(valueByCurrency.entrySet());
            ranked.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                    .thenComparing(Map.Entry.comparingByKey()));
            int rank = 1;
            for (Map.Entry<String, Double> entry : ranked) {
                String currency = entry.getKey();
                double value = entry.getValue();
                if (value == 0.0) {
                    continue;
                }
                exposures.add(new CurrencyExposure(
                        currency,
                        value,
                        balances.get(currency),
                        rateByCurrency.get(currency),
                        value / foreignTotal,
                        portfolioTotal > 0.0 ? value / portfolioTotal : 0.0,
                        rank++
                ));
            }
        }
        log.debug("Computed {} exposures for base {} (foreign total {})", exposures.size(), base, foreignTotal);
        return new Result(exposures, foreignTotal, portfolioTotal);
    }

    /**
     * @param totalPortfolioValue absolute value of every balance in base currency
     */
    public record Result(List<CurrencyExposure> exposures, double totalForeignExposure, double totalPortfolioValue) {

        public boolean isEmpty() {
            return exposures.isEmpty();
        }
    }
}
