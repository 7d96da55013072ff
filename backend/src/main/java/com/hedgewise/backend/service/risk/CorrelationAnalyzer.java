package com.hedgewise.backend.service.risk;

import com.hedgewise.backend.model.CorrelationMatrix;
import com.hedgewise.backend.model.VolatilityProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class CorrelationAnalyzer {

    /**
     * Builds the matrix from each currency's retained returns, aligned to the most recent
     * common length. Currencies without a usable series are marked unavailable.
     */
    public CorrelationMatrix analyze(Map<String, VolatilityProfile> profiles) {
        List<String> currencies = new ArrayList<>(profiles.keySet());
        CorrelationMatrix.Builder builder = CorrelationMatrix.builder(currencies);

        List<String> usable = new ArrayList<>();
        int common = Integer.MAX_VALUE;
        for (String currency : currencies) {
            VolatilityProfile profile = profiles.get(currency);
            if (!profile.fallback() && profile.recentReturns().size() >= 2) {
                usable.add(currency);
                common = Math.min(common, profile.recentReturns().size());
                builder.available(currency);
            }
        }
        if (usable.size() < currencies.size()) {
            log.debug("No correlation data for {} of {} currencies", currencies.size() - usable.size(), currencies.size());
        }

        for (int i = 0; i < usable.size(); i++) {
            List<Double> first = tail(profiles.get(usable.get(i)).recentReturns(), common);
            for (int j = i + 1; j < usable.size(); j++) {
                List<Double> second = tail(profiles.get(usable.get(j)).recentReturns(), common);
                builder.correlation(usable.get(i), usable.get(j), pearson(first, second));
            }
        }
        return builder.build();
    }

    /**
     * Pearson correlation; 0 when either series has zero variance.
     */
    public static double pearson(List<Double> series1, List<Double> series2) {
        int n = Math.min(series1.size(), series2.size());
        if (n == 0) {
            return 0;
        }
        double mean1 = 0;
        double mean2 = 0;
        for (int i = 0; i < n; i++) {
            mean1 += series1.get(i);
            mean2 += series2.get(i);
        }
        mean1 /= n;
        mean2 /= n;

        double covariance = 0;
        double variance1 = 0;
        double variance2 = 0;
        for (int i = 0; i < n; i++) {
            double diff1 = series1.get(i) - mean1;
            double diff2 = series2.get(i) - mean2;
            covariance += diff1 * diff2;
            variance1 += diff1 * diff1;
            variance2 += diff2 * diff2;
        }
        if (variance1 == 0 || variance2 == 0) {
            return 0;
        }
        double correlation = covariance / Math.sqrt(variance1 * variance2);
        return Double.isFinite(correlation) ? correlation : 0;
    }

    private static List<Double> tail(List<Double> values, int length) {
        return values.subList(values.size() - length, values.size());
    }
}
