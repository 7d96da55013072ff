package com.hedgewise.backend.service.risk;

import com.hedgewise.backend.config.RiskProperties;
import com.hedgewise.backend.model.ConcentrationRisk;
import com.hedgewise.backend.model.ConcentrationRisk.CurrencyConcentration;
import com.hedgewise.backend.model.CorrelationMatrix;
import com.hedgewise.backend.model.CurrencyExposure;
import com.hedgewise.backend.model.ExpectedShortfall;
import com.hedgewise.backend.model.RiskFactor;
import com.hedgewise.backend.model.RiskLevel;
import com.hedgewise.backend.model.VarResult;
import com.hedgewise.backend.model.VolatilityProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Risk measures over a set of exposures. Every VaR figure is a non-negative loss amount.
 * Historical VaR is summed per currency and ignores cross-currency correlation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskMeasureEngine {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private final RiskProperties riskProperties;

    public List<VarResult> valueAtRisk(List<CurrencyExposure> exposures,
                                       Map<String, VolatilityProfile> volatilities,
                                       CorrelationMatrix correlations,
                                       MonteCarloSimulator.Simulation simulation) {
        double stdDev = parametricStdDev(exposures, volatilities, correlations);
        List<VarResult> results = new ArrayList<>();
        for (double confidence : riskProperties.getConfidenceLevels()) {
            Map<String, Double> byCurrency = historicalVarByCurrency(exposures, volatilities, confidence);
            double historical = byCurrency.values().stream().mapToDouble(Double::doubleValue).sum();
            double parametric = stdDev * zScore(confidence);
            double monteCarlo = percentileLoss(simulation.sortedReturns(), confidence, 1.0);
            results.add(new VarResult(confidence, historical, byCurrency, parametric, monteCarlo));
        }
        return results;
    }

    /**
     * Currencies without return history use the normal approximation on their fallback volatility.
     */
    public Map<String, Double> historicalVarByCurrency(List<CurrencyExposure> exposures,
                                                       Map<String, VolatilityProfile> volatilities,
                                                       double confidence) {
        Map<String, Double> byCurrency = new LinkedHashMap<>();
        for (CurrencyExposure exposure : exposures) {
            VolatilityProfile profile = volatilities.get(exposure.currency());
            double var;
            if (profile.returns().isEmpty()) {
                var = exposure.exposure() * profile.daily() * zScore(confidence);
            } else {
                double[] sorted = profile.returns().stream().mapToDouble(Double::doubleValue).sorted().toArray();
                var = percentileLoss(sorted, confidence, exposure.exposure());
            }
            byCurrency.put(exposure.currency(), var);
        }
        return byCurrency;
    }

    public double parametricVariance(List<CurrencyExposure> exposures,
                                     Map<String, VolatilityProfile> volatilities,
                                     CorrelationMatrix correlations) {
        double variance = 0.0;
        for (CurrencyExposure first : exposures) {
            double a = first.exposure() * volatilities.get(first.currency()).daily();
            for (CurrencyExposure second : exposures) {
                double b = second.exposure() * volatilities.get(second.currency()).daily();
                variance += a * b * correlations.correlation(first.currency(), second.currency());
            }
        }
        return Math.max(0.0, variance);
    }

    public double parametricStdDev(List<CurrencyExposure> exposures,
                                   Map<String, VolatilityProfile> volatilities,
                                   CorrelationMatrix correlations) {
        return Math.sqrt(parametricVariance(exposures, volatilities, correlations));
    }

    public List<ExpectedShortfall> expectedShortfall(MonteCarloSimulator.Simulation simulation, String baseCurrency) {
        List<ExpectedShortfall> results = new ArrayList<>();
        for (double confidence : riskProperties.getConfidenceLevels()) {
            double value = tailAverage(simulation.sortedReturns(), confidence);
            String interpretation = String.format(Locale.ROOT, "Expected loss in worst %s%% of scenarios: %.2f %s",
                    formatPercent(1.0 - confidence), value, baseCurrency);
            results.add(new ExpectedShortfall(confidence, value, interpretation));
        }
        return results;
    }

    public ConcentrationRisk concentration(List<CurrencyExposure> exposures) {
        if (exposures.isEmpty()) {
            return ConcentrationRisk.none();
        }
        double threshold = riskProperties.getConcentrationThreshold();
        List<CurrencyConcentration> entries = exposures.stream()
                .map(exposure -> new CurrencyConcentration(exposure.currency(), exposure.relativeExposure(),
                        exposure.relativeExposure() > threshold))
                .sorted(Comparator.comparingDouble(CurrencyConcentration::concentration).reversed()
                        .thenComparing(CurrencyConcentration::currency))
                .toList();

        double herfindahl = entries.stream().mapToDouble(entry -> entry.concentration() * entry.concentration()).sum();
        double max = entries.get(0).concentration();
        double top3 = entries.stream().limit(3).mapToDouble(CurrencyConcentration::concentration).sum();

        List<String> advice = entries.stream()
                .filter(CurrencyConcentration::highConcentration)
                .map(entry -> String.format(Locale.ROOT, "Reduce %s exposure by %.1f%%",
                        entry.currency(), (entry.concentration() - threshold) * 100.0))
                .toList();
        return new ConcentrationRisk(herfindahl, max, top3, concentrationLevel(herfindahl, max), entries, advice);
    }

    public static RiskLevel concentrationLevel(double herfindahl, double maxConcentration) {
        if (maxConcentration > 0.5 || herfindahl > 0.25) {
            return RiskLevel.HIGH;
        }
        if (maxConcentration > 0.3 || herfindahl > 0.15) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    /**
     * Individual factors (exposure x daily volatility) plus one factor per strongly correlated pair,
     * ranked by absolute contribution.
     */
    public List<RiskFactor> riskFactors(List<CurrencyExposure> exposures,
                                        Map<String, VolatilityProfile> volatilities,
                                        CorrelationMatrix correlations) {
        List<RiskFactor> raw = new ArrayList<>();
        for (CurrencyExposure exposure : exposures) {
            double contribution = exposure.exposure() * volatilities.get(exposure.currency()).daily();
            raw.add(new RiskFactor(RiskFactor.FactorType.INDIVIDUAL, List.of(exposure.currency()), contribution, 0.0, null));
        }
        double threshold = riskProperties.getCorrelationThreshold();
        for (int i = 0; i < exposures.size(); i++) {
            CurrencyExposure first = exposures.get(i);
            for (int j = i + 1; j < exposures.size(); j++) {
                CurrencyExposure second = exposures.get(j);
                if (!correlations.hasData(first.currency(), second.currency())) {
                    continue;
                }
                double correlation = correlations.correlation(first.currency(), second.currency());
                if (Math.abs(correlation) <= threshold) {
                    continue;
                }
                double contribution = 2.0 * first.exposure() * second.exposure()
                        * volatilities.get(first.currency()).daily()
                        * volatilities.get(second.currency()).daily()
                        * correlation;
                raw.add(new RiskFactor(RiskFactor.FactorType.CORRELATION,
                        List.of(first.currency(), second.currency()), contribution, 0.0, correlation));
            }
        }

        double total = raw.stream().mapToDouble(factor -> Math.abs(factor.contribution())).sum();
        return raw.stream()
                .sorted(Comparator.comparingDouble((RiskFactor factor) -> Math.abs(factor.contribution())).reversed()
                        .thenComparing(factor -> String.join("/", factor.currencies())))
                .map(factor -> new RiskFactor(factor.type(), factor.currencies(), factor.contribution(),
                        total > 0.0 ? Math.abs(factor.contribution()) / total * 100.0 : 0.0, factor.correlation()))
                .toList();
    }

    public double totalRisk(List<CurrencyExposure> exposures, Map<String, VolatilityProfile> volatilities) {
        return exposures.stream()
                .mapToDouble(exposure -> exposure.exposure() * volatilities.get(exposure.currency()).daily())
                .sum();
    }

    public static double zScore(double confidence) {
        if (Math.abs(confidence - 0.95) < 1e-9) {
            return 1.645;
        }
        if (Math.abs(confidence - 0.99) < 1e-9) {
            return 2.326;
        }
        return STANDARD_NORMAL.inverseCumulativeProbability(confidence);
    }

    public static int tailIndex(int size, double confidence) {
        int index = (int) Math.floor(size * (1.0 - confidence));
        return Math.max(0, Math.min(size - 1, index));
    }

    /**
     * Loss at the (1 - confidence) quantile of ascending returns, floored at zero.
     */
    public static double percentileLoss(double[] sortedReturns, double confidence, double scale) {
        if (sortedReturns.length == 0) {
            return 0.0;
        }
        double value = sortedReturns[tailIndex(sortedReturns.length, confidence)];
        return Math.max(0.0, -value) * scale;
    }

    /**
     * Mean absolute return over the tail up to and including the VaR index.
     */
    public static double tailAverage(double[] sortedReturns, double confidence) {
        if (sortedReturns.length == 0) {
            return 0.0;
        }
        int index = tailIndex(sortedReturns.length, confidence);
        return Arrays.stream(sortedReturns, 0, index + 1).map(Math::abs).average().orElse(0.0);
    }

    private static String formatPercent(double fraction) {
        double percent = fraction * 100.0;
        if (Math.abs(percent - Math.rint(percent)) < 1e-9) {
            return String.valueOf((long) Math.rint(percent));
        }
        return String.format(Locale.ROOT, "%.2f", percent);
    }
}
