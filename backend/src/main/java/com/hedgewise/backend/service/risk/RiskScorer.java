package com.hedgewise.backend.service.risk;

import com.hedgewise.backend.config.RiskProperties;
import com.hedgewise.backend.model.ConcentrationRisk;
import com.hedgewise.backend.model.CurrencyExposure;
import com.hedgewise.backend.model.Priority;
import com.hedgewise.backend.model.RiskFactor;
import com.hedgewise.backend.model.RiskRecommendation;
import com.hedgewise.backend.model.VolatilityProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class RiskScorer {

    private final RiskProperties riskProperties;

    /**
     * 40 x max concentration + min(40, 200 x average annual volatility) + max(0, 20 - 2 x currency count),
     * bounded to [0, 100]. A portfolio without foreign exposure scores 0.
     */
    public double score(List<CurrencyExposure> exposures, Map<String, VolatilityProfile> volatilities,
                        ConcentrationRisk concentration) {
        if (exposures.isEmpty()) {
            return 0.0;
        }
        double averageVolatility = exposures.stream()
                .mapToDouble(exposure -> volatilities.get(exposure.currency()).annual())
                .average()
                .orElse(0.0);
        double concentrationScore = 40.0 * concentration.maxConcentration();
        double volatilityScore = Math.min(40.0, 200.0 * averageVolatility);
        double diversificationScore = Math.max(0.0, 20.0 - 2.0 * exposures.size());
        return Math.max(0.0, Math.min(100.0, concentrationScore + volatilityScore + diversificationScore));
    }

    public List<RiskRecommendation> recommendations(List<CurrencyExposure> exposures,
                                                    Map<String, VolatilityProfile> volatilities,
                                                    ConcentrationRisk concentration,
                                                    List<RiskFactor> factors) {
        List<RiskRecommendation> recommendations = new ArrayList<>();
        if (exposures.isEmpty()) {
            return recommendations;
        }

        if (concentration.maxConcentration() > riskProperties.getConcentrationThreshold()) {
            String currency = concentration.currencies().get(0).currency();
            recommendations.add(new RiskRecommendation(RiskRecommendation.Type.DIVERSIFICATION, Priority.HIGH,
                    String.format(Locale.ROOT, "%.1f%% of foreign exposure is in %s; diversify or hedge this exposure",
                            concentration.maxConcentration() * 100.0, currency)));
        }

        long highlyCorrelated = factors.stream()
                .filter(factor -> factor.type() == RiskFactor.FactorType.CORRELATION)
                .filter(factor -> Math.abs(factor.correlation()) > riskProperties.getHighCorrelationThreshold())
                .count();
        if (highlyCorrelated > 0) {
            recommendations.add(new RiskRecommendation(RiskRecommendation.Type.CORRELATION, Priority.MEDIUM,
                    highlyCorrelated + " highly correlated currency pairs; hedge or diversify into uncorrelated currencies"));
        }

        long highVolatility = exposures.stream()
                .filter(exposure -> volatilities.get(exposure.currency()).annual() > riskProperties.getHighVolatilityThreshold())
                .count();
        if (highVolatility > 0) {
            recommendations.add(new RiskRecommendation(RiskRecommendation.Type.VOLATILITY, Priority.MEDIUM,
                    highVolatility + " currencies have high volatility; consider hedging volatile exposures"));
        }
        return recommendations;
    }
}
