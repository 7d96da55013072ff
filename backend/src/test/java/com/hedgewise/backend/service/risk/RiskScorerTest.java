package com.hedgewise.backend.service.risk;

import com.hedgewise.backend.config.RiskProperties;
import com.hedgewise.backend.model.ConcentrationRisk;
import com.hedgewise.backend.model.CurrencyExposure;
import com.hedgewise.backend.model.Priority;
import com.hedgewise.backend.model.RiskFactor;
import com.hedgewise.backend.model.RiskRecommendation;
import com.hedgewise.backend.model.VolatilityProfile;
import com.hedgewise.backend.util.RiskFixtures;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.data.Offset.offset;

class RiskScorerTest {

    private final RiskProperties properties = new RiskProperties();
    private final RiskScorer scorer = new RiskScorer(properties);
    private final RiskMeasureEngine measures = new RiskMeasureEngine(properties);

    private static List<CurrencyExposure> eurGbp() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("EUR", 60_000.0);
        values.put("GBP", 40_000.0);
        return RiskFixtures.exposures(values);
    }

    private static Map<String, VolatilityProfile> vols(double eur, double gbp) {
        Map<String, Double> annual = new LinkedHashMap<>();
        annual.put("EUR", eur);
        annual.put("GBP", gbp);
        return RiskFixtures.annualVolatilities(annual);
    }

    @Test
    void combinesConcentrationVolatilityAndDiversification() {
        List<CurrencyExposure> exposures = eurGbp();

        double score = scorer.score(exposures, vols(0.10, 0.20), measures.concentration(exposures));

        assertThat(score).isCloseTo(70.0, offset(1e-9));
    }

    @Test
    void volatilityComponentIsCapped() {
        List<CurrencyExposure> exposures = List.of(RiskFixtures.exposure("TRY", 100_000, 1.0));
        Map<String, VolatilityProfile> volatilities = RiskFixtures.annualVolatilities(Map.of("TRY", 0.6));

        double score = scorer.score(exposures, volatilities, measures.concentration(exposures));

        assertThat(score).isCloseTo(98.0, offset(1e-9));
    }

    @Test
    void emptyPortfolioScoresZero() {
        assertThat(scorer.score(List.of(), Map.of(), ConcentrationRisk.none())).isZero();
        assertThat(scorer.recommendations(List.of(), Map.of(), ConcentrationRisk.none(), List.of())).isEmpty();
    }

    @Test
    void recommendsDiversificationCorrelationAndVolatilityActions() {
        List<CurrencyExposure> exposures = eurGbp();
        RiskFactor pair = new RiskFactor(RiskFactor.FactorType.CORRELATION, List.of("EUR", "GBP"), 1.0, 50.0, 0.85);

        List<RiskRecommendation> recommendations = scorer.recommendations(exposures, vols(0.10, 0.25),
                measures.concentration(exposures), List.of(pair));

        assertThat(recommendations).extracting(RiskRecommendation::type).containsExactly(
                RiskRecommendation.Type.DIVERSIFICATION,
                RiskRecommendation.Type.CORRELATION,
                RiskRecommendation.Type.VOLATILITY);
        assertThat(recommendations.get(0).priority()).isEqualTo(Priority.HIGH);
        assertThat(recommendations.get(0).message()).startsWith("60.0% of foreign exposure is in EUR");
        assertThat(recommendations.get(1).priority()).isEqualTo(Priority.MEDIUM);
        assertThat(recommendations.get(2).message()).startsWith("1 currencies have high volatility");
    }

    @Test
    void balancedCalmPortfolioNeedsNoAction() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("EUR", 25_000.0);
        values.put("GBP", 25_000.0);
        values.put("JPY", 25_000.0);
        values.put("CHF", 25_000.0);
        List<CurrencyExposure> exposures = RiskFixtures.exposures(values);
        Map<String, Double> annual = new LinkedHashMap<>();
        values.keySet().forEach(currency -> annual.put(currency, 0.08));

        List<RiskRecommendation> recommendations = scorer.recommendations(exposures,
                RiskFixtures.annualVolatilities(annual), measures.concentration(exposures), List.of());

        assertThat(recommendations).isEmpty();
    }
}
