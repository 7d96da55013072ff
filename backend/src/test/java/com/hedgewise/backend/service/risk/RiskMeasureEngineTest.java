package com.hedgewise.backend.service.risk;

import com.hedgewise.backend.config.RiskProperties;
import com.hedgewise.backend.model.ConcentrationRisk;
import com.hedgewise.backend.model.CorrelationMatrix;
import com.hedgewise.backend.model.CurrencyExposure;
import com.hedgewise.backend.model.ExpectedShortfall;
import com.hedgewise.backend.model.RiskFactor;
import com.hedgewise.backend.model.RiskLevel;
import com.hedgewise.backend.model.VarResult;
import com.hedgewise.backend.model.VolatilityProfile;
import com.hedgewise.backend.util.CancellationToken;
import com.hedgewise.backend.util.FakeMarketDataProvider;
import com.hedgewise.backend.util.RiskFixtures;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.data.Offset.offset;

class RiskMeasureEngineTest {

    private final RiskMeasureEngine engine = new RiskMeasureEngine(new RiskProperties());

    private static CorrelationMatrix matrix(String first, String second, double correlation) {
        return CorrelationMatrix.builder(List.of(first, second))
                .available(first)
                .available(second)
                .correlation(first, second, correlation)
                .build();
    }

    private static Map<String, VolatilityProfile> dailyVolatilities(String first, double firstDaily,
                                                                    String second, double secondDaily) {
        Map<String, VolatilityProfile> profiles = new LinkedHashMap<>();
        profiles.put(first, VolatilityProfile.fromDaily(first, firstDaily, List.of(), List.of()));
        profiles.put(second, VolatilityProfile.fromDaily(second, secondDaily, List.of(), List.of()));
        return profiles;
    }

    @Test
    void usesTabulatedZScoresForStandardConfidenceLevels() {
        assertThat(RiskMeasureEngine.zScore(0.95)).isEqualTo(1.645);
        assertThat(RiskMeasureEngine.zScore(0.99)).isEqualTo(2.326);
        assertThat(RiskMeasureEngine.zScore(0.975)).isCloseTo(1.95996, offset(1e-4));
    }

    @Test
    void percentileLossReadsTheTailOfSortedReturns() {
        double[] returns = new double[20];
        returns[0] = -0.05;
        returns[1] = -0.03;
        returns[2] = -0.01;
        for (int i = 3; i < returns.length; i++) {
            returns[i] = 0.001 * i;
        }

        assertThat(RiskMeasureEngine.percentileLoss(returns, 0.95, 100_000)).isCloseTo(3_000.0, offset(1e-6));
        assertThat(RiskMeasureEngine.percentileLoss(returns, 0.99, 100_000)).isCloseTo(5_000.0, offset(1e-6));
        assertThat(RiskMeasureEngine.tailAverage(returns, 0.95)).isCloseTo(0.04, offset(1e-12));
    }

    @Test
    void percentileLossIsNeverNegative() {
        double[] gains = {0.01, 0.02, 0.03};

        assertThat(RiskMeasureEngine.percentileLoss(gains, 0.95, 1_000)).isZero();
        assertThat(RiskMeasureEngine.percentileLoss(new double[0], 0.95, 1_000)).isZero();
    }

    @Test
    void parametricVarianceIncludesCrossTerms() {
        List<CurrencyExposure> exposures = List.of(
                RiskFixtures.exposure("EUR", 100_000, 0.67),
                RiskFixtures.exposure("GBP", 50_000, 0.33));
        Map<String, VolatilityProfile> volatilities = dailyVolatilities("EUR", 0.01, "GBP", 0.02);

        double variance = engine.parametricVariance(exposures, volatilities, matrix("EUR", "GBP", 0.5));

        assertThat(variance).isCloseTo(3_000_000.0, offset(1e-6));
        assertThat(engine.parametricStdDev(exposures, volatilities, matrix("EUR", "GBP", 0.5)))
                .isCloseTo(Math.sqrt(3_000_000.0), offset(1e-9));
    }

    @Test
    void unknownCorrelationIsTreatedAsIndependent() {
        List<CurrencyExposure> exposures = List.of(
                RiskFixtures.exposure("EUR", 100_000, 0.67),
                RiskFixtures.exposure("GBP", 50_000, 0.33));
        Map<String, VolatilityProfile> volatilities = dailyVolatilities("EUR", 0.01, "GBP", 0.02);

        double variance = engine.parametricVariance(exposures, volatilities, CorrelationMatrix.empty());

        assertThat(variance).isCloseTo(2_000_000.0, offset(1e-6));
    }

    @Test
    void higherConfidenceNeverLowersVar() {
        SplittableRandom random = new SplittableRandom(11);
        for (int round = 0; round < 20; round++) {
            double eurExposure = 10_000 + random.nextDouble() * 500_000;
            double jpyExposure = 10_000 + random.nextDouble() * 500_000;
            double[] eurReturns = FakeMarketDataProvider.returns(random.nextLong(), 60, 0.004 + random.nextDouble() * 0.01);
            double[] jpyReturns = FakeMarketDataProvider.returns(random.nextLong(), 60, 0.004 + random.nextDouble() * 0.01);

            Map<String, VolatilityProfile> volatilities = new LinkedHashMap<>();
            volatilities.put("EUR", profile("EUR", eurReturns));
            volatilities.put("JPY", profile("JPY", jpyReturns));
            Map<String, Double> values = new LinkedHashMap<>();
            values.put("EUR", eurExposure);
            values.put("JPY", jpyExposure);
            List<CurrencyExposure> exposures = RiskFixtures.exposures(values);
            CorrelationMatrix correlations = new CorrelationAnalyzer().analyze(volatilities);
            RiskProperties properties = RiskFixtures.riskProperties(400, random.nextLong());
            MonteCarloSimulator.Simulation simulation = RiskFixtures.simulator(properties)
                    .simulate(exposures, volatilities, correlations, CancellationToken.none());

            List<VarResult> results = engine.valueAtRisk(exposures, volatilities, correlations, simulation);

            VarResult var95 = results.get(0);
            VarResult var99 = results.get(1);
            assertThat(var99.historical()).isGreaterThanOrEqualTo(var95.historical());
            assertThat(var99.parametric()).isGreaterThanOrEqualTo(var95.parametric());
            assertThat(var99.monteCarlo()).isGreaterThanOrEqualTo(var95.monteCarlo());
            assertThat(var95.historical()).isGreaterThanOrEqualTo(0.0);
        }
    }

    @Test
    void historicalVarFallsBackToNormalApproximationWithoutReturns() {
        List<CurrencyExposure> exposures = List.of(RiskFixtures.exposure("BRL", 100_000, 1.0));
        Map<String, VolatilityProfile> volatilities = RiskFixtures.annualVolatilities(Map.of("BRL", 0.15));

        Map<String, Double> byCurrency = engine.historicalVarByCurrency(exposures, volatilities, 0.95);

        double expected = 100_000 * (0.15 / Math.sqrt(252)) * 1.645;
        assertThat(byCurrency.get("BRL")).isCloseTo(expected, offset(1e-6));
    }

    @Test
    void expectedShortfallDescribesTheTail() {
        double[] sorted = new double[100];
        for (int i = 0; i < sorted.length; i++) {
            sorted[i] = -1_000.0 + 20.0 * i;
        }
        MonteCarloSimulator.Simulation simulation = new MonteCarloSimulator.Simulation(sorted, 0.0, 1.0, false);

        List<ExpectedShortfall> shortfall = engine.expectedShortfall(simulation, "USD");

        assertThat(shortfall).hasSize(2);
        ExpectedShortfall es95 = shortfall.get(0);
        assertThat(es95.value()).isCloseTo(950.0, offset(1e-9));
        assertThat(es95.interpretation()).isEqualTo("Expected loss in worst 5% of scenarios: 950.00 USD");
        assertThat(shortfall.get(1).value()).isCloseTo(990.0, offset(1e-9));
    }

    @Test
    void equalExposuresGiveMediumConcentration() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("EUR", 25_000.0);
        values.put("GBP", 25_000.0);
        values.put("JPY", 25_000.0);
        values.put("CHF", 25_000.0);

        ConcentrationRisk risk = engine.concentration(RiskFixtures.exposures(values));

        assertThat(risk.herfindahlIndex()).isCloseTo(0.25, offset(1e-12));
        assertThat(risk.maxConcentration()).isCloseTo(0.25, offset(1e-12));
        assertThat(risk.top3Concentration()).isCloseTo(0.75, offset(1e-12));
        assertThat(risk.level()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(risk.advice()).isEmpty();
    }

    @Test
    void concentratedPortfolioGetsReductionAdvice() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("GBP", 40_000.0);
        values.put("EUR", 60_000.0);

        ConcentrationRisk risk = engine.concentration(RiskFixtures.exposures(values));

        assertThat(risk.level()).isEqualTo(RiskLevel.HIGH);
        assertThat(risk.currencies().get(0).currency()).isEqualTo("EUR");
        assertThat(risk.herfindahlIndex()).isCloseTo(0.52, offset(1e-12));
        assertThat(risk.advice()).containsExactly("Reduce EUR exposure by 35.0%", "Reduce GBP exposure by 15.0%");
    }

    @Test
    void herfindahlStaysWithinBounds() {
        SplittableRandom random = new SplittableRandom(3);
        for (int round = 0; round < 50; round++) {
            int count = 1 + random.nextInt(8);
            Map<String, Double> values = new LinkedHashMap<>();
            for (int i = 0; i < count; i++) {
                values.put("C" + i, 1.0 + random.nextDouble() * 1_000_000);
            }

            ConcentrationRisk risk = engine.concentration(RiskFixtures.exposures(values));

            assertThat(risk.herfindahlIndex()).isBetween(1.0 / count - 1e-9, 1.0 + 1e-9);
            assertThat(risk.maxConcentration()).isLessThanOrEqualTo(risk.top3Concentration() + 1e-12);
        }
    }

    @Test
    void emptyPortfolioHasNoConcentration() {
        ConcentrationRisk risk = engine.concentration(List.of());

        assertThat(risk.herfindahlIndex()).isZero();
        assertThat(risk.level()).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void stronglyCorrelatedPairsBecomeRiskFactors() {
        List<CurrencyExposure> exposures = List.of(
                RiskFixtures.exposure("EUR", 100_000, 0.67),
                RiskFixtures.exposure("GBP", 50_000, 0.33));
        Map<String, VolatilityProfile> volatilities = dailyVolatilities("EUR", 0.01, "GBP", 0.01);

        List<RiskFactor> factors = engine.riskFactors(exposures, volatilities, matrix("EUR", "GBP", 0.9));

        assertThat(factors).hasSize(3);
        RiskFactor pair = factors.get(0);
        assertThat(pair.type()).isEqualTo(RiskFactor.FactorType.CORRELATION);
        assertThat(pair.currencies()).containsExactly("EUR", "GBP");
        assertThat(pair.contribution()).isCloseTo(900_000.0, offset(1e-6));
        assertThat(pair.correlation()).isEqualTo(0.9);
        assertThat(factors.get(1).currencies()).containsExactly("EUR");
        double total = factors.stream().mapToDouble(RiskFactor::relativeContribution).sum();
        assertThat(total).isCloseTo(100.0, offset(1e-9));
    }

    @Test
    void weakCorrelationLeavesOnlyIndividualFactors() {
        List<CurrencyExposure> exposures = List.of(
                RiskFixtures.exposure("EUR", 100_000, 0.67),
                RiskFixtures.exposure("GBP", 50_000, 0.33));
        Map<String, VolatilityProfile> volatilities = dailyVolatilities("EUR", 0.01, "GBP", 0.01);

        List<RiskFactor> factors = engine.riskFactors(exposures, volatilities, matrix("EUR", "GBP", 0.5));

        assertThat(factors).extracting(RiskFactor::type).containsOnly(RiskFactor.FactorType.INDIVIDUAL);
        assertThat(factors.get(0).relativeContribution()).isCloseTo(200.0 / 3.0, offset(1e-9));
        assertThat(engine.totalRisk(exposures, volatilities)).isCloseTo(1_500.0, offset(1e-9));
    }

    private static VolatilityProfile profile(String currency, double[] returns) {
        List<Double> values = Arrays.stream(returns).boxed().toList();
        double mean = Arrays.stream(returns).average().orElse(0.0);
        double variance = Arrays.stream(returns).map(r -> (r - mean) * (r - mean)).sum() / (returns.length - 1);
        return VolatilityProfile.fromDaily(currency, Math.sqrt(variance), values, values.subList(values.size() - 30, values.size()));
    }
}
