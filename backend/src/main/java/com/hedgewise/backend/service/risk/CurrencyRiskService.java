package com.hedgewise.backend.service.risk;

import com.hedgewise.backend.event.RiskAlert;
import com.hedgewise.backend.exception.AssessmentNotFoundException;
import com.hedgewise.backend.exception.CalculationFailureException;
import com.hedgewise.backend.exception.HedgingException;
import com.hedgewise.backend.model.ConcentrationRisk;
import com.hedgewise.backend.model.CorrelationMatrix;
import com.hedgewise.backend.model.CurrencyExposure;
import com.hedgewise.backend.model.ExpectedShortfall;
import com.hedgewise.backend.model.MonteCarloSummary;
import com.hedgewise.backend.model.Portfolio;
import com.hedgewise.backend.model.RiskAssessment;
import com.hedgewise.backend.model.RiskFactor;
import com.hedgewise.backend.model.VarResult;
import com.hedgewise.backend.model.VolatilityProfile;
import com.hedgewise.backend.service.MetricsService;
import com.hedgewise.backend.service.RiskEventDispatcher;
import com.hedgewise.backend.service.marketdata.MarketDataClient;
import com.hedgewise.backend.util.CancellationToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs the risk pipeline for one portfolio: exposures, volatility and correlation, risk measures,
 * scoring. The result replaces the user's cached assessment and is published to listeners.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CurrencyRiskService {

    static final String OPERATION = "risk-assessment";

    private final ExposureCalculator exposureCalculator;
    private final VolatilityEstimator volatilityEstimator;
    private final CorrelationAnalyzer correlationAnalyzer;
    private final RiskMeasureEngine riskMeasureEngine;
    private final MonteCarloSimulator monteCarloSimulator;
    private final StressTestEngine stressTestEngine;
    private final RiskScorer riskScorer;
    private final RiskAlertEvaluator riskAlertEvaluator;
    private final MarketDataClient marketDataClient;
    private final RiskAssessmentCache assessmentCache;
    private final CalculationTracker calculationTracker;
    private final RiskEventDispatcher eventDispatcher;
    private final MetricsService metricsService;

    public RiskAssessment calculateRisk(String userId, Portfolio portfolio) {
        Objects.requireNonNull(portfolio.baseCurrency(), "baseCurrency");
        CancellationToken token = calculationTracker.start(OPERATION, userId);
        try {
            RiskAssessment assessment = assess(userId, portfolio, token);
            token.throwIfCancelled(OPERATION);
            assessmentCache.put(assessment);
            metricsService.recordAssessment(assessment.getRiskScore());
            log.info("Risk assessment {} for user {}: {} exposures, score {}", assessment.getId(), userId,
                    assessment.getExposures().size(), Math.round(assessment.getRiskScore()));
            eventDispatcher.riskCalculated(assessment);
            for (RiskAlert alert : riskAlertEvaluator.evaluate(assessment)) {
                metricsService.recordAlert();
                eventDispatcher.riskAlert(alert);
            }
            return assessment;
        } catch (HedgingException e) {
            metricsService.recordAssessmentFailure();
            throw e;
        } catch (RuntimeException e) {
            metricsService.recordAssessmentFailure();
            log.error("Risk assessment failed for user {}", userId, e);
            throw new CalculationFailureException(OPERATION, userId, "Risk assessment failed: " + e.getMessage(), e);
        } finally {
            calculationTracker.finish(OPERATION, userId, token);
        }
    }

    public Optional<RiskAssessment> getLatestAssessment(String userId) {
        return assessmentCache.get(userId);
    }

    public RiskAssessment requireLatestAssessment(String userId) {
        return assessmentCache.get(userId).orElseThrow(() -> new AssessmentNotFoundException(userId));
    }

    private RiskAssessment assess(String userId, Portfolio portfolio, CancellationToken token) {
        String base = portfolio.baseCurrency();
        ExposureCalculator.Result exposureResult = exposureCalculator.calculate(portfolio, marketDataClient::getExchangeRate);
        List<CurrencyExposure> exposures = exposureResult.exposures();
        List<String> currencies = exposures.stream().map(CurrencyExposure::currency).toList();
        token.throwIfCancelled(OPERATION);

        Map<String, VolatilityProfile> volatilities = volatilityEstimator.estimate(currencies, base);
        CorrelationMatrix correlations = correlationAnalyzer.analyze(volatilities);
        token.throwIfCancelled(OPERATION);

        MonteCarloSimulator.Simulation simulation = exposures.isEmpty()
                ? new MonteCarloSimulator.Simulation(new double[0], 0.0, 0.0, false)
                : monteCarloSimulator.simulate(exposures, volatilities, correlations, token);

        List<VarResult> valueAtRisk = riskMeasureEngine.valueAtRisk(exposures, volatilities, correlations, simulation);
        double variance = riskMeasureEngine.parametricVariance(exposures, volatilities, correlations);
        List<ExpectedShortfall> shortfall = riskMeasureEngine.expectedShortfall(simulation, base);
        ConcentrationRisk concentration = riskMeasureEngine.concentration(exposures);
        List<RiskFactor> factors = riskMeasureEngine.riskFactors(exposures, volatilities, correlations);

        RiskAssessment assessment = RiskAssessment.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .timestamp(Instant.now())
                .baseCurrency(base)
                .totalPortfolioValue(exposureResult.totalPortfolioValue())
                .totalForeignExposure(exposureResult.totalForeignExposure())
                .exposures(exposures)
                .volatilities(volatilities)
                .valueAtRisk(valueAtRisk)
                .parametricVariance(variance)
                .parametricStdDev(Math.sqrt(variance))
                .monteCarlo(new MonteCarloSummary(simulation.trials(), simulation.mean(), simulation.stdDev(),
                        simulation.correlated()))
                .expectedShortfall(shortfall)
                .concentration(concentration)
                .riskFactors(factors)
                .stressTests(stressTestEngine.run(exposures, exposureResult.totalForeignExposure()))
                .correlationMatrix(correlations)
                .totalRisk(riskMeasureEngine.totalRisk(exposures, volatilities))
                .riskScore(riskScorer.score(exposures, volatilities, concentration))
                .recommendations(riskScorer.recommendations(exposures, volatilities, concentration, factors))
                .build();
        verifyFinite(assessment);
        return assessment;
    }

    private void verifyFinite(RiskAssessment assessment) {
        boolean finite = Double.isFinite(assessment.getRiskScore())
                && Double.isFinite(assessment.getParametricVariance())
                && Double.isFinite(assessment.getTotalRisk())
                && assessment.getValueAtRisk().stream().allMatch(result -> Double.isFinite(result.historical())
                && Double.isFinite(result.parametric())
                && Double.isFinite(result.monteCarlo()));
        if (!finite) {
            throw new CalculationFailureException(OPERATION, assessment.getUserId(),
                    "Risk measures produced a non-finite value");
        }
    }
}
