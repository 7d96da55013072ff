package com.hedgewise.backend.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of one risk calculation for a user. Instances are never mutated; a newer
 * calculation replaces the cached one.
 */
@Value
@Builder
public class RiskAssessment {

    String id;
    String userId;
    Instant timestamp;
    String baseCurrency;
    double totalPortfolioValue;
    double totalForeignExposure;
    @Singular
    List<CurrencyExposure> exposures;
    @Singular
    Map<String, VolatilityProfile> volatilities;
    List<VarResult> valueAtRisk;
    double parametricVariance;
    double parametricStdDev;
    MonteCarloSummary monteCarlo;
    List<ExpectedShortfall> expectedShortfall;
    ConcentrationRisk concentration;
    @Singular
    List<RiskFactor> riskFactors;
    @Singular
    List<StressTestResult> stressTests;
    CorrelationMatrix correlationMatrix;
    double totalRisk;
    double riskScore;
    @Singular
    List<RiskRecommendation> recommendations;

    public Optional<VarResult> varAt(double confidenceLevel) {
        return valueAtRisk.stream()
                .filter(result -> Math.abs(result.confidenceLevel() - confidenceLevel) < 1e-9)
                .findFirst();
    }

    public Optional<CurrencyExposure> exposureOf(String currency) {
        return exposures.stream().filter(exposure -> exposure.currency().equals(currency)).findFirst();
    }
}
