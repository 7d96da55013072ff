package com.hedgewise.backend.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CostBenefitAnalysis {

    double directCost;
    double opportunityCost;
    double transactionCost;
    double totalCost;
    double riskReduction;
    double volatilityReduction;
    double downsideProtection;
    double totalBenefit;
    double benefitCostRatio;
    double hedgeEffectiveness;
    List<ScenarioOutcome> scenarios;
    double expectedNetBenefit;
}
