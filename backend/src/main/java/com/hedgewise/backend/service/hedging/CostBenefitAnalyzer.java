package com.hedgewise.backend.service.hedging;

import com.hedgewise.backend.config.HedgingProperties;
import com.hedgewise.backend.model.CostBenefitAnalysis;
import com.hedgewise.backend.model.CurrencyExposure;
import com.hedgewise.backend.model.RiskAssessment;
import com.hedgewise.backend.model.ScenarioOutcome;
import com.hedgewise.backend.model.StrategyCandidate;
import com.hedgewise.backend.model.VarResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Prices a candidate at its current hedge ratio against the risk it removes.
 */
@Service
@RequiredArgsConstructor
public class CostBenefitAnalyzer {

    private static final double DOWNSIDE_CONFIDENCE = 0.95;

    private final HedgingProperties hedgingProperties;

    public CostBenefitAnalysis analyze(StrategyCandidate candidate, RiskAssessment assessment) {
        HedgingProperties.Cost costs = hedgingProperties.getCost();
        double ratio = candidate.getHedgeRatio();
        double effectiveness = candidate.getEffectiveness();
        double exposure = candidate.getExposure();
        double hedged = exposure * ratio;

        double directCost = candidate.isNatural() ? 0.0 : candidate.costAt(ratio);
        double opportunityCost = hedged * costs.getOpportunityRate() * candidate.getTimeHorizonDays() / 365.0;
        double transactionCost = candidate.isNatural() ? 0.0
                : candidate.getAllocations().size() * costs.getTransactionFixedFee()
                + hedged * costs.getTransactionVariableBps() / 10_000.0;
        double totalCost = directCost + opportunityCost + transactionCost;

        double riskReduction = candidate.getRiskContribution() * ratio * effectiveness;
        double volatilityReduction = exposure * candidate.getVolatility() * ratio * effectiveness;
        double downsideProtection = attributableVar(candidate, assessment) * ratio * effectiveness;
        double totalBenefit = riskReduction + volatilityReduction + downsideProtection;

        List<ScenarioOutcome> scenarios = new ArrayList<>();
        double expectedNetBenefit = 0.0;
        for (HedgingProperties.MacroScenario scenario : hedgingProperties.getScenarios()) {
            double unhedgedLoss = -exposure * scenario.getMarketMove();
            double hedgedLoss = unhedgedLoss * (1.0 - ratio * effectiveness);
            double netBenefit = unhedgedLoss - hedgedLoss - totalCost;
            scenarios.add(new ScenarioOutcome(scenario.getName(), scenario.getProbability(), scenario.getMarketMove(),
                    unhedgedLoss, hedgedLoss, totalCost, netBenefit));
            expectedNetBenefit += scenario.getProbability() * netBenefit;
        }

        return CostBenefitAnalysis.builder()
                .directCost(directCost)
                .opportunityCost(opportunityCost)
                .transactionCost(transactionCost)
                .totalCost(totalCost)
                .riskReduction(riskReduction)
                .volatilityReduction(volatilityReduction)
                .downsideProtection(downsideProtection)
                .totalBenefit(totalBenefit)
                .benefitCostRatio(totalBenefit / (totalCost + 1.0))
                .hedgeEffectiveness(ratio * effectiveness)
                .scenarios(scenarios)
                .expectedNetBenefit(expectedNetBenefit)
                .build();
    }

    /**
     * Share of the portfolio's parametric 95% VaR attributable to the candidate's currencies,
     * by relative exposure.
     */
    private static double attributableVar(StrategyCandidate candidate, RiskAssessment assessment) {
        double portfolioVar = assessment.varAt(DOWNSIDE_CONFIDENCE)
                .or(() -> assessment.getValueAtRisk().stream().findFirst())
                .map(VarResult::parametric)
                .orElse(0.0);
        double share = candidate.getCurrencies().stream()
                .map(assessment::exposureOf)
                .flatMap(Optional::stream)
                .mapToDouble(CurrencyExposure::relativeExposure)
                .sum();
        return portfolioVar * Math.min(1.0, share);
    }
}
