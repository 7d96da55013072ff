package com.hedgewise.backend.service.hedging;

import com.hedgewise.backend.config.HedgingProperties;
import com.hedgewise.backend.exception.CalculationFailureException;
import com.hedgewise.backend.exception.HedgingException;
import com.hedgewise.backend.model.CostBenefitAnalysis;
import com.hedgewise.backend.model.HedgingNeed;
import com.hedgewise.backend.model.HedgingRecommendation;
import com.hedgewise.backend.model.ImplementationPlan;
import com.hedgewise.backend.model.OptimizationResult;
import com.hedgewise.backend.model.RankedStrategy;
import com.hedgewise.backend.model.RiskAssessment;
import com.hedgewise.backend.model.StrategyCandidate;
import com.hedgewise.backend.model.StrategyProfile;
import com.hedgewise.backend.service.MetricsService;
import com.hedgewise.backend.service.RiskEventDispatcher;
import com.hedgewise.backend.service.risk.CalculationTracker;
import com.hedgewise.backend.service.risk.CurrencyRiskService;
import com.hedgewise.backend.util.CancellationToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Turns a risk assessment into a ranked set of hedging strategies with a rollout plan for the best one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HedgingStrategyService {

    static final String OPERATION = "hedging-optimization";

    private final CurrencyRiskService currencyRiskService;
    private final HedgingNeedAnalyzer needAnalyzer;
    private final StrategyGenerator strategyGenerator;
    private final HedgeRatioOptimizer ratioOptimizer;
    private final CostBenefitAnalyzer costBenefitAnalyzer;
    private final StrategyRanker strategyRanker;
    private final ImplementationPlanner implementationPlanner;
    private final HedgingProperties hedgingProperties;
    private final CalculationTracker calculationTracker;
    private final RiskEventDispatcher eventDispatcher;
    private final MetricsService metricsService;

    public HedgingRecommendation recommend(String userId, StrategyProfile profile) {
        return recommend(currencyRiskService.requireLatestAssessment(userId), profile);
    }

    public HedgingRecommendation recommend(RiskAssessment assessment, StrategyProfile profile) {
        String userId = assessment.getUserId();
        CancellationToken token = calculationTracker.start(OPERATION, userId);
        try {
            HedgingRecommendation recommendation = build(assessment, profile, token);
            token.throwIfCancelled(OPERATION);
            metricsService.recordRecommendation();
            log.info("Hedging recommendation for user {}: {} needs, {} strategies, top {}", userId,
                    recommendation.getNeeds().size(), recommendation.getStrategies().size(),
                    recommendation.getStrategies().isEmpty() ? "none" : recommendation.getStrategies().get(0).strategy().getId());
            eventDispatcher.strategiesGenerated(recommendation);
            return recommendation;
        } catch (HedgingException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Hedging optimization failed for user {}", userId, e);
            throw new CalculationFailureException(OPERATION, userId, "Hedging optimization failed: " + e.getMessage(), e);
        } finally {
            calculationTracker.finish(OPERATION, userId, token);
        }
    }

    private HedgingRecommendation build(RiskAssessment assessment, StrategyProfile profile, CancellationToken token) {
        List<HedgingNeed> needs = needAnalyzer.analyze(assessment);
        List<StrategyCandidate> candidates = strategyGenerator.generate(needs, assessment.getCorrelationMatrix(), profile);
        HedgingProperties.Profile settings = profile == null ? null : hedgingProperties.getProfiles().get(profile);
        List<OptimizationResult> optimized = ratioOptimizer.optimizeAll(candidates, ratioOptimizer.bounds(settings), token);
        token.throwIfCancelled(OPERATION);

        List<CostBenefitAnalysis> analyses = optimized.stream()
                .map(result -> costBenefitAnalyzer.analyze(result.candidate(), assessment))
                .toList();
        List<RankedStrategy> ranked = strategyRanker.rank(optimized, analyses);
        ImplementationPlan plan = ranked.isEmpty() ? null : implementationPlanner.plan(ranked.get(0).strategy());

        return HedgingRecommendation.builder()
                .userId(assessment.getUserId())
                .assessmentId(assessment.getId())
                .generatedAt(Instant.now())
                .profile(profile)
                .needs(needs)
                .strategies(ranked)
                .implementationPlan(plan)
                .totalRiskReduction(ranked.stream().mapToDouble(entry -> entry.analysis().getRiskReduction()).sum())
                .totalCost(ranked.stream().mapToDouble(entry -> entry.analysis().getTotalCost()).sum())
                .build();
    }
}
