package com.hedgewise.backend.service.hedging;

import com.hedgewise.backend.config.HedgingProperties;
import com.hedgewise.backend.model.CostBenefitAnalysis;
import com.hedgewise.backend.model.OptimizationResult;
import com.hedgewise.backend.model.RankedStrategy;
import com.hedgewise.backend.model.StrategyCandidate;
import com.hedgewise.backend.model.StrategyType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders analysed candidates by a weighted score. Ties fall back to risk reduction, then id,
 * so ranking an already ranked list keeps its order.
 */
@Service
@RequiredArgsConstructor
public class StrategyRanker {

    private static final Comparator<RankedStrategy> ORDER =
            Comparator.comparingDouble(RankedStrategy::score).reversed()
                    .thenComparing(Comparator.comparingDouble((RankedStrategy ranked) -> ranked.analysis().getRiskReduction())
                            .reversed())
                    .thenComparing(ranked -> ranked.strategy().getId());

    private final HedgingProperties hedgingProperties;

    public List<RankedStrategy> rank(List<OptimizationResult> optimized, List<CostBenefitAnalysis> analyses) {
        if (optimized.size() != analyses.size()) {
            throw new IllegalArgumentException("Expected one analysis per optimised candidate");
        }
        List<RankedStrategy> scored = new ArrayList<>(optimized.size());
        for (int i = 0; i < optimized.size(); i++) {
            OptimizationResult result = optimized.get(i);
            CostBenefitAnalysis analysis = analyses.get(i);
            scored.add(new RankedStrategy(0, result.candidate(), result, analysis, score(result.candidate(), analysis)));
        }
        return order(scored);
    }

    public List<RankedStrategy> rerank(List<RankedStrategy> ranked) {
        List<RankedStrategy> rescored = ranked.stream()
                .map(entry -> new RankedStrategy(entry.rank(), entry.strategy(), entry.optimization(), entry.analysis(),
                        score(entry.strategy(), entry.analysis())))
                .toList();
        return order(rescored);
    }

    public double score(StrategyCandidate candidate, CostBenefitAnalysis analysis) {
        HedgingProperties.Ranking weights = hedgingProperties.getRanking();
        double bcr = Math.max(0.0, analysis.getBenefitCostRatio());
        double normalizedBcr = bcr / (1.0 + bcr);
        double riskReduction = candidate.getHedgeRatio() * candidate.getEffectiveness();
        double liquidity = candidate.getLiquidity() == null ? 0.0 : candidate.getLiquidity().score();
        double simplicity = candidate.getType() == StrategyType.SINGLE ? 1.0 : 0.0;
        return weights.getBenefitCostWeight() * normalizedBcr
                + weights.getRiskReductionWeight() * riskReduction
                + weights.getEffectivenessWeight() * candidate.getEffectiveness()
                + weights.getLiquidityWeight() * liquidity
                + weights.getSimplicityWeight() * simplicity;
    }

    private static List<RankedStrategy> order(List<RankedStrategy> strategies) {
        List<RankedStrategy> sorted = new ArrayList<>(strategies);
        sorted.sort(ORDER);
        List<RankedStrategy> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ranked.add(sorted.get(i).withRank(i + 1));
        }
        return ranked;
    }
}
