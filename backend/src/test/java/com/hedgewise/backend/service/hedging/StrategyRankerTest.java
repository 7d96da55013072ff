package com.hedgewise.backend.service.hedging;

import com.hedgewise.backend.model.CostBenefitAnalysis;
import com.hedgewise.backend.model.LiquidityTier;
import com.hedgewise.backend.model.OptimizationResult;
import com.hedgewise.backend.model.Priority;
import com.hedgewise.backend.model.RankedStrategy;
import com.hedgewise.backend.model.StrategyCandidate;
import com.hedgewise.backend.model.StrategyType;
import com.hedgewise.backend.util.RiskFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;

class StrategyRankerTest {

    private final StrategyRanker ranker = new StrategyRanker(RiskFixtures.hedgingProperties());

    private static StrategyCandidate candidate(String id, StrategyType type, double ratio, double effectiveness,
                                               LiquidityTier liquidity) {
        return StrategyCandidate.builder()
                .id(id)
                .type(type)
                .currencies(List.of("EUR"))
                .exposure(100_000)
                .allocations(List.of())
                .hedgeRatio(ratio)
                .timeHorizonDays(90)
                .effectiveness(effectiveness)
                .liquidity(liquidity)
                .priority(Priority.HIGH)
                .build();
    }

    private static CostBenefitAnalysis analysis(double benefitCostRatio, double riskReduction) {
        return CostBenefitAnalysis.builder()
                .benefitCostRatio(benefitCostRatio)
                .riskReduction(riskReduction)
                .scenarios(List.of())
                .build();
    }

    private static OptimizationResult optimized(StrategyCandidate candidate) {
        return new OptimizationResult(candidate, candidate.getHedgeRatio(), candidate.getHedgeRatio(), 0.0, 1, true);
    }

    @Test
    void scoreCombinesWeightedCriteria() {
        StrategyCandidate forward = candidate("single-EUR-forward_contract", StrategyType.SINGLE, 0.5, 0.9,
                LiquidityTier.HIGH);

        double score = ranker.score(forward, analysis(3.0, 100));

        double expected = 0.3 * 0.75 + 0.3 * 0.45 + 0.2 * 0.9 + 0.1 * 1.0 + 0.1 * 1.0;
        assertThat(score).isCloseTo(expected, offset(1e-12));
    }

    @Test
    void ranksByScoreAndNumbersFromOne() {
        List<StrategyCandidate> candidates = List.of(
                candidate("basket-EUR-GBP-JPY", StrategyType.BASKET, 0.4, 0.75, LiquidityTier.MEDIUM),
                candidate("single-EUR-forward_contract", StrategyType.SINGLE, 0.9, 0.95, LiquidityTier.HIGH),
                candidate("single-EUR-currency_option", StrategyType.SINGLE, 0.6, 0.85, LiquidityTier.MEDIUM));
        List<CostBenefitAnalysis> analyses = List.of(analysis(5, 300), analysis(5, 900), analysis(2, 500));

        List<RankedStrategy> ranked = ranker.rank(candidates.stream().map(StrategyRankerTest::optimized).toList(),
                analyses);

        assertThat(ranked).extracting(entry -> entry.strategy().getId()).containsExactly(
                "single-EUR-forward_contract", "single-EUR-currency_option", "basket-EUR-GBP-JPY");
        assertThat(ranked).extracting(RankedStrategy::rank).containsExactly(1, 2, 3);
        for (int i = 1; i < ranked.size(); i++) {
            assertThat(ranked.get(i).score()).isLessThanOrEqualTo(ranked.get(i - 1).score());
        }
    }

    @Test
    void tiesBreakOnRiskReductionThenId() {
        StrategyCandidate first = candidate("b", StrategyType.SINGLE, 0.5, 0.9, LiquidityTier.HIGH);
        StrategyCandidate second = candidate("a", StrategyType.SINGLE, 0.5, 0.9, LiquidityTier.HIGH);
        StrategyCandidate third = candidate("c", StrategyType.SINGLE, 0.5, 0.9, LiquidityTier.HIGH);

        List<RankedStrategy> ranked = ranker.rank(List.of(optimized(first), optimized(second), optimized(third)),
                List.of(analysis(1, 10), analysis(1, 10), analysis(1, 20)));

        assertThat(ranked).extracting(entry -> entry.strategy().getId()).containsExactly("c", "a", "b");
    }

    @Test
    void rerankingARankedListKeepsItsOrder() {
        List<StrategyCandidate> candidates = List.of(
                candidate("x", StrategyType.SINGLE, 0.5, 0.9, LiquidityTier.HIGH),
                candidate("y", StrategyType.COMBINATION, 0.7, 0.92, LiquidityTier.MEDIUM),
                candidate("z", StrategyType.NATURAL, 0.625, 0.7, LiquidityTier.HIGH),
                candidate("w", StrategyType.SINGLE, 0.5, 0.9, LiquidityTier.HIGH));
        List<RankedStrategy> ranked = ranker.rank(candidates.stream().map(StrategyRankerTest::optimized).toList(),
                List.of(analysis(2, 50), analysis(4, 60), analysis(30, 40), analysis(2, 50)));

        List<RankedStrategy> reranked = ranker.rerank(ranked);

        assertThat(reranked).extracting(entry -> entry.strategy().getId())
                .containsExactlyElementsOf(ranked.stream().map(entry -> entry.strategy().getId()).toList());
        assertThat(reranked).extracting(RankedStrategy::rank).containsExactly(1, 2, 3, 4);
    }

    @Test
    void rejectsMismatchedInputs() {
        StrategyCandidate forward = candidate("x", StrategyType.SINGLE, 0.5, 0.9, LiquidityTier.HIGH);

        assertThatThrownBy(() -> ranker.rank(List.of(optimized(forward)), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
