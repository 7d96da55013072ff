package com.hedgewise.backend.model;

public record RankedStrategy(
        int rank,
        StrategyCandidate strategy,
        OptimizationResult optimization,
        CostBenefitAnalysis analysis,
        double score
) {

    public RankedStrategy withRank(int newRank) {
        return new RankedStrategy(newRank, strategy, optimization, analysis, score);
    }
}
