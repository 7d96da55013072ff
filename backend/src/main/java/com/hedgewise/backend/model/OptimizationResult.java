package com.hedgewise.backend.model;

/**
 * Outcome of tuning one candidate's hedge ratio. Hitting the iteration cap leaves
 * {@code converged} false but still returns the best ratio found.
 */
public record OptimizationResult(
        StrategyCandidate candidate,
        double initialRatio,
        double optimizedRatio,
        double utility,
        int iterations,
        boolean converged
) {
}
