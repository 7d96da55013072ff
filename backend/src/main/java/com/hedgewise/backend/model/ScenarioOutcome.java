package com.hedgewise.backend.model;

public record ScenarioOutcome(
        String name,
        double probability,
        double marketMove,
        double unhedgedLoss,
        double hedgedLoss,
        double hedgeCost,
        double netBenefit
) {
}
