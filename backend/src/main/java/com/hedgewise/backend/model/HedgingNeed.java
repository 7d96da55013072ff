package com.hedgewise.backend.model;

public record HedgingNeed(
        String currency,
        double exposure,
        double relativeExposure,
        Priority priority,
        double riskContribution,
        double volatility,
        double recommendedHedgeRatio,
        int timeHorizonDays,
        Urgency urgency
) {
}
