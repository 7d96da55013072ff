package com.hedgewise.backend.model;

import java.util.List;

public record ConcentrationRisk(
        double herfindahlIndex,
        double maxConcentration,
        double top3Concentration,
        RiskLevel level,
        List<CurrencyConcentration> currencies,
        List<String> advice
) {

    public static ConcentrationRisk none() {
        return new ConcentrationRisk(0.0, 0.0, 0.0, RiskLevel.LOW, List.of(), List.of());
    }

    public record CurrencyConcentration(String currency, double concentration, boolean highConcentration) {
    }
}
