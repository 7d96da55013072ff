package com.hedgewise.backend.model;

import java.util.Map;

public record StressTestResult(
        String scenario,
        double totalLoss,
        double lossFraction,
        Severity severity,
        Map<String, Double> lossesByCurrency
) {
}
