package com.hedgewise.backend.model;

import java.util.List;

public record ImplementationPlan(
        String strategyId,
        List<ImplementationPhase> phases,
        List<String> prerequisites,
        List<String> risks,
        List<String> monitoringMetrics
) {

    public int totalDurationDays() {
        return phases.stream().mapToInt(ImplementationPhase::durationDays).sum();
    }
}
