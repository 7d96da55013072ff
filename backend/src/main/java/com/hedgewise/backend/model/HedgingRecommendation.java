package com.hedgewise.backend.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class HedgingRecommendation {

    String userId;
    String assessmentId;
    Instant generatedAt;
    StrategyProfile profile;
    List<HedgingNeed> needs;
    List<RankedStrategy> strategies;
    ImplementationPlan implementationPlan;
    double totalRiskReduction;
    double totalCost;
}
