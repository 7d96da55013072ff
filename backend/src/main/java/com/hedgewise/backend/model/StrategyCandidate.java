package com.hedgewise.backend.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class StrategyCandidate {

    String id;
    StrategyType type;
    List<String> currencies;
    double exposure;
    List<InstrumentAllocation> allocations;
    double hedgeRatio;
    int timeHorizonDays;
    double totalCost;
    double effectiveness;
    LiquidityTier liquidity;
    Priority priority;
    double riskContribution;
    double volatility;

    public StrategyCandidate withHedgeRatio(double ratio) {
        return toBuilder().hedgeRatio(ratio).build();
    }

    /**
     * Direct instrument cost when hedging {@code ratio} of the exposure.
     */
    public double costAt(double ratio) {
        return totalCost * ratio;
    }

    public boolean isNatural() {
        return type == StrategyType.NATURAL;
    }
}
