package com.hedgewise.backend.model;

public record MonteCarloSummary(int trials, double meanReturn, double stdDev, boolean correlatedDraws) {
}
