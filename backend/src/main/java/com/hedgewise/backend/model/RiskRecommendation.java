package com.hedgewise.backend.model;

public record RiskRecommendation(Type type, Priority priority, String message) {

    public enum Type {
        DIVERSIFICATION,
        CORRELATION,
        VOLATILITY
    }
}
