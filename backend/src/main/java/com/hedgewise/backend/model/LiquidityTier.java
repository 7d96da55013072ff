package com.hedgewise.backend.model;

public enum LiquidityTier {
    HIGH(1.0),
    MEDIUM(0.6),
    LOW(0.3);

    private final double score;

    LiquidityTier(double score) {
        this.score = score;
    }

    public double score() {
        return score;
    }

    public static LiquidityTier worstOf(LiquidityTier left, LiquidityTier right) {
        return left.score <= right.score ? left : right;
    }
}
