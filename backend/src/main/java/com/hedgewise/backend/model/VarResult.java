package com.hedgewise.backend.model;

import java.util.Map;

/**
 * Value at risk at one confidence level for each of the three methods, as positive loss amounts.
 */
public record VarResult(
        double confidenceLevel,
        double historical,
        Map<String, Double> historicalByCurrency,
        double parametric,
        double monteCarlo
) {
}
