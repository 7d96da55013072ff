package com.hedgewise.backend.model;

import java.util.List;

/**
 * One term of the portfolio risk decomposition.
 *
 * @param correlation pair correlation for {@link FactorType#CORRELATION} factors, null otherwise
 */
public record RiskFactor(
        FactorType type,
        List<String> currencies,
        double contribution,
        double relativeContribution,
        Double correlation
) {

    public enum FactorType {
        INDIVIDUAL,
        CORRELATION
    }
}
