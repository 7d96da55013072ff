package com.hedgewise.backend.model;

/**
 * Portion of a strategy assigned to one instrument.
 *
 * @param cost cost of hedging {@code amount} in full, before the strategy's hedge ratio is applied
 */
public record InstrumentAllocation(
        InstrumentType instrument,
        double amount,
        double portion,
        double cost,
        double effectiveness
) {
}
