package com.hedgewise.backend.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Catalog entry describing a tradeable hedging instrument.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HedgeInstrument {

    @NotNull
    private InstrumentType type;

    @PositiveOrZero
    private double costBasisPoints;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double effectiveness;

    @PositiveOrZero
    private double minimumAmount;

    @Min(1)
    private int maximumTenorDays;

    @NotNull
    private LiquidityTier liquidity;

    public double costFor(double notional) {
        return notional * costBasisPoints / 10_000.0;
    }
}
