package com.rafaeldiaz.spread_sentinel.model;

/**
 * Plan de dos piernas: comprar barato en un exchange y vender caro en el otro.
 */
public record ExecutionPlan(
        ProfitEstimate estimate,
        String buyVenue,
        double buyPrice,
        String sellVenue,
        double sellPrice
) {
    public Direction direction() {
        return estimate.direction();
    }
}
