package com.rafaeldiaz.spread_sentinel.model;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Análisis completo de un par de cotizaciones: ambos sentidos y, si supera el umbral, el plan.
 * {@code plan} es null cuando no hay oportunidad.
 */
public record ArbitrageAnalysis(
        Quote quoteA,
        Quote quoteB,
        ProfitEstimate aToB,
        ProfitEstimate bToA,
        @Nullable ExecutionPlan plan
) {
    public Optional<ExecutionPlan> opportunity() {
        return Optional.ofNullable(plan);
    }
}
