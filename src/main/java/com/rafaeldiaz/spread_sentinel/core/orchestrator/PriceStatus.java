package com.rafaeldiaz.spread_sentinel.core.orchestrator;

import com.rafaeldiaz.spread_sentinel.model.Quote;

/**
 * Cotizaciones actuales y spreads brutos en ambos sentidos (sin comisiones).
 */
public record PriceStatus(Quote quoteA, Quote quoteB, double spreadAToB, double spreadBToA) {
}
