package com.rafaeldiaz.spread_sentinel.model;

import java.time.Instant;

/**
 * 📸 Foto inmutable del ticker de un exchange.
 * Se crea en cada consulta y se descarta tras la evaluación que la consume.
 */
public record Quote(String venue, double ask, double bid, Instant timestamp) {

    public Quote {
        if (venue == null || venue.isBlank()) {
            throw new IllegalArgumentException("venue requerido");
        }
        if (!(ask > 0) || !(bid > 0) || Double.isInfinite(ask) || Double.isInfinite(bid)) {
            throw new IllegalArgumentException("Precios inválidos para " + venue + ": ask=" + ask + " bid=" + bid);
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
