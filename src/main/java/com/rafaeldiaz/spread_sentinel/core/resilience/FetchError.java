package com.rafaeldiaz.spread_sentinel.core.resilience;

public enum FetchError {
    /** Se agotaron los intentos: dato no disponible en este ciclo. */
    EXHAUSTED,
    /** La espera entre intentos fue cancelada. */
    CANCELLED
}
