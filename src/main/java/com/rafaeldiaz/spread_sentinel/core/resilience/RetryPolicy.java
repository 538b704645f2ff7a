package com.rafaeldiaz.spread_sentinel.core.resilience;

import java.time.Duration;

/**
 * Política de reintentos: intentos máximos, espera inicial y factor exponencial.
 * Ejemplo por defecto: 3 intentos, 1s -> 2s entre ellos.
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, double backoffFactor) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(1), 2.0);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts debe ser >= 1");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay inválido");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor debe ser >= 1");
        }
    }

    /**
     * Espera antes del intento {@code attempt + 1} (attempt empieza en 1).
     */
    public Duration delayAfter(int attempt) {
        double factor = Math.pow(backoffFactor, attempt - 1);
        return Duration.ofMillis((long) (initialDelay.toMillis() * factor));
    }
}
