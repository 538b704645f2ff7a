package com.rafaeldiaz.spread_sentinel.core.resilience;

import java.time.Duration;

/**
 * Espera entre reintentos. Devuelve false si la espera fue abortada (stop del loop o interrupción).
 */
@FunctionalInterface
public interface Sleeper {

    boolean sleep(Duration duration);

    /** Espera de hilo normal; solo se corta con una interrupción. */
    Sleeper THREAD = duration -> {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    };
}
