package com.rafaeldiaz.spread_sentinel.core.resilience;

import com.rafaeldiaz.spread_sentinel.utils.BotLogger;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * 🛡️ NÚCLEO DE RESILIENCIA
 * Envuelve lecturas a los exchanges (ticker, balance) con reintentos y espera exponencial.
 * Nunca lanza: devuelve un {@link FetchResult} que el llamador trata como
 * "dato no disponible en este ciclo".
 *
 * <p>Solo para lecturas. El envío de órdenes NO pasa por aquí (reintentar puede duplicar la orden).</p>
 */
public class ResilientFetcher {

    private final RetryPolicy policy;

    public ResilientFetcher(RetryPolicy policy) {
        this.policy = policy;
    }

    public RetryPolicy policy() {
        return policy;
    }

    public <T> FetchResult<T> fetch(String operationName, Callable<T> operation) {
        return fetch(operationName, operation, Sleeper.THREAD);
    }

    /**
     * @param sleeper espera entre intentos; dentro de un loop es su token de cancelación
     */
    public <T> FetchResult<T> fetch(String operationName, Callable<T> operation, Sleeper sleeper) {
        Exception lastFailure = null;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                return FetchResult.success(operation.call());
            } catch (Exception e) {
                lastFailure = e;
                BotLogger.warn("⚠️ Error en " + operationName + ": " + e.getMessage()
                        + " (intento " + attempt + "/" + policy.maxAttempts() + ")");
            }

            if (attempt < policy.maxAttempts()) {
                Duration delay = policy.delayAfter(attempt);
                if (!sleeper.sleep(delay)) {
                    BotLogger.info("⏹ " + operationName + " cancelado durante el backoff.");
                    return FetchResult.failure(FetchError.CANCELLED, lastFailure);
                }
            }
        }

        BotLogger.error("❌ Fallo tras " + policy.maxAttempts() + " intentos en " + operationName + ".");
        return FetchResult.failure(FetchError.EXHAUSTED, lastFailure);
    }
}
