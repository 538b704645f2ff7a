package com.rafaeldiaz.spread_sentinel.core.resilience;

import org.jetbrains.annotations.Nullable;

import java.util.NoSuchElementException;

/**
 * Resultado de una lectura con reintentos: valor o fallo definitivo, nunca ambos.
 */
public final class FetchResult<T> {

    private final T value;
    private final FetchError error;
    private final Exception lastFailure;

    private FetchResult(T value, FetchError error, Exception lastFailure) {
        this.value = value;
        this.error = error;
        this.lastFailure = lastFailure;
    }

    public static <T> FetchResult<T> success(T value) {
        return new FetchResult<>(value, null, null);
    }

    public static <T> FetchResult<T> failure(FetchError error, Exception lastFailure) {
        return new FetchResult<>(null, error, lastFailure);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T value() {
        if (error != null) {
            throw new NoSuchElementException("Sin valor: " + error);
        }
        return value;
    }

    @Nullable
    public FetchError error() {
        return error;
    }

    /** Última excepción observada; null si tuvo éxito o si se canceló antes del primer fallo. */
    @Nullable
    public Exception lastFailure() {
        return lastFailure;
    }

    public String describeFailure() {
        if (error == null) return "OK";
        return lastFailure != null ? error + " (" + lastFailure.getMessage() + ")" : error.toString();
    }

    @Override
    public String toString() {
        return isSuccess() ? "FetchResult[" + value + "]" : "FetchResult[" + describeFailure() + "]";
    }
}
