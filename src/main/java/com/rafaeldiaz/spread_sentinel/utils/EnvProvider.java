package com.rafaeldiaz.spread_sentinel.utils;

/**
 * Fuente de claves de configuración (entorno, .env o un Map en tests).
 */
@FunctionalInterface
public interface EnvProvider {
    String get(String key);
}
