package com.rafaeldiaz.spread_sentinel.core.orchestrator;

/**
 * Configuración o credenciales inválidas. Fatal en el arranque.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
