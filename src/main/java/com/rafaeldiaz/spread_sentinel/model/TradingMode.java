package com.rafaeldiaz.spread_sentinel.model;

/**
 * Modo de operación: SIMULATION solo anota, REAL envía órdenes a mercado.
 */
public enum TradingMode {
    SIMULATION("Simulación"),
    REAL("Real");

    private final String label;

    TradingMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
