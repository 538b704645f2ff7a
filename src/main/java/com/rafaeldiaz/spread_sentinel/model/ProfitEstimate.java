package com.rafaeldiaz.spread_sentinel.model;

/**
 * Resultado del modelo de beneficio para un sentido concreto.
 *
 * @param direction        sentido evaluado
 * @param rawSpread        bid(venta) - ask(compra), sin comisiones
 * @param netProfit        beneficio neto en moneda de cotización por unidad
 * @param netProfitPercent beneficio neto sobre el coste efectivo de compra, en %
 */
public record ProfitEstimate(
        Direction direction,
        double rawSpread,
        double netProfit,
        double netProfitPercent
) {
    public boolean isProfitable() {
        return netProfit > 0;
    }
}
