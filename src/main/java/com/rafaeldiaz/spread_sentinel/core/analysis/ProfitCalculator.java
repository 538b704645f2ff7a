package com.rafaeldiaz.spread_sentinel.core.analysis;

import com.rafaeldiaz.spread_sentinel.model.Direction;
import com.rafaeldiaz.spread_sentinel.model.ProfitEstimate;

/**
 * 🧮 PROFIT CALCULATOR (El Contador)
 * Resultado matemático de comprar en un exchange y vender en el otro.
 * Funciones puras, sin estado ni efectos.
 */
public class ProfitCalculator {

    /**
     * Spread bruto: lo que se gana vendiendo al bid tras comprar al ask, sin comisiones.
     */
    public double spread(double ask, double bid) {
        return bid - ask;
    }

    /**
     * Beneficio tras comisiones. La comisión se aplica a ambas piernas:
     * la compra paga sobre el coste, la venta sobre lo ingresado.
     *
     * @param buyPrice  ask del exchange donde compramos
     * @param sellPrice bid del exchange donde vendemos
     * @param feeRate   comisión por operación (0.001 = 0.1%)
     */
    public ProfitEstimate profitAfterFees(Direction direction, double buyPrice, double sellPrice, double feeRate) {
        double effectiveBuy = buyPrice * (1 + feeRate);
        if (effectiveBuy == 0) {
            throw new IllegalArgumentException("Coste efectivo de compra nulo (buyPrice=" + buyPrice + ")");
        }
        double effectiveSell = sellPrice * (1 - feeRate);

        double netProfit = effectiveSell - effectiveBuy;
        double netPercent = (netProfit / effectiveBuy) * 100.0;

        return new ProfitEstimate(direction, spread(buyPrice, sellPrice), netProfit, netPercent);
    }
}
