package com.rafaeldiaz.spread_sentinel.core.orchestrator;

import com.rafaeldiaz.spread_sentinel.model.ArbitrageAnalysis;
import com.rafaeldiaz.spread_sentinel.model.TradeRecord;
import com.rafaeldiaz.spread_sentinel.model.TradingMode;

import java.util.List;

/**
 * Resultado de un ciclo de arbitraje: el análisis y las piernas ejecutadas (vacío si no hubo oportunidad).
 */
public record ArbitrageReport(TradingMode mode, ArbitrageAnalysis analysis, List<TradeRecord> trades) {

    public ArbitrageReport {
        trades = List.copyOf(trades);
    }

    public boolean executed() {
        return !trades.isEmpty();
    }

    /** Al menos una pierna falló y otra no: hay posición abierta que revisar a mano. */
    public boolean isPartial() {
        return trades.stream().anyMatch(TradeRecord::isFailed)
                && trades.stream().anyMatch(t -> !t.isFailed());
    }

    public boolean allFailed() {
        return executed() && trades.stream().allMatch(TradeRecord::isFailed);
    }
}
