package com.rafaeldiaz.spread_sentinel.core.orchestrator;

import com.rafaeldiaz.spread_sentinel.model.TradingMode;

import java.util.List;

/**
 * Capital libre por exchange y su variación desde la primera consulta del proceso.
 */
public record AccountStatus(TradingMode mode, String currency, List<VenueBalance> balances) {

    public AccountStatus {
        balances = List.copyOf(balances);
    }

    public record VenueBalance(String venue, double balance, double variation) {
    }
}
