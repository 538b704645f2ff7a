package com.rafaeldiaz.spread_sentinel.model;

import java.util.Locale;

public enum TradeAction {
    BUY,
    SELL;

    /** Lado en minúsculas tal como lo esperan las APIs ("buy" / "sell"). */
    public String venueSide() {
        return name().toLowerCase(Locale.ROOT);
    }
}
