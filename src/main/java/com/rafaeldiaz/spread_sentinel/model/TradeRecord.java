package com.rafaeldiaz.spread_sentinel.model;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * 🧾 Una pierna ejecutada (o simulada). Inmutable; se crea una sola vez y va al ledger.
 * {@code orderReference} y {@code failureReason} pueden ser null.
 */
public record TradeRecord(
        Instant timestamp,
        TradeAction action,
        String venue,
        double price,
        @Nullable String orderReference,
        @Nullable String failureReason
) {

    public static TradeRecord simulated(TradeAction action, String venue, double price) {
        return new TradeRecord(Instant.now(), action, venue, price, null, null);
    }

    public static TradeRecord filled(TradeAction action, String venue, double price, String orderReference) {
        return new TradeRecord(Instant.now(), action, venue, price, orderReference, null);
    }

    public static TradeRecord failed(TradeAction action, String venue, double price, String reason) {
        return new TradeRecord(Instant.now(), action, venue, price, null, reason);
    }

    public boolean isFailed() {
        return failureReason != null;
    }
}
