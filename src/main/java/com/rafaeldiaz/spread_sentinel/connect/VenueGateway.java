package com.rafaeldiaz.spread_sentinel.connect;

import com.rafaeldiaz.spread_sentinel.model.Quote;
import com.rafaeldiaz.spread_sentinel.model.TradeAction;

/**
 * Las tres operaciones que el núcleo consume de cada exchange.
 * Las dos lecturas se pueden reintentar; el envío de órdenes NO.
 */
public interface VenueGateway {

    /** Identificador corto del exchange ("okx", "kraken"). */
    String name();

    /** Mejor ask y mejor bid actuales para el símbolo (formato "BTC/USDT"). */
    Quote fetchQuote(String symbol) throws VenueException;

    /** Saldo libre (disponible para operar) de una moneda. */
    double fetchFreeBalance(String currency) throws VenueException;

    /**
     * Orden a mercado por {@code amount} unidades de la moneda base.
     *
     * @return referencia de la orden asignada por el exchange
     */
    String submitMarketOrder(String symbol, TradeAction side, double amount) throws VenueException;
}
