package com.rafaeldiaz.spread_sentinel.execution;

import com.rafaeldiaz.spread_sentinel.connect.VenueException;
import com.rafaeldiaz.spread_sentinel.connect.VenueGateway;
import com.rafaeldiaz.spread_sentinel.core.ledger.TradeLedger;
import com.rafaeldiaz.spread_sentinel.core.resilience.FetchResult;
import com.rafaeldiaz.spread_sentinel.core.resilience.ResilientFetcher;
import com.rafaeldiaz.spread_sentinel.model.TradeAction;
import com.rafaeldiaz.spread_sentinel.model.TradeRecord;
import com.rafaeldiaz.spread_sentinel.model.TradingMode;
import com.rafaeldiaz.spread_sentinel.utils.BotLogger;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * ⚔️ TRADE EXECUTOR
 * Ejecuta UNA pierna (compra o venta) en un exchange, simulada o real,
 * y deja exactamente un {@link TradeRecord} en el ledger del modo, salga bien o mal.
 *
 * <p>Modo real:</p>
 * <ul>
 * <li>BUY: verifica saldo libre en moneda de cotización antes de enviar. Sin saldo, no hay orden.</li>
 * <li>SELL: se envía directamente (se asume el activo en cartera).</li>
 * <li>El envío de la orden se intenta UNA sola vez; reintentar puede duplicarla.</li>
 * </ul>
 */
public class TradeExecutor {

    public static final String INSUFFICIENT_BALANCE = "insufficient balance";
    public static final String BALANCE_UNAVAILABLE = "balance unavailable";

    private final ResilientFetcher fetcher;
    private final Map<TradingMode, TradeLedger> ledgers;
    private final String symbol;
    private final String quoteCurrency;
    private final double tradeAmount;

    public TradeExecutor(ResilientFetcher fetcher, Map<TradingMode, TradeLedger> ledgers,
                         String symbol, String quoteCurrency, double tradeAmount) {
        this.fetcher = fetcher;
        this.ledgers = new EnumMap<>(ledgers);
        this.symbol = symbol;
        this.quoteCurrency = quoteCurrency;
        this.tradeAmount = tradeAmount;
        for (TradingMode mode : TradingMode.values()) {
            if (!this.ledgers.containsKey(mode)) {
                throw new IllegalArgumentException("Falta ledger para " + mode);
            }
        }
    }

    public TradeRecord execute(TradeAction action, VenueGateway venue, double price, TradingMode mode) {
        TradeRecord record = (mode == TradingMode.SIMULATION)
                ? simulate(action, venue, price)
                : executeReal(action, venue, price);

        ledgers.get(mode).append(record);
        BotLogger.logTrade(mode, record);
        return record;
    }

    public double tradeAmount() {
        return tradeAmount;
    }

    private TradeRecord simulate(TradeAction action, VenueGateway venue, double price) {
        BotLogger.info(String.format(Locale.US, "🧪 [SIMULACIÓN] %s en %s a %.2f %s",
                action == TradeAction.BUY ? "Compra" : "Venta", venue.name().toUpperCase(Locale.ROOT), price, quoteCurrency));
        return TradeRecord.simulated(action, venue.name(), price);
    }

    private TradeRecord executeReal(TradeAction action, VenueGateway venue, double price) {
        String venueName = venue.name();

        if (action == TradeAction.BUY) {
            FetchResult<Double> balance = fetcher.fetch("balance " + venueName + " " + quoteCurrency,
                    () -> venue.fetchFreeBalance(quoteCurrency));
            if (!balance.isSuccess()) {
                BotLogger.error("⛔ No se pudo leer el saldo en " + venueName + ": " + balance.describeFailure());
                return TradeRecord.failed(action, venueName, price, BALANCE_UNAVAILABLE);
            }
            double required = price * tradeAmount;
            if (balance.value() < required) {
                BotLogger.error(String.format(Locale.US, "🚫 Saldo insuficiente en %s para comprar: %.2f < %.2f %s",
                        venueName, balance.value(), required, quoteCurrency));
                return TradeRecord.failed(action, venueName, price, INSUFFICIENT_BALANCE);
            }
        }

        try {
            String orderId = venue.submitMarketOrder(symbol, action, tradeAmount);
            BotLogger.info("🔫 [REAL] " + action + " en " + venueName + " -> orden " + orderId);
            return TradeRecord.filled(action, venueName, price, orderId);
        } catch (VenueException e) {
            BotLogger.error("💥 Orden " + action + " rechazada en " + venueName + ": " + e.getMessage());
            return TradeRecord.failed(action, venueName, price, e.getMessage());
        } catch (RuntimeException e) {
            BotLogger.error("💥 Falla inesperada enviando " + action + " a " + venueName + ": " + e.getMessage());
            return TradeRecord.failed(action, venueName, price, String.valueOf(e.getMessage()));
        }
    }
}
