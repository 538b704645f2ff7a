package com.rafaeldiaz.spread_sentinel.telegram;

import com.rafaeldiaz.spread_sentinel.core.orchestrator.AccountStatus;
import com.rafaeldiaz.spread_sentinel.core.orchestrator.ArbitrageReport;
import com.rafaeldiaz.spread_sentinel.core.orchestrator.PriceStatus;
import com.rafaeldiaz.spread_sentinel.model.ArbitrageAnalysis;
import com.rafaeldiaz.spread_sentinel.model.ExecutionPlan;
import com.rafaeldiaz.spread_sentinel.model.ProfitEstimate;
import com.rafaeldiaz.spread_sentinel.model.Quote;
import com.rafaeldiaz.spread_sentinel.model.TradeAction;
import com.rafaeldiaz.spread_sentinel.model.TradeRecord;
import com.rafaeldiaz.spread_sentinel.model.TradingMode;

import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * 🖨️ FORMATEADOR DE MENSAJES (HTML de Telegram)
 * Todo el texto que ve el operador sale de aquí. Decimales siempre con Locale.US.
 */
public class MessageFormatter {

    private static final String COMMANDS =
            "<u>Simulación:</u>\n"
                    + "• <b>/status</b> - Precios y spreads\n"
                    + "• <b>/arbitrage</b> - Analiza y simula una oportunidad\n"
                    + "• <b>/account_status</b> - Capital y variación\n"
                    + "• <b>/history</b> - Últimas operaciones simuladas\n"
                    + "• <b>/start_loop</b> - Lanza la vigilancia continua\n"
                    + "• <b>/stop_loop</b> - Detiene la vigilancia continua\n\n"
                    + "<u>Real:</u>\n"
                    + "• <b>/real_status</b> - Precios para trading real\n"
                    + "• <b>/real_account</b> - Capital real de las cuentas\n"
                    + "• <b>/real_history</b> - Últimas operaciones reales\n"
                    + "• <b>/real_arbitrage</b> - Ejecuta una oportunidad real\n"
                    + "• <b>/start_real_loop</b> - Lanza la vigilancia continua (real)\n"
                    + "• <b>/stop_real_loop</b> - Detiene la vigilancia continua (real)\n\n"
                    + "• <b>/backtest</b> - Test histórico (no disponible)\n"
                    + "• <b>/help</b> - Esta ayuda";

    private final String symbol;
    private final String quoteCurrency;
    private final DateTimeFormatter timeFormat;

    public MessageFormatter(String symbol, String quoteCurrency, ZoneId zone) {
        this.symbol = symbol;
        this.quoteCurrency = quoteCurrency;
        this.timeFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(zone);
    }

    // =========================================================================
    // 🤖 AYUDA
    // =========================================================================

    public String welcome() {
        return "🤖 <b>Bot de arbitraje " + symbol + "</b>\n\n" + COMMANDS;
    }

    public String help() {
        return "📖 <b>Comandos disponibles</b>\n\n" + COMMANDS;
    }

    public String unknownCommand(String command) {
        return "❓ Comando desconocido: <code>" + escape(command) + "</code>\n\n" + help();
    }

    public String backtestNotImplemented() {
        return "<b>El backtesting todavía no está implementado.</b>";
    }

    // =========================================================================
    // 📊 PRECIOS Y ANÁLISIS
    // =========================================================================

    public String pricesUnavailable() {
        return "<b>❗ No se pudieron obtener los precios.</b>";
    }

    public String priceStatus(TradingMode mode, PriceStatus status) {
        Quote a = status.quoteA();
        Quote b = status.quoteB();
        return "<b>📊 Precios " + symbol + " (" + mode.label() + ")</b>\n\n"
                + venueBlock(a) + "\n"
                + venueBlock(b) + "\n"
                + "<b>Spreads:</b>\n"
                + "• " + route(a.venue(), b.venue()) + ": <b>" + money(status.spreadAToB()) + "</b>\n"
                + "• " + route(b.venue(), a.venue()) + ": <b>" + money(status.spreadBToA()) + "</b>";
    }

    public String arbitrageReport(ArbitrageReport report) {
        ArbitrageAnalysis analysis = report.analysis();
        Quote a = analysis.quoteA();
        Quote b = analysis.quoteB();

        StringBuilder sb = new StringBuilder()
                .append("<b>📊 Análisis de arbitraje ").append(symbol)
                .append(" (").append(report.mode().label()).append(")</b>\n\n")
                .append(quoteLine(a)).append('\n')
                .append(quoteLine(b)).append("\n\n")
                .append("<b>Spreads:</b>\n")
                .append("• ").append(route(a.venue(), b.venue())).append(": <b>")
                .append(money(analysis.aToB().rawSpread())).append("</b>\n")
                .append("• ").append(route(b.venue(), a.venue())).append(": <b>")
                .append(money(analysis.bToA().rawSpread())).append("</b>\n\n")
                .append("<b>Beneficio estimado tras comisiones:</b>\n")
                .append("• ").append(route(a.venue(), b.venue())).append(": ").append(profit(analysis.aToB())).append('\n')
                .append("• ").append(route(b.venue(), a.venue())).append(": ").append(profit(analysis.bToA())).append("\n\n");

        if (analysis.plan() == null) {
            sb.append("<b>✅ Sin oportunidad de arbitraje</b> por ahora (").append(report.mode().label()).append(").");
        } else {
            ExecutionPlan plan = analysis.plan();
            sb.append("<b>🔴 Oportunidad detectada:</b> comprar en <b>").append(display(plan.buyVenue()))
                    .append("</b> y vender en <b>").append(display(plan.sellVenue())).append("</b>.\n");
            appendTrades(sb, report);
        }
        return sb.toString();
    }

    /**
     * Aviso que empuja un loop cuando ejecuta una oportunidad.
     */
    public String loopOpportunity(ArbitrageReport report) {
        ExecutionPlan plan = report.analysis().plan();
        StringBuilder sb = new StringBuilder()
                .append("<b>📊 Oportunidad (").append(report.mode().label()).append(") en ").append(symbol).append("</b>\n\n")
                .append("<b>").append(route(plan.buyVenue(), plan.sellVenue())).append(":</b>\n")
                .append("Beneficio estimado: ").append(profit(plan.estimate())).append('\n')
                .append("Compra en <b>").append(display(plan.buyVenue())).append("</b> a <b>").append(money(plan.buyPrice()))
                .append("</b> y venta en <b>").append(display(plan.sellVenue())).append("</b> a <b>")
                .append(money(plan.sellPrice())).append("</b>.\n");
        appendTrades(sb, report);
        return sb.toString();
    }

    // =========================================================================
    // 💰 CUENTAS E HISTORIAL
    // =========================================================================

    public String accountUnavailable(TradingMode mode) {
        return "<b>❗ No se pudo obtener el estado de las cuentas (" + mode.label() + ").</b>";
    }

    public String accountStatus(AccountStatus status) {
        StringBuilder sb = new StringBuilder("<b>💼 Estado de las cuentas (")
                .append(status.mode().label()).append(")</b>\n");
        for (AccountStatus.VenueBalance balance : status.balances()) {
            sb.append("\n<b>").append(display(balance.venue())).append(":</b>\n")
                    .append("• Capital: <b>").append(money(balance.balance())).append("</b>\n")
                    .append("• Variación: <b>").append(String.format(Locale.US, "%+.2f %s", balance.variation(), quoteCurrency))
                    .append("</b>\n");
        }
        return sb.toString().trim();
    }

    public String history(TradingMode mode, List<TradeRecord> records) {
        if (records.isEmpty()) {
            return "<b>Todavía no hay operaciones registradas (" + mode.label() + ").</b>";
        }
        StringBuilder sb = new StringBuilder("<b>🧾 Operaciones recientes (")
                .append(mode.label()).append(")</b>\n<pre>")
                .append(String.format(Locale.US, "%-19s %-4s %-7s %12s%n", "Fecha/Hora", "Op", "Exch.", "Precio"));
        for (TradeRecord r : records) {
            sb.append(String.format(Locale.US, "%-19s %-4s %-7s %12.2f",
                    timeFormat.format(r.timestamp()), r.action(), display(r.venue()), r.price()));
            if (r.isFailed()) {
                sb.append(" ✗");
            }
            sb.append('\n');
        }
        return sb.append("</pre>").toString();
    }

    // =========================================================================
    // 🔄 LOOPS
    // =========================================================================

    public String loopStarted(TradingMode mode, Duration interval) {
        return String.format(Locale.US, "<b>🔄 Loop de arbitraje (%s) lanzado (cada %.1f s).</b>",
                mode.label(), interval.toMillis() / 1000.0);
    }

    public String loopAlreadyRunning(TradingMode mode) {
        return "<b>El loop de arbitraje (" + mode.label() + ") ya está activo.</b>";
    }

    public String loopStopped(TradingMode mode) {
        return "<b>⏹ Loop de arbitraje (" + mode.label() + ") detenido.</b>";
    }

    public String loopStopping(TradingMode mode) {
        return "<b>⏳ Loop de arbitraje (" + mode.label() + ") deteniéndose:</b> termina la operación en curso y no lanza más.";
    }

    public String loopNotRunning(TradingMode mode) {
        return "<b>No hay ningún loop de arbitraje (" + mode.label() + ") en marcha.</b>";
    }

    // =========================================================================
    // 🕵️ HELPERS
    // =========================================================================

    private void appendTrades(StringBuilder sb, ArbitrageReport report) {
        if (report.mode() == TradingMode.REAL) {
            for (TradeRecord trade : report.trades()) {
                sb.append(trade.action() == TradeAction.BUY ? "Compra " : "Venta ")
                        .append(display(trade.venue())).append(": ")
                        .append(trade.isFailed()
                                ? "❌ " + escape(trade.failureReason())
                                : "✅ orden " + escape(trade.orderReference()))
                        .append('\n');
            }
        }
        if (report.isPartial()) {
            sb.append("\n<b>⚠️ EJECUCIÓN PARCIAL</b>: una pierna falló. Revisar posiciones manualmente.");
        } else if (report.allFailed()) {
            sb.append("\n<b>❌ EJECUCIÓN FALLIDA</b>: ninguna pierna se ejecutó.");
        }
    }

    private String venueBlock(Quote q) {
        return "<b>" + display(q.venue()) + ":</b>\n"
                + "• Ask: <b>" + money(q.ask()) + "</b>\n"
                + "• Bid: <b>" + money(q.bid()) + "</b>\n";
    }

    private String quoteLine(Quote q) {
        return "<b>" + display(q.venue()) + ":</b> Ask = <b>" + money(q.ask()) + "</b>, Bid = <b>" + money(q.bid()) + "</b>";
    }

    private String profit(ProfitEstimate estimate) {
        return String.format(Locale.US, "<b>%.2f%%</b> (neto: <b>%s</b>)",
                estimate.netProfitPercent(), money(estimate.netProfit()));
    }

    private String route(String from, String to) {
        return display(from) + " → " + display(to);
    }

    private String money(double value) {
        return String.format(Locale.US, "%.2f %s", value, quoteCurrency);
    }

    private static String display(String venue) {
        return venue.toUpperCase(Locale.ROOT);
    }

    static String escape(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }
}
