package com.rafaeldiaz.spread_sentinel.core.orchestrator;

import com.rafaeldiaz.spread_sentinel.connect.VenueGateway;
import com.rafaeldiaz.spread_sentinel.core.analysis.ProfitCalculator;
import com.rafaeldiaz.spread_sentinel.core.ledger.TradeLedger;
import com.rafaeldiaz.spread_sentinel.core.resilience.FetchResult;
import com.rafaeldiaz.spread_sentinel.core.resilience.ResilientFetcher;
import com.rafaeldiaz.spread_sentinel.core.resilience.Sleeper;
import com.rafaeldiaz.spread_sentinel.core.scanner.OpportunityEvaluator;
import com.rafaeldiaz.spread_sentinel.execution.TradeExecutor;
import com.rafaeldiaz.spread_sentinel.model.ArbitrageAnalysis;
import com.rafaeldiaz.spread_sentinel.model.ExecutionPlan;
import com.rafaeldiaz.spread_sentinel.model.Quote;
import com.rafaeldiaz.spread_sentinel.model.TradeAction;
import com.rafaeldiaz.spread_sentinel.model.TradeRecord;
import com.rafaeldiaz.spread_sentinel.model.TradingMode;
import com.rafaeldiaz.spread_sentinel.notify.Notifier;
import com.rafaeldiaz.spread_sentinel.telegram.MessageFormatter;
import com.rafaeldiaz.spread_sentinel.utils.BotLogger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 🎼 COORDINADOR DE ARBITRAJE
 * Dueño del estado del proceso: los dos exchanges, un ledger por modo, los loops y la foto
 * inicial de saldos. El frontal de comandos solo habla con esta clase.
 */
public class ArbitrageCoordinator {

    private final VenueGateway venueA;
    private final VenueGateway venueB;
    private final String symbol;
    private final String quoteCurrency;
    private final ResilientFetcher fetcher;
    private final ProfitCalculator calculator;
    private final OpportunityEvaluator evaluator;
    private final TradeExecutor executor;
    private final Map<TradingMode, TradeLedger> ledgers;
    private final LoopTaskManager loops;
    private final Duration pollingInterval;
    private final Notifier notifier;
    private final MessageFormatter formatter;

    // Se fija una vez por exchange, en la primera consulta de cuentas
    private final Map<String, Double> initialBalances = new ConcurrentHashMap<>();

    public ArbitrageCoordinator(VenueGateway venueA, VenueGateway venueB, String symbol, String quoteCurrency,
                                ResilientFetcher fetcher, ProfitCalculator calculator, OpportunityEvaluator evaluator,
                                TradeExecutor executor, Map<TradingMode, TradeLedger> ledgers, LoopTaskManager loops,
                                Duration pollingInterval, Notifier notifier, MessageFormatter formatter) {
        if (venueA.name().equals(venueB.name())) {
            throw new IllegalArgumentException("Los dos exchanges deben ser distintos: " + venueA.name());
        }
        this.venueA = venueA;
        this.venueB = venueB;
        this.symbol = symbol;
        this.quoteCurrency = quoteCurrency;
        this.fetcher = fetcher;
        this.calculator = calculator;
        this.evaluator = evaluator;
        this.executor = executor;
        this.ledgers = new EnumMap<>(ledgers);
        this.loops = loops;
        this.pollingInterval = pollingInterval;
        this.notifier = notifier;
        this.formatter = formatter;
    }

    /**
     * Arma el grafo completo a partir de la configuración.
     */
    public static ArbitrageCoordinator create(BotConfig config, VenueGateway venueA, VenueGateway venueB,
                                              Notifier notifier, MessageFormatter formatter) {
        ResilientFetcher fetcher = new ResilientFetcher(config.retryPolicy());
        ProfitCalculator calculator = new ProfitCalculator();
        OpportunityEvaluator evaluator = new OpportunityEvaluator(calculator,
                config.profitThresholdPercent(), config.feeRate());

        Map<TradingMode, TradeLedger> ledgers = new EnumMap<>(TradingMode.class);
        for (TradingMode mode : TradingMode.values()) {
            ledgers.put(mode, new TradeLedger(config.ledgerMaxRecords()));
        }

        TradeExecutor executor = new TradeExecutor(fetcher, ledgers, config.symbol(),
                config.quoteCurrency(), config.tradeAmount());

        return new ArbitrageCoordinator(venueA, venueB, config.symbol(), config.quoteCurrency(), fetcher, calculator,
                evaluator, executor, ledgers, new LoopTaskManager(config.loopStopTimeout()),
                config.pollingInterval(), notifier, formatter);
    }

    // =========================================================================
    // 📋 OPERACIONES DEL FRONTAL
    // =========================================================================

    /** Precios y spreads actuales. Vacío si algún ticker no respondió tras los reintentos. */
    public Optional<PriceStatus> status() {
        return fetchQuotes(Sleeper.THREAD).map(pair -> new PriceStatus(pair.a(), pair.b(),
                calculator.spread(pair.a().ask(), pair.b().bid()),
                calculator.spread(pair.b().ask(), pair.a().bid())));
    }

    /**
     * Un ciclo manual: analiza y, si hay oportunidad, ejecuta las dos piernas en el modo indicado.
     */
    public Optional<ArbitrageReport> arbitrageOnce(TradingMode mode) {
        return fetchQuotes(Sleeper.THREAD).map(pair -> evaluateAndExecute(mode, pair));
    }

    /** Saldo libre en moneda de cotización por exchange, con su variación desde la primera consulta. */
    public Optional<AccountStatus> accountStatus(TradingMode mode) {
        List<AccountStatus.VenueBalance> balances = new ArrayList<>();
        for (VenueGateway venue : List.of(venueA, venueB)) {
            FetchResult<Double> result = fetcher.fetch("balance " + venue.name() + " " + quoteCurrency,
                    () -> venue.fetchFreeBalance(quoteCurrency));
            if (!result.isSuccess()) {
                BotLogger.error("❌ Estado de cuentas (" + mode.label() + ") no disponible: " + result.describeFailure());
                return Optional.empty();
            }
            double balance = result.value();
            double initial = initialBalances.computeIfAbsent(venue.name(), k -> balance);
            balances.add(new AccountStatus.VenueBalance(venue.name(), balance, balance - initial));
        }
        return Optional.of(new AccountStatus(mode, quoteCurrency, balances));
    }

    public List<TradeRecord> history(TradingMode mode, int n) {
        return ledgers.get(mode).recent(n);
    }

    public LoopCommandResult startLoop(TradingMode mode) {
        return loops.start(mode, token -> runCycle(mode, token), pollingInterval);
    }

    public LoopCommandResult stopLoop(TradingMode mode) {
        return loops.stop(mode);
    }

    public boolean isLoopRunning(TradingMode mode) {
        return loops.isRunning(mode);
    }

    public Duration pollingInterval() {
        return pollingInterval;
    }

    public String symbol() {
        return symbol;
    }

    /** Detiene los loops de ambos modos (hook de apagado). */
    public void shutdown() {
        loops.shutdown();
    }

    // =========================================================================
    // 🔄 ITERACIÓN DEL LOOP
    // =========================================================================

    /**
     * Una iteración del loop. Las esperas de reintento van contra el token, así que un stop
     * corta la lectura de precios; una vez empezada la ejecución, las dos piernas se completan.
     */
    void runCycle(TradingMode mode, CancellationToken token) {
        Optional<QuotePair> quotes = fetchQuotes(token);
        if (quotes.isEmpty()) {
            if (!token.isCancelled()) {
                BotLogger.error("❌ Error obteniendo precios (" + mode.label() + "). Se salta la iteración.");
            }
            return;
        }
        if (token.isCancelled()) {
            return;
        }

        ArbitrageReport report = evaluateAndExecute(mode, quotes.get());
        if (report.executed()) {
            notifier.notify(formatter.loopOpportunity(report));
        } else {
            BotLogger.info("Sin oportunidad (" + mode.label() + ") en esta iteración.");
        }
    }

    // =========================================================================
    // 🕵️ HELPERS
    // =========================================================================

    private ArbitrageReport evaluateAndExecute(TradingMode mode, QuotePair pair) {
        ArbitrageAnalysis analysis = evaluator.analyze(pair.a(), pair.b());
        Optional<ExecutionPlan> opportunity = analysis.opportunity();
        if (opportunity.isEmpty()) {
            return new ArbitrageReport(mode, analysis, List.of());
        }

        ExecutionPlan plan = opportunity.get();
        BotLogger.info(String.format(Locale.US, "🎯 Oportunidad %s: comprar en %s a %.2f, vender en %s a %.2f (%.3f%%)",
                mode.label(), plan.buyVenue(), plan.buyPrice(), plan.sellVenue(), plan.sellPrice(),
                plan.estimate().netProfitPercent()));

        // Dos piernas independientes: si una falla, la otra se intenta igual
        TradeRecord buy = executor.execute(TradeAction.BUY, venue(plan.buyVenue()), plan.buyPrice(), mode);
        TradeRecord sell = executor.execute(TradeAction.SELL, venue(plan.sellVenue()), plan.sellPrice(), mode);

        ArbitrageReport report = new ArbitrageReport(mode, analysis, List.of(buy, sell));
        if (report.isPartial()) {
            BotLogger.error("⚠️ EJECUCIÓN PARCIAL (" + mode.label() + "): compra "
                    + (buy.isFailed() ? "FALLÓ" : "OK") + ", venta " + (sell.isFailed() ? "FALLÓ" : "OK")
                    + ". Requiere intervención manual.");
        }
        return report;
    }

    private Optional<QuotePair> fetchQuotes(Sleeper sleeper) {
        FetchResult<Quote> a = fetcher.fetch("ticker " + venueA.name(), () -> venueA.fetchQuote(symbol), sleeper);
        if (!a.isSuccess()) {
            return Optional.empty();
        }
        FetchResult<Quote> b = fetcher.fetch("ticker " + venueB.name(), () -> venueB.fetchQuote(symbol), sleeper);
        if (!b.isSuccess()) {
            return Optional.empty();
        }
        return Optional.of(new QuotePair(a.value(), b.value()));
    }

    private VenueGateway venue(String name) {
        if (venueA.name().equals(name)) return venueA;
        if (venueB.name().equals(name)) return venueB;
        throw new IllegalStateException("Exchange desconocido en el plan: " + name);
    }

    private record QuotePair(Quote a, Quote b) {
    }
}
