package com.rafaeldiaz.spread_sentinel.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rafaeldiaz.spread_sentinel.core.orchestrator.ArbitrageCoordinator;
import com.rafaeldiaz.spread_sentinel.core.orchestrator.LoopCommandResult;
import com.rafaeldiaz.spread_sentinel.model.TradingMode;
import com.rafaeldiaz.spread_sentinel.notify.Notifier;
import com.rafaeldiaz.spread_sentinel.notify.TelegramNotifier;
import com.rafaeldiaz.spread_sentinel.utils.BotLogger;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 📡 FRONTAL DE COMANDOS (Telegram long polling)
 * Lee {@code getUpdates}, ignora cualquier chat que no sea el configurado y traduce cada
 * comando a una operación del {@link ArbitrageCoordinator}. La respuesta sale por el {@link Notifier}.
 */
public class TelegramCommandBot {

    private static final int POLL_TIMEOUT_SECONDS = 30;
    private static final long ERROR_BACKOFF_MS = 1500;

    private final OkHttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String apiUrl;
    private final String botToken;
    private final String chatId;
    private final ArbitrageCoordinator coordinator;
    private final Notifier notifier;
    private final MessageFormatter formatter;
    private final int historySize;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile long offset = 0;

    public TelegramCommandBot(OkHttpClient client, String botToken, String chatId, ArbitrageCoordinator coordinator,
                              Notifier notifier, MessageFormatter formatter, int historySize) {
        this(client, botToken, chatId, coordinator, notifier, formatter, historySize, TelegramNotifier.DEFAULT_API_URL);
    }

    public TelegramCommandBot(OkHttpClient client, String botToken, String chatId, ArbitrageCoordinator coordinator,
                              Notifier notifier, MessageFormatter formatter, int historySize, String apiUrl) {
        this.client = client;
        this.botToken = botToken;
        this.chatId = chatId;
        this.coordinator = coordinator;
        this.notifier = notifier;
        this.formatter = formatter;
        this.historySize = historySize;
        this.apiUrl = apiUrl;
    }

    /**
     * Bloquea el hilo actual haciendo polling hasta {@link #stop()}.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) return;
        BotLogger.info("📡 Bot de Telegram escuchando comandos...");

        while (running.get()) {
            try {
                pollOnce();
            } catch (IOException | RuntimeException e) {
                BotLogger.warn("⚠️ Error en polling de Telegram: " + e.getMessage());
                try {
                    Thread.sleep(ERROR_BACKOFF_MS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    running.set(false);
                }
            }
        }
        BotLogger.info("📡 Polling de Telegram detenido.");
    }

    public void stop() {
        running.set(false);
    }

    void pollOnce() throws IOException {
        Request request = new Request.Builder()
                .url(apiUrl + "/bot" + botToken + "/getUpdates?timeout=" + POLL_TIMEOUT_SECONDS + "&offset=" + offset)
                .get()
                .build();

        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new IOException("HTTP " + response.code());
            }
            JsonNode root = mapper.readTree(response.body().string());
            if (!root.path("ok").asBoolean(false)) return;

            for (JsonNode update : root.path("result")) {
                offset = Math.max(offset, update.path("update_id").asLong() + 1);

                JsonNode message = update.get("message");
                if (message == null) continue;

                // Solo el chat del operador
                String fromChat = message.path("chat").path("id").asText();
                if (!chatId.equals(fromChat)) {
                    BotLogger.warn("🚷 Mensaje ignorado de chat no autorizado: " + fromChat);
                    continue;
                }

                String text = message.path("text").asText(null);
                if (text != null) {
                    onCommand(text);
                }
            }
        }
    }

    /**
     * Ejecuta un comando y envía la respuesta. Nunca lanza.
     */
    public void onCommand(String text) {
        String command = normalize(text);
        if (command.isEmpty()) return;

        String reply;
        try {
            reply = handle(command);
        } catch (RuntimeException e) {
            BotLogger.error("💥 Error procesando " + command + ": " + e.getMessage());
            reply = "<b>❗ Error procesando " + MessageFormatter.escape(command) + "</b>";
        }
        notifier.notify(reply);
    }

    private String handle(String command) {
        switch (command) {
            case "/start": return formatter.welcome();
            case "/help": return formatter.help();
            case "/backtest": return formatter.backtestNotImplemented();

            // --- SIMULACIÓN ---
            case "/status": return status(TradingMode.SIMULATION);
            case "/arbitrage": return arbitrage(TradingMode.SIMULATION);
            case "/account_status": return account(TradingMode.SIMULATION);
            case "/history": return formatter.history(TradingMode.SIMULATION, coordinator.history(TradingMode.SIMULATION, historySize));
            case "/start_loop": return startLoop(TradingMode.SIMULATION);
            case "/stop_loop": return stopLoop(TradingMode.SIMULATION);

            // --- REAL ---
            case "/real_status": return status(TradingMode.REAL);
            case "/real_arbitrage": return arbitrage(TradingMode.REAL);
            case "/real_account": return account(TradingMode.REAL);
            case "/real_history": return formatter.history(TradingMode.REAL, coordinator.history(TradingMode.REAL, historySize));
            case "/start_real_loop": return startLoop(TradingMode.REAL);
            case "/stop_real_loop": return stopLoop(TradingMode.REAL);

            default: return formatter.unknownCommand(command);
        }
    }

    private String status(TradingMode mode) {
        return coordinator.status()
                .map(s -> formatter.priceStatus(mode, s))
                .orElseGet(formatter::pricesUnavailable);
    }

    private String arbitrage(TradingMode mode) {
        return coordinator.arbitrageOnce(mode)
                .map(formatter::arbitrageReport)
                .orElseGet(formatter::pricesUnavailable);
    }

    private String account(TradingMode mode) {
        return coordinator.accountStatus(mode)
                .map(formatter::accountStatus)
                .orElseGet(() -> formatter.accountUnavailable(mode));
    }

    private String startLoop(TradingMode mode) {
        LoopCommandResult result = coordinator.startLoop(mode);
        return result == LoopCommandResult.STARTED
                ? formatter.loopStarted(mode, coordinator.pollingInterval())
                : formatter.loopAlreadyRunning(mode);
    }

    private String stopLoop(TradingMode mode) {
        switch (coordinator.stopLoop(mode)) {
            case STOPPED: return formatter.loopStopped(mode);
            case STOPPING: return formatter.loopStopping(mode);
            default: return formatter.loopNotRunning(mode);
        }
    }

    /** "/Status@MiBot extra" -> "/status" */
    static String normalize(String text) {
        if (text == null) return "";
        String trimmed = text.trim();
        if (trimmed.isEmpty()) return "";
        String first = trimmed.split("\\s+")[0];
        int at = first.indexOf('@');
        if (at > 0) {
            first = first.substring(0, at);
        }
        return first.toLowerCase(Locale.ROOT);
    }
}
