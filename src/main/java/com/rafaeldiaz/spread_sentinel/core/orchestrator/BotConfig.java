package com.rafaeldiaz.spread_sentinel.core.orchestrator;

import com.rafaeldiaz.spread_sentinel.core.resilience.RetryPolicy;
import com.rafaeldiaz.spread_sentinel.utils.EnvProvider;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 🧠 CONFIGURACIÓN GLOBAL
 * Se lee una sola vez en el arranque (entorno del proceso, luego .env) y no cambia después.
 */
public final class BotConfig {

    static final List<String> REQUIRED_SECRETS = List.of(
            "OKX_API_KEY", "OKX_API_SECRET", "OKX_PASSWORD",
            "KRAKEN_API_KEY", "KRAKEN_API_SECRET",
            "TELEGRAM_BOT_TOKEN", "TELEGRAM_CHAT_ID");

    private final String symbol;
    private final String baseCurrency;
    private final String quoteCurrency;
    private final double profitThresholdPercent;
    private final double tradeAmount;
    private final double feeRate;
    private final Duration pollingInterval;
    private final RetryPolicy retryPolicy;
    private final int ledgerMaxRecords;
    private final int historySize;
    private final Duration loopStopTimeout;
    private final String telegramToken;
    private final String telegramChatId;

    private BotConfig(EnvProvider env) {
        this.symbol = text(env, "SYMBOL", "BTC/USDT").toUpperCase(Locale.ROOT);
        String[] parts = symbol.split("/");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new ConfigurationException("SYMBOL debe tener formato BASE/QUOTE: " + symbol);
        }
        this.baseCurrency = parts[0];
        this.quoteCurrency = parts[1];

        // Gatillo de rentabilidad (en %)
        this.profitThresholdPercent = number(env, "PROFIT_THRESHOLD_PERCENT", "0.5");
        this.tradeAmount = number(env, "TRADE_AMOUNT", "0.001");
        this.feeRate = number(env, "FEE_RATE", "0.001");
        this.pollingInterval = Duration.ofMillis(millis(env, "POLLING_INTERVAL_MS", "2000"));

        int maxAttempts = integer(env, "RETRY_MAX_ATTEMPTS", "3");
        long initialDelayMs = millis(env, "RETRY_INITIAL_DELAY_MS", "1000");
        double backoff = number(env, "RETRY_BACKOFF_FACTOR", "2");

        this.ledgerMaxRecords = integer(env, "LEDGER_MAX_RECORDS", "1000");
        this.historySize = integer(env, "HISTORY_SIZE", "10");
        this.loopStopTimeout = Duration.ofMillis(millis(env, "LOOP_STOP_TIMEOUT_MS", "30000"));

        this.telegramToken = env.get("TELEGRAM_BOT_TOKEN");
        this.telegramChatId = env.get("TELEGRAM_CHAT_ID");

        List<String> problems = new ArrayList<>();
        if (profitThresholdPercent < 0) problems.add("PROFIT_THRESHOLD_PERCENT < 0");
        if (tradeAmount <= 0) problems.add("TRADE_AMOUNT <= 0");
        if (feeRate < 0 || feeRate >= 1) problems.add("FEE_RATE fuera de [0, 1)");
        if (pollingInterval.isZero() || pollingInterval.isNegative()) problems.add("POLLING_INTERVAL_MS <= 0");
        if (maxAttempts < 1) problems.add("RETRY_MAX_ATTEMPTS < 1");
        if (initialDelayMs < 0) problems.add("RETRY_INITIAL_DELAY_MS < 0");
        if (backoff < 1) problems.add("RETRY_BACKOFF_FACTOR < 1");
        if (ledgerMaxRecords < 1) problems.add("LEDGER_MAX_RECORDS < 1");
        if (historySize < 1) problems.add("HISTORY_SIZE < 1");
        if (loopStopTimeout.isNegative() || loopStopTimeout.isZero()) problems.add("LOOP_STOP_TIMEOUT_MS <= 0");
        for (String key : REQUIRED_SECRETS) {
            String value = env.get(key);
            if (value == null || value.isBlank()) problems.add(key + " no definido");
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException("Configuración inválida: " + String.join(", ", problems));
        }

        this.retryPolicy = new RetryPolicy(maxAttempts, Duration.ofMillis(initialDelayMs), backoff);
    }

    public static BotConfig load(EnvProvider env) {
        return new BotConfig(env);
    }

    private static String text(EnvProvider env, String key, String defaultVal) {
        String val = env.get(key);
        return (val == null || val.isBlank()) ? defaultVal : val.trim();
    }

    private static double number(EnvProvider env, String key, String defaultVal) {
        String raw = text(env, key, defaultVal);
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " no es numérico: '" + raw + "'", e);
        }
    }

    // Contadores y tamaños: solo enteros, "2.5" es un error
    private static int integer(EnvProvider env, String key, String defaultVal) {
        String raw = text(env, key, defaultVal);
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " debe ser entero: '" + raw + "'", e);
        }
    }

    private static long millis(EnvProvider env, String key, String defaultVal) {
        String raw = text(env, key, defaultVal);
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " debe ser un entero en ms: '" + raw + "'", e);
        }
    }

    public String symbol() { return symbol; }
    public String baseCurrency() { return baseCurrency; }
    public String quoteCurrency() { return quoteCurrency; }
    public double profitThresholdPercent() { return profitThresholdPercent; }
    public double tradeAmount() { return tradeAmount; }
    public double feeRate() { return feeRate; }
    public Duration pollingInterval() { return pollingInterval; }
    public RetryPolicy retryPolicy() { return retryPolicy; }
    public int ledgerMaxRecords() { return ledgerMaxRecords; }
    public int historySize() { return historySize; }
    public Duration loopStopTimeout() { return loopStopTimeout; }
    public String telegramToken() { return telegramToken; }
    public String telegramChatId() { return telegramChatId; }
}
