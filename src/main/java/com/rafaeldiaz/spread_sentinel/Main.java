package com.rafaeldiaz.spread_sentinel;

import com.rafaeldiaz.spread_sentinel.connect.KrakenGateway;
import com.rafaeldiaz.spread_sentinel.connect.OkxGateway;
import com.rafaeldiaz.spread_sentinel.core.orchestrator.ArbitrageCoordinator;
import com.rafaeldiaz.spread_sentinel.core.orchestrator.BotConfig;
import com.rafaeldiaz.spread_sentinel.core.orchestrator.ConfigurationException;
import com.rafaeldiaz.spread_sentinel.notify.Notifier;
import com.rafaeldiaz.spread_sentinel.notify.TelegramNotifier;
import com.rafaeldiaz.spread_sentinel.telegram.MessageFormatter;
import com.rafaeldiaz.spread_sentinel.telegram.TelegramCommandBot;
import com.rafaeldiaz.spread_sentinel.utils.BotLogger;
import com.rafaeldiaz.spread_sentinel.utils.ConfigLoader;
import okhttp3.OkHttpClient;

import java.time.ZoneId;
import java.util.concurrent.TimeUnit;

/**
 * <h1>Spread Sentinel - arbitraje OKX / Kraken</h1>
 * <p>
 * Punto de entrada: carga la configuración, arma conectores, coordinador y bot de Telegram,
 * y se queda escuchando comandos. Los loops arrancan solo a pedido del operador.
 * </p>
 */
public class Main {

    public static void main(String[] args) {
        BotLogger.info("======================================================");
        BotLogger.info("🚀 INICIANDO SPREAD SENTINEL...");

        // -----------------------------------------------------------
        // 1. CONFIGURACIÓN (fatal si falla)
        // -----------------------------------------------------------
        ConfigLoader env = new ConfigLoader();
        BotConfig config;
        try {
            config = BotConfig.load(env);
        } catch (ConfigurationException e) {
            BotLogger.error("⛔ " + e.getMessage());
            System.err.println("FATAL CONFIG ERROR: " + e.getMessage());
            System.exit(1);
            return;
        }
        BotLogger.info("✅ [1/3] Configuración: " + config.symbol() + " | umbral " + config.profitThresholdPercent()
                + "% | monto " + config.tradeAmount() + " | fee " + config.feeRate());

        // -----------------------------------------------------------
        // 2. CONECTIVIDAD
        // -----------------------------------------------------------
        // readTimeout por encima del timeout del long polling de Telegram
        OkHttpClient http = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(45, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .build();

        OkxGateway okx = new OkxGateway(http, env);
        KrakenGateway kraken = new KrakenGateway(http, env);
        Notifier notifier = new TelegramNotifier(http, config.telegramToken(), config.telegramChatId());
        BotLogger.info("✅ [2/3] Conectores OKX y Kraken: ONLINE");

        // -----------------------------------------------------------
        // 3. COORDINADOR Y FRONTAL
        // -----------------------------------------------------------
        MessageFormatter formatter = new MessageFormatter(config.symbol(), config.quoteCurrency(), ZoneId.systemDefault());
        ArbitrageCoordinator coordinator = ArbitrageCoordinator.create(config, okx, kraken, notifier, formatter);
        TelegramCommandBot bot = new TelegramCommandBot(http, config.telegramToken(), config.telegramChatId(),
                coordinator, notifier, formatter, config.historySize());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            BotLogger.info("🛑 Apagando: deteniendo loops...");
            bot.stop();
            coordinator.shutdown();
            http.dispatcher().executorService().shutdown();
            http.connectionPool().evictAll();
        }, "shutdown-hook"));

        BotLogger.info("✅ [3/3] Coordinador y bot de Telegram: ONLINE");
        bot.start();
    }
}
