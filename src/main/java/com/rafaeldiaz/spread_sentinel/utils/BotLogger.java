package com.rafaeldiaz.spread_sentinel.utils;

import com.rafaeldiaz.spread_sentinel.model.TradeRecord;
import com.rafaeldiaz.spread_sentinel.model.TradingMode;

import java.io.File;
import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.logging.*;

public class BotLogger {

    // 🎨 PALETA ANSI (solo consola)
    public static final String RESET = "\u001B[0m";
    public static final String RED = "\u001B[31m";
    public static final String GREEN = "\u001B[32m";
    public static final String YELLOW = "\u001B[33m";
    public static final String CYAN = "\u001B[36m";

    private static final Logger logger = Logger.getLogger("SpreadSentinel");
    private static final String LOG_DIR = "logs";

    private static final BlockingQueue<Runnable> logTasks = new LinkedBlockingQueue<>();

    static {
        try {
            File dir = new File(LOG_DIR);
            if (!dir.exists()) dir.mkdirs();

            // --- 1. FILE HANDLER (texto limpio, rotación 10MB x 5) ---
            FileHandler fh = new FileHandler(LOG_DIR + "/bot.log", 10 * 1024 * 1024, 5, true);
            fh.setEncoding("UTF-8");
            fh.setFormatter(new Formatter() {
                private static final String STANDARD_FORMAT = "[%1$tF %1$tT] [%2$-7s] %3$s %n";
                @Override
                public synchronized String format(LogRecord lr) {
                    return String.format(STANDARD_FORMAT, new java.util.Date(lr.getMillis()),
                            lr.getLevel().getLocalizedName(), lr.getMessage());
                }
            });
            logger.addHandler(fh);
            logger.setLevel(Level.INFO);
            logger.setUseParentHandlers(false);

            // --- 2. CONSOLE HANDLER (nivel coloreado) ---
            ConsoleHandler ch = new ConsoleHandler();
            ch.setFormatter(new Formatter() {
                @Override
                public String format(LogRecord lr) {
                    String color = GREEN;
                    if (lr.getLevel() == Level.WARNING) color = YELLOW;
                    if (lr.getLevel() == Level.SEVERE) color = RED;
                    // %1$s color | %2$tT hora | %3$s reset | %4$s mensaje
                    return String.format("%1$s[%2$tT]%3$s %4$s %n",
                            color, new java.util.Date(lr.getMillis()), RESET, lr.getMessage());
                }
            });
            logger.addHandler(ch);
        } catch (IOException e) {
            System.err.println("FATAL LOG ERROR: " + e.getMessage());
        }

        // --- 3. HILO ASÍNCRONO ---
        Thread consumerThread = new Thread(() -> {
            while (true) {
                try {
                    Runnable task = logTasks.take();
                    task.run();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (RuntimeException e) {
                    System.err.println("Log worker error: " + e.getMessage());
                }
            }
        });
        consumerThread.setName("Async-Log-Worker");
        consumerThread.setDaemon(true);
        consumerThread.start();
    }

    private BotLogger() {}

    // --- MÉTODOS PÚBLICOS ---

    public static void info(String msg) { logTasks.offer(() -> logger.info(msg)); }
    public static void warn(String msg) { logTasks.offer(() -> logger.warning(msg)); }
    public static void error(String msg) { logTasks.offer(() -> logger.severe(msg)); }

    /**
     * Una línea por pierna ejecutada. Locale.US para no romper los decimales.
     */
    public static void logTrade(TradingMode mode, TradeRecord record) {
        String outcome = record.isFailed()
                ? "FALLO: " + record.failureReason()
                : (record.orderReference() != null ? "orden " + record.orderReference() : "OK");
        String msg = String.format(Locale.US, "💰 [%s] %s en %s a %.2f | %s",
                mode.label(), record.action(), record.venue().toUpperCase(Locale.ROOT), record.price(), outcome);
        if (record.isFailed()) {
            error(msg);
        } else {
            info(msg);
        }
    }
}
