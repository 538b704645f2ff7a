package com.rafaeldiaz.spread_sentinel.utils;

import com.rafaeldiaz.spread_sentinel.model.TradeAction;
import com.rafaeldiaz.spread_sentinel.model.TradeRecord;
import com.rafaeldiaz.spread_sentinel.model.TradingMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BotLoggerTest {

    private static final String LOG_DIR = "logs";

    @Test
    @DisplayName("Debe crear el directorio de logs y escribir el trade (asíncrono) con punto decimal")
    void testTradeLineReachesLogFile() throws Exception {
        String marker = "ord-" + UUID.randomUUID();
        BotLogger.logTrade(TradingMode.REAL, TradeRecord.filled(TradeAction.BUY, "okx", 43250.5, marker));

        File dir = new File(LOG_DIR);
        assertTrue(dir.isDirectory(), "El directorio logs debe existir");

        // El worker escribe en segundo plano: esperamos hasta 3s
        String line = null;
        for (int i = 0; i < 30 && line == null; i++) {
            line = findLine(dir, marker);
            if (line == null) Thread.sleep(100);
        }
        assertNotNull(line, "El trade debe aparecer en bot.log");
        assertTrue(line.contains("43250.50"));
        assertTrue(line.contains("[Real]"));
        assertTrue(line.contains("OKX"));
    }

    @Test
    @DisplayName("Un trade fallido se registra sin lanzar")
    void testFailedTradeDoesNotThrow() {
        assertDoesNotThrow(() -> BotLogger.logTrade(TradingMode.SIMULATION,
                TradeRecord.failed(TradeAction.SELL, "kraken", 43000.0, "insufficient balance")));
    }

    private static String findLine(File dir, String marker) throws IOException {
        File[] logs = dir.listFiles((d, name) -> name.startsWith("bot.log") && !name.endsWith(".lck"));
        if (logs == null) return null;
        for (File log : logs) {
            for (String l : Files.readAllLines(log.toPath(), StandardCharsets.UTF_8)) {
                if (l.contains(marker)) return l;
            }
        }
        return null;
    }
}
