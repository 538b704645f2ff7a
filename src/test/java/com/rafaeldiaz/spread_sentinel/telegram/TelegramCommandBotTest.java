package com.rafaeldiaz.spread_sentinel.telegram;

import com.rafaeldiaz.spread_sentinel.core.orchestrator.ArbitrageCoordinator;
import com.rafaeldiaz.spread_sentinel.core.orchestrator.LoopCommandResult;
import com.rafaeldiaz.spread_sentinel.core.orchestrator.PriceStatus;
import com.rafaeldiaz.spread_sentinel.model.Quote;
import com.rafaeldiaz.spread_sentinel.model.TradeAction;
import com.rafaeldiaz.spread_sentinel.model.TradeRecord;
import com.rafaeldiaz.spread_sentinel.model.TradingMode;
import com.rafaeldiaz.spread_sentinel.notify.Notifier;
import okhttp3.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TelegramCommandBotTest {

    @Mock
    private OkHttpClient mockHttpClient;
    @Mock
    private Call mockCall;
    @Mock
    private ArbitrageCoordinator coordinator;
    @Mock
    private Notifier notifier;

    private TelegramCommandBot bot;

    private static final String UPDATES = "{ \"ok\": true, \"result\": ["
            + " { \"update_id\": 100, \"message\": { \"chat\": { \"id\": 42 }, \"text\": \"/help\" } },"
            + " { \"update_id\": 101, \"message\": { \"chat\": { \"id\": 666 }, \"text\": \"/start_real_loop\" } },"
            + " { \"update_id\": 102, \"edited_message\": { \"chat\": { \"id\": 42 }, \"text\": \"/status\" } }"
            + " ] }";

    @BeforeEach
    void setUp() {
        when(mockHttpClient.newCall(any(Request.class))).thenReturn(mockCall);
        when(coordinator.pollingInterval()).thenReturn(Duration.ofSeconds(2));
        bot = new TelegramCommandBot(mockHttpClient, "TOKEN", "42", coordinator, notifier,
                new MessageFormatter("BTC/USDT", "USDT", ZoneOffset.UTC), 10, "https://tg.test");
    }

    private String lastMessage() {
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(notifier, atLeastOnce()).notify(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("/start y /help listan todos los comandos")
    void testWelcomeAndHelp() {
        bot.onCommand("/start");
        assertTrue(lastMessage().contains("/start_real_loop"));

        bot.onCommand("/help");
        String help = lastMessage();
        for (String cmd : List.of("/status", "/arbitrage", "/account_status", "/history", "/start_loop", "/stop_loop",
                "/real_status", "/real_account", "/real_history", "/real_arbitrage", "/stop_real_loop", "/backtest")) {
            assertTrue(help.contains(cmd), "falta " + cmd);
        }
    }

    @Test
    @DisplayName("/status sin precios: mensaje de error, sin excepción")
    void testStatusUnavailable() {
        when(coordinator.status()).thenReturn(Optional.empty());

        bot.onCommand("/status");

        assertTrue(lastMessage().contains("No se pudieron obtener los precios"));
    }

    @Test
    @DisplayName("/real_status con precios: modo Real en la cabecera")
    void testRealStatus() {
        Quote a = new Quote("okx", 100.0, 99.5, Instant.now());
        Quote b = new Quote("kraken", 101.0, 100.5, Instant.now());
        when(coordinator.status()).thenReturn(Optional.of(new PriceStatus(a, b, 0.5, -1.5)));

        bot.onCommand("/real_status");

        String msg = lastMessage();
        assertTrue(msg.contains("(Real)"));
        assertTrue(msg.contains("OKX"));
        assertTrue(msg.contains("-1.50 USDT"));
    }

    @Test
    @DisplayName("Loops: start/stop por modo con sus respuestas")
    void testLoopCommands() {
        when(coordinator.startLoop(TradingMode.SIMULATION)).thenReturn(LoopCommandResult.STARTED, LoopCommandResult.ALREADY_RUNNING);
        when(coordinator.stopLoop(TradingMode.REAL)).thenReturn(LoopCommandResult.NOT_RUNNING);

        bot.onCommand("/start_loop");
        assertTrue(lastMessage().contains("lanzado"));
        bot.onCommand("/start_loop");
        assertTrue(lastMessage().contains("ya está activo"));
        bot.onCommand("/stop_real_loop");
        assertTrue(lastMessage().contains("No hay ningún loop"));

        verify(coordinator, times(2)).startLoop(TradingMode.SIMULATION);
        verify(coordinator).stopLoop(TradingMode.REAL);
    }

    @Test
    @DisplayName("Stop con una operación en vuelo: avisa que el loop se está deteniendo")
    void testStopWhileTradeInFlight() {
        when(coordinator.stopLoop(TradingMode.REAL)).thenReturn(LoopCommandResult.STOPPING);

        bot.onCommand("/stop_real_loop");

        String msg = lastMessage();
        assertTrue(msg.contains("deteniéndose"));
        assertTrue(msg.contains("(Real)"));
    }

    @Test
    @DisplayName("/history pide los últimos N del modo correcto")
    void testHistory() {
        when(coordinator.history(TradingMode.REAL, 10)).thenReturn(
                List.of(TradeRecord.filled(TradeAction.BUY, "kraken", 43000.0, "TX1")));

        bot.onCommand("/real_history");

        assertTrue(lastMessage().contains("43000.00"));
        verify(coordinator).history(TradingMode.REAL, 10);
    }

    @Test
    @DisplayName("Comando desconocido: ayuda; sufijo @bot y mayúsculas se normalizan")
    void testUnknownAndNormalization() {
        bot.onCommand("/moon");
        assertTrue(lastMessage().contains("Comando desconocido"));

        bot.onCommand("/BACKTEST@SpreadSentinelBot ahora");
        assertTrue(lastMessage().contains("backtesting"));

        assertEquals("/status", TelegramCommandBot.normalize("  /Status@bot extra "));
        assertEquals("", TelegramCommandBot.normalize("   "));
    }

    @Test
    @DisplayName("Error inesperado en el coordinador: se responde y no se propaga")
    void testCommandErrorContained() {
        when(coordinator.arbitrageOnce(TradingMode.SIMULATION)).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> bot.onCommand("/arbitrage"));
        assertTrue(lastMessage().contains("Error procesando"));
    }

    @Test
    @DisplayName("Polling: solo atiende al chat autorizado y avanza el offset")
    void testPollOnceFiltersChatAndAdvancesOffset() throws IOException {
        when(mockCall.execute()).thenReturn(response(UPDATES), response("{ \"ok\": true, \"result\": [] }"));

        bot.pollOnce();
        bot.pollOnce();

        // Solo /help del chat 42; el chat 666 y el edited_message se ignoran
        verify(notifier, times(1)).notify(any());
        verify(coordinator, never()).startLoop(any());

        ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
        verify(mockHttpClient, times(2)).newCall(captor.capture());
        assertTrue(captor.getAllValues().get(0).url().toString().contains("offset=0"));
        assertTrue(captor.getAllValues().get(1).url().toString().contains("offset=103"));
        assertTrue(captor.getAllValues().get(1).url().toString().startsWith("https://tg.test/botTOKEN/getUpdates"));
    }

    private static Response response(String body) {
        return new Response.Builder()
                .request(new Request.Builder().url("https://test.com").build())
                .protocol(Protocol.HTTP_1_1)
                .code(200)
                .message("OK")
                .body(ResponseBody.create(body, MediaType.parse("application/json")))
                .build();
    }
}
