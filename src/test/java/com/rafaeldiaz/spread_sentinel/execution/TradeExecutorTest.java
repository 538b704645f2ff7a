package com.rafaeldiaz.spread_sentinel.execution;

import com.rafaeldiaz.spread_sentinel.connect.VenueException;
import com.rafaeldiaz.spread_sentinel.connect.VenueGateway;
import com.rafaeldiaz.spread_sentinel.core.ledger.TradeLedger;
import com.rafaeldiaz.spread_sentinel.core.resilience.ResilientFetcher;
import com.rafaeldiaz.spread_sentinel.core.resilience.RetryPolicy;
import com.rafaeldiaz.spread_sentinel.model.TradeAction;
import com.rafaeldiaz.spread_sentinel.model.TradeRecord;
import com.rafaeldiaz.spread_sentinel.model.TradingMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TradeExecutorTest {

    @Mock
    private VenueGateway okx;

    private TradeLedger simLedger;
    private TradeLedger realLedger;
    private TradeExecutor executor;

    @BeforeEach
    void setUp() {
        lenient().when(okx.name()).thenReturn("okx");
        simLedger = new TradeLedger(100);
        realLedger = new TradeLedger(100);
        ResilientFetcher fetcher = new ResilientFetcher(new RetryPolicy(2, Duration.ZERO, 1.0));
        executor = new TradeExecutor(fetcher,
                Map.of(TradingMode.SIMULATION, simLedger, TradingMode.REAL, realLedger),
                "BTC/USDT", "USDT", 0.001);
    }

    @Test
    @DisplayName("Simulación: siempre OK, sin llamadas al exchange")
    void testSimulationNeverTouchesVenue() throws VenueException {
        TradeRecord record = executor.execute(TradeAction.BUY, okx, 50_000.0, TradingMode.SIMULATION);

        assertFalse(record.isFailed());
        assertNull(record.orderReference());
        assertEquals(50_000.0, record.price());
        assertEquals(1, simLedger.size());
        assertEquals(0, realLedger.size());
        verify(okx, never()).fetchFreeBalance(anyString());
        verify(okx, never()).submitMarketOrder(anyString(), any(), anyDouble());
    }

    @Test
    @DisplayName("REAL BUY con saldo insuficiente: registro fallido y NINGUNA orden")
    void testInsufficientBalanceNeverSubmits() throws VenueException {
        when(okx.fetchFreeBalance("USDT")).thenReturn(10.0); // necesita 50 USDT

        TradeRecord record = executor.execute(TradeAction.BUY, okx, 50_000.0, TradingMode.REAL);

        assertTrue(record.isFailed());
        assertEquals(TradeExecutor.INSUFFICIENT_BALANCE, record.failureReason());
        assertEquals(1, realLedger.size());
        verify(okx, never()).submitMarketOrder(anyString(), any(), anyDouble());
    }

    @Test
    @DisplayName("REAL BUY con saldo suficiente: orden enviada una vez, referencia guardada")
    void testRealBuyFilled() throws VenueException {
        when(okx.fetchFreeBalance("USDT")).thenReturn(1_000.0);
        when(okx.submitMarketOrder("BTC/USDT", TradeAction.BUY, 0.001)).thenReturn("ord-123");

        TradeRecord record = executor.execute(TradeAction.BUY, okx, 50_000.0, TradingMode.REAL);

        assertFalse(record.isFailed());
        assertEquals("ord-123", record.orderReference());
        assertEquals("okx", record.venue());
        verify(okx, times(1)).submitMarketOrder("BTC/USDT", TradeAction.BUY, 0.001);
        assertEquals(record, realLedger.recent(1).get(0));
    }

    @Test
    @DisplayName("Rechazo del exchange: registro fallido con el motivo, sin reintento")
    void testSubmissionFailureRecorded() throws VenueException {
        when(okx.fetchFreeBalance("USDT")).thenReturn(1_000.0);
        when(okx.submitMarketOrder(anyString(), any(), anyDouble()))
                .thenThrow(new VenueException("okx", "code 51008: Insufficient balance"));

        TradeRecord record = executor.execute(TradeAction.BUY, okx, 50_000.0, TradingMode.REAL);

        assertTrue(record.isFailed());
        assertTrue(record.failureReason().contains("51008"));
        verify(okx, times(1)).submitMarketOrder(anyString(), any(), anyDouble());
        assertEquals(1, realLedger.size());
    }

    @Test
    @DisplayName("Saldo ilegible tras reintentos: 'balance unavailable' y sin orden")
    void testBalanceUnavailable() throws VenueException {
        when(okx.fetchFreeBalance("USDT")).thenThrow(new VenueException("okx", "HTTP 503"));

        TradeRecord record = executor.execute(TradeAction.BUY, okx, 50_000.0, TradingMode.REAL);

        assertEquals(TradeExecutor.BALANCE_UNAVAILABLE, record.failureReason());
        verify(okx, times(2)).fetchFreeBalance("USDT");
        verify(okx, never()).submitMarketOrder(anyString(), any(), anyDouble());
    }

    @Test
    @DisplayName("REAL SELL: sin chequeo de saldo, orden directa")
    void testRealSellSkipsBalanceCheck() throws VenueException {
        when(okx.submitMarketOrder("BTC/USDT", TradeAction.SELL, 0.001)).thenReturn("ord-9");

        TradeRecord record = executor.execute(TradeAction.SELL, okx, 50_100.0, TradingMode.REAL);

        assertEquals("ord-9", record.orderReference());
        verify(okx, never()).fetchFreeBalance(anyString());
    }

    @Test
    void testRequiresLedgerPerMode() {
        ResilientFetcher fetcher = new ResilientFetcher(RetryPolicy.DEFAULT);
        assertThrows(IllegalArgumentException.class, () -> new TradeExecutor(fetcher,
                Map.of(TradingMode.SIMULATION, simLedger), "BTC/USDT", "USDT", 0.001));
    }
}
