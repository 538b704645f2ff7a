package com.rafaeldiaz.spread_sentinel.core.orchestrator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    @DisplayName("Sin cancelar: la espera se completa")
    void testSleepCompletes() {
        CancellationToken token = new CancellationToken();
        assertTrue(token.sleep(Duration.ofMillis(5)));
        assertFalse(token.isCancelled());
    }

    @Test
    @DisplayName("Cancelado antes: retorna false de inmediato")
    void testSleepAfterCancel() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        assertFalse(token.sleep(Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("Cancelar despierta una espera en curso")
    void testCancelWakesSleeper() throws Exception {
        CancellationToken token = new CancellationToken();
        CompletableFuture<Boolean> sleeping = CompletableFuture.supplyAsync(() -> token.sleep(Duration.ofMinutes(5)));

        Thread.sleep(50);
        token.cancel();

        assertFalse(sleeping.get(2, TimeUnit.SECONDS));
        assertTrue(token.isCancelled());
    }
}
