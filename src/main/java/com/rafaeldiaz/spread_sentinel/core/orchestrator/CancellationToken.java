package com.rafaeldiaz.spread_sentinel.core.orchestrator;

import com.rafaeldiaz.spread_sentinel.core.resilience.Sleeper;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 🛑 Señal de parada de un loop. Como {@link Sleeper} corta cualquier espera en curso
 * en cuanto se cancela (backoff del fetcher o pausa entre iteraciones).
 */
public final class CancellationToken implements Sleeper {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch signal = new CountDownLatch(1);

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            signal.countDown();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @return true si se completó la espera; false si se canceló (antes o durante)
     */
    @Override
    public boolean sleep(Duration duration) {
        if (cancelled.get()) return false;
        try {
            boolean signalled = signal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
            return !signalled && !cancelled.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
