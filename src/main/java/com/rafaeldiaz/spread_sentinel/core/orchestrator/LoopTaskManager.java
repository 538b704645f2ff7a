package com.rafaeldiaz.spread_sentinel.core.orchestrator;

import com.rafaeldiaz.spread_sentinel.model.TradingMode;
import com.rafaeldiaz.spread_sentinel.utils.BotLogger;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * ⏰ GESTOR DE LOOPS
 * Un loop como máximo por modo (IDLE -> RUNNING -> IDLE). Simulación y real son independientes.
 *
 * <p>La parada es cooperativa: se cancela el token y se espera a que la iteración en curso
 * termine. Una iteración que ya está ejecutando un trade lo completa; el hilo nunca se
 * interrumpe y el modo no se puede relanzar hasta que esa iteración acabe.</p>
 */
public class LoopTaskManager {

    private final ExecutorService pool;
    private final Duration stopTimeout;
    private final Map<TradingMode, LoopHandle> handles = new EnumMap<>(TradingMode.class);

    public LoopTaskManager(Duration stopTimeout) {
        this(Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "bot-loop");
            t.setDaemon(true);
            return t;
        }), stopTimeout);
    }

    public LoopTaskManager(ExecutorService pool, Duration stopTimeout) {
        this.pool = pool;
        this.stopTimeout = stopTimeout;
    }

    /**
     * @param iteration cuerpo de una iteración; recibe el token para sus esperas cancelables
     * @param interval  pausa entre iteraciones
     */
    public synchronized LoopCommandResult start(TradingMode mode, Consumer<CancellationToken> iteration, Duration interval) {
        LoopHandle current = handles.get(mode);
        if (current != null && !current.isFinished()) {
            return LoopCommandResult.ALREADY_RUNNING;
        }

        CancellationToken token = new CancellationToken();
        handles.put(mode, new LoopHandle(mode, pool.submit(() -> runLoop(mode, iteration, interval, token)), token));
        BotLogger.info("🔄 Loop " + mode.label() + " lanzado (cada " + interval.toMillis() + " ms).");
        return LoopCommandResult.STARTED;
    }

    /**
     * Pide la parada y espera hasta {@code stopTimeout}. Nunca interrumpe la iteración: si no
     * terminó a tiempo devuelve {@link LoopCommandResult#STOPPING} y el handle se conserva, así
     * que un {@code start} del mismo modo sigue respondiendo ALREADY_RUNNING hasta que acabe.
     */
    public LoopCommandResult stop(TradingMode mode) {
        LoopHandle current;
        synchronized (this) {
            current = handles.get(mode);
            if (current == null || current.isFinished()) {
                handles.remove(mode);
                return LoopCommandResult.NOT_RUNNING;
            }
            current.token().cancel();
        }

        // La espera va fuera del lock: el otro modo sigue atendiendo start/isRunning
        if (!awaitTermination(current)) {
            return LoopCommandResult.STOPPING;
        }

        synchronized (this) {
            handles.remove(mode, current);
        }
        BotLogger.info("⏹ Loop " + mode.label() + " detenido.");
        return LoopCommandResult.STOPPED;
    }

    public synchronized boolean isRunning(TradingMode mode) {
        LoopHandle current = handles.get(mode);
        return current != null && !current.isFinished();
    }

    /**
     * Detiene todos los loops vivos y libera el pool (hook de apagado).
     */
    public void shutdown() {
        for (TradingMode mode : TradingMode.values()) {
            stop(mode);
        }
        pool.shutdown();
    }

    private void runLoop(TradingMode mode, Consumer<CancellationToken> iteration, Duration interval, CancellationToken token) {
        Thread thread = Thread.currentThread();
        String poolName = thread.getName();
        thread.setName("bot-loop-" + mode.name().toLowerCase(Locale.ROOT));
        try {
            while (!token.isCancelled()) {
                try {
                    iteration.accept(token);
                } catch (RuntimeException e) {
                    BotLogger.error("🔥 Error en iteración del loop " + mode.label() + ": " + e.getMessage());
                }
                if (!token.sleep(interval)) {
                    break;
                }
            }
        } finally {
            thread.setName(poolName);
        }
    }

    /** @return true si la tarea terminó dentro del plazo */
    private boolean awaitTermination(LoopHandle handle) {
        try {
            handle.task().get(stopTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            BotLogger.warn("⏳ El loop " + handle.mode().label() + " sigue completando su iteración tras "
                    + stopTimeout.toMillis() + " ms. Parará al terminarla.");
            return false;
        } catch (ExecutionException e) {
            BotLogger.error("💥 El loop " + handle.mode().label() + " terminó con error: " + e.getCause());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            BotLogger.warn("Espera de parada interrumpida para " + handle.mode().label());
            return handle.isFinished();
        }
    }
}
