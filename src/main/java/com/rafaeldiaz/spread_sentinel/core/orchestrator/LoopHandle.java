package com.rafaeldiaz.spread_sentinel.core.orchestrator;

import com.rafaeldiaz.spread_sentinel.model.TradingMode;

import java.util.concurrent.Future;

/**
 * Loop vivo de un modo: la tarea en el pool y su token de parada.
 */
public record LoopHandle(TradingMode mode, Future<?> task, CancellationToken token) {

    public boolean isFinished() {
        return task.isDone();
    }
}
