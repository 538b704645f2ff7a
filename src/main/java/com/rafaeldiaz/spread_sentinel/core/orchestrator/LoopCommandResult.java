package com.rafaeldiaz.spread_sentinel.core.orchestrator;

/** Respuesta a un start/stop de loop. */
public enum LoopCommandResult {
    STARTED,
    ALREADY_RUNNING,
    STOPPED,
    /** Parada pedida, pero la iteración en curso sigue terminando su trade. */
    STOPPING,
    NOT_RUNNING
}
