package com.rafaeldiaz.spread_sentinel.notify;

/**
 * Destino de los avisos del bot (respuestas a comandos y alertas de los loops).
 * Las implementaciones no lanzan: un aviso perdido se registra en el log y ya.
 */
@FunctionalInterface
public interface Notifier {
    void notify(String htmlText);
}
