package com.rafaeldiaz.spread_sentinel.core.ledger;

import com.rafaeldiaz.spread_sentinel.model.TradeRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * 📒 Historial en memoria, solo-añadir. El orden de inserción es el único orden.
 * Con retención acotada se descartan los más antiguos; los retenidos conservan su orden.
 */
public class TradeLedger {

    private final int maxRecords;
    private final Deque<TradeRecord> records = new ArrayDeque<>();

    public TradeLedger(int maxRecords) {
        if (maxRecords < 1) {
            throw new IllegalArgumentException("maxRecords debe ser >= 1");
        }
        this.maxRecords = maxRecords;
    }

    public synchronized void append(TradeRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record nulo");
        }
        records.addLast(record);
        while (records.size() > maxRecords) {
            records.removeFirst();
        }
    }

    /**
     * Últimos {@code n} registros en orden de inserción. Vacío si no hay nada o n <= 0.
     */
    public synchronized List<TradeRecord> recent(int n) {
        if (n <= 0 || records.isEmpty()) {
            return List.of();
        }
        int skip = Math.max(0, records.size() - n);
        List<TradeRecord> result = new ArrayList<>(records.size() - skip);
        Iterator<TradeRecord> it = records.iterator();
        for (int i = 0; it.hasNext(); i++) {
            TradeRecord r = it.next();
            if (i >= skip) result.add(r);
        }
        return List.copyOf(result);
    }

    public synchronized int size() {
        return records.size();
    }
}
