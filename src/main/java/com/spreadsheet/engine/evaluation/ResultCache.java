package com.spreadsheet.engine.evaluation;

import com.spreadsheet.engine.values.FormulaValue;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-lived cellId -> result map that saves re-reading settled cells during a
 * burst of reads. Entries expire after the TTL. It is only an optimization: the
 * engine invalidates a cell and everything downstream of it on every write.
 */
public class ResultCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public ResultCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * The cached value, or null when absent or expired.
     */
    public FormulaValue get(String cellId) {
        Entry entry = entries.get(cellId);
        if (entry == null) {
            return null;
        }
        if (clock.millis() - entry.timestamp > ttl.toMillis()) {
            entries.remove(cellId, entry);
            return null;
        }
        return entry.value;
    }

    public void put(String cellId, FormulaValue value) {
        entries.put(cellId, new Entry(value, clock.millis()));
    }

    public void invalidate(String cellId) {
        entries.remove(cellId);
    }

    public void invalidateAll(Collection<String> cellIds) {
        for (String cellId : cellIds) {
            entries.remove(cellId);
        }
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private static final class Entry {
        private final FormulaValue value;
        private final long timestamp;

        private Entry(FormulaValue value, long timestamp) {
            this.value = value;
            this.timestamp = timestamp;
        }
    }
}
