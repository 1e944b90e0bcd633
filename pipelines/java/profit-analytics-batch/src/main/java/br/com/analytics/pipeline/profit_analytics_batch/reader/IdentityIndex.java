package br.com.analytics.pipeline.profit_analytics_batch.reader;

import br.com.analytics.pipeline.profit_analytics_batch.model.SourceRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only id to record index owned by a single loader run. The first record stored under an id wins,
 * so overlapping or re-fetched pages never produce duplicates.
 */
final class IdentityIndex<T extends SourceRecord> {

    private final Map<String, T> records = new LinkedHashMap<>();

    void add(T record) {
        if (record != null && record.id() != null) {
            records.putIfAbsent(record.id(), record);
        }
    }

    void addAll(Collection<? extends T> batch) {
        for (T record : batch) {
            add(record);
        }
    }

    int size() {
        return records.size();
    }

    List<T> values() {
        return new ArrayList<>(records.values());
    }
}
