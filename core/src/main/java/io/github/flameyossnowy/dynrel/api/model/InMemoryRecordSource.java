package io.github.flameyossnowy.dynrel.api.model;

import io.github.flameyossnowy.dynrel.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link RecordSource} backed by plain maps.
 * Counts the queries it answers so callers can check how often relations hit the source.
 */
public class InMemoryRecordSource implements RecordSource {
    private final Map<String, List<Map<String, Object>>> tables = new ConcurrentHashMap<>(8);
    private final AtomicInteger queryCount = new AtomicInteger();

    public InMemoryRecordSource insert(@NotNull String table, @NotNull Map<String, Object> row) {
        tables.computeIfAbsent(table, k -> Collections.synchronizedList(new ArrayList<>(16)))
            .add(new LinkedHashMap<>(row));
        return this;
    }

    @Override
    public @NotNull List<Map<String, Object>> where(@NotNull String table, @NotNull String column, @Nullable Object value) {
        queryCount.incrementAndGet();
        Logging.deepInfo(() -> "where " + table + "." + column + " = " + value);

        List<Map<String, Object>> rows = tables.get(table);
        if (rows == null) {
            return List.of();
        }

        List<Map<String, Object>> result = new ArrayList<>();
        synchronized (rows) {
            for (Map<String, Object> row : rows) {
                if (row.containsKey(column) && Objects.equals(row.get(column), value)) {
                    result.add(Collections.unmodifiableMap(row));
                }
            }
        }
        return result;
    }

    public int queryCount() {
        return queryCount.get();
    }
}
