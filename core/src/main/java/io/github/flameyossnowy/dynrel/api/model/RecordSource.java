package io.github.flameyossnowy.dynrel.api.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Where relation descriptors fetch their rows from.
 * Implementations own query execution; relations only describe what to fetch.
 */
public interface RecordSource {
    /**
     * Returns every row of {@code table} whose {@code column} equals {@code value}.
     */
    @NotNull
    List<Map<String, Object>> where(@NotNull String table, @NotNull String column, @Nullable Object value);
}
