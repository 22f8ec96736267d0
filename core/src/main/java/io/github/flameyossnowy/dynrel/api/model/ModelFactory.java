package io.github.flameyossnowy.dynrel.api.model;

import org.jetbrains.annotations.NotNull;

import java.util.Map;

@FunctionalInterface
public interface ModelFactory<M extends Model> {
    M create(@NotNull ModelContext context, @NotNull Map<String, Object> attributes);
}
