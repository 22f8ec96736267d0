package io.github.flameyossnowy.dynrel.api.model;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Everything a model needs to build and materialize its relations.
 */
public record ModelContext(@NotNull EntityRegistry entities, @NotNull RecordSource source) {
    public ModelContext {
        Objects.requireNonNull(entities, "Entity registry cannot be null");
        Objects.requireNonNull(source, "Record source cannot be null");
    }
}
