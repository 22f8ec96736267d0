package io.github.flameyossnowy.dynrel.api.model;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Describes an entity that relations can target.
 *
 * @param identifier fully-qualified entity name used by relation configuration, e.g. {@code App\Comment}
 * @param table      table (or collection) the rows live in
 * @param primaryKey primary key column
 * @param factory    builds a model instance from a row
 */
public record EntityType<M extends Model>(
    @NotNull String identifier,
    @NotNull String table,
    @NotNull String primaryKey,
    @NotNull ModelFactory<M> factory
) {
    public EntityType {
        Objects.requireNonNull(identifier, "Entity identifier cannot be null");
        Objects.requireNonNull(table, "Table cannot be null");
        Objects.requireNonNull(primaryKey, "Primary key cannot be null");
        Objects.requireNonNull(factory, "Factory cannot be null");
        if (identifier.isBlank()) {
            throw new IllegalArgumentException("Entity identifier cannot be blank");
        }
    }

    public static <M extends Model> EntityType<M> of(String identifier, String table, ModelFactory<M> factory) {
        return new EntityType<>(identifier, table, "id", factory);
    }
}
