package io.github.flameyossnowy.dynrel.api.model;

import io.github.flameyossnowy.dynrel.api.exceptions.UnknownEntityException;
import io.github.flameyossnowy.dynrel.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of entity types by identifier.
 * <p>
 * Relationship construction looks targets up here, so every identifier a relation
 * configuration can produce has to be registered before the relation is materialized.
 */
public final class EntityRegistry {
    private final Map<String, EntityType<?>> byIdentifier = new ConcurrentHashMap<>(16);

    /**
     * Registers an entity type, replacing any previous registration with the same identifier.
     *
     * @param type The entity type
     * @return this registry
     */
    public EntityRegistry register(@NotNull EntityType<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("EntityType cannot be null");
        }

        EntityType<?> previous = byIdentifier.put(type.identifier(), type);
        if (previous != null) {
            Logging.warn("Entity '" + type.identifier() + "' was registered twice, the last registration wins");
        }
        Logging.deepInfo(() -> "Registered entity " + type.identifier() + " -> " + type.table());
        return this;
    }

    /**
     * @param identifier The entity identifier
     * @return the entity type, or null if not registered
     */
    @Nullable
    @SuppressWarnings("unchecked")
    public <M extends Model> EntityType<M> get(String identifier) {
        return (EntityType<M>) byIdentifier.get(identifier);
    }

    /**
     * Like {@link #get(String)} but fails for unknown identifiers.
     *
     * @throws UnknownEntityException if nothing is registered under the identifier
     */
    @NotNull
    public <M extends Model> EntityType<M> require(String identifier) {
        EntityType<M> type = get(identifier);
        if (type == null) {
            throw new UnknownEntityException(identifier);
        }
        return type;
    }

    public boolean has(String identifier) {
        return byIdentifier.containsKey(identifier);
    }

    public Set<String> identifiers() {
        return Collections.unmodifiableSet(byIdentifier.keySet());
    }

    public void clear() {
        byIdentifier.clear();
    }
}
