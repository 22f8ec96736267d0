package io.github.flameyossnowy.dynrel.api.model;

import io.github.flameyossnowy.dynrel.api.exceptions.InvalidRelationshipContractException;
import io.github.flameyossnowy.dynrel.api.exceptions.UndefinedMethodException;
import io.github.flameyossnowy.dynrel.api.relation.BelongsTo;
import io.github.flameyossnowy.dynrel.api.relation.HasMany;
import io.github.flameyossnowy.dynrel.api.relation.HasOne;
import io.github.flameyossnowy.dynrel.api.relation.Relation;
import io.github.flameyossnowy.dynrel.api.relation.RelationshipKind;
import io.github.flameyossnowy.dynrel.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.UnmodifiableView;

import java.util.*;

/**
 * Base class for models.
 * <p>
 * A model holds its attributes, a cache of materialized relations keyed by relation name,
 * and the named relation methods it defines. Relations are only fetched on first access
 * through {@link #getProperty(String)} or {@link #getRelationValue(String)} and served from
 * the cache afterwards.
 * <p>
 * Instances are not thread-safe.
 */
public abstract class Model {
    private final ModelContext context;
    private final Map<String, Object> attributes;
    private final Map<String, Object> relations = new LinkedHashMap<>(8);
    private final Map<String, RelationMethod> relationMethods = new HashMap<>(8);

    protected Model(@NotNull ModelContext context, @NotNull Map<String, Object> attributes) {
        this.context = Objects.requireNonNull(context, "Model context cannot be null");
        this.attributes = new LinkedHashMap<>(Objects.requireNonNull(attributes, "Attributes cannot be null"));
    }

    public ModelContext getContext() {
        return context;
    }

    // ========== Attributes ==========

    public String getKeyName() {
        return "id";
    }

    @Nullable
    public Object getKey() {
        return attributes.get(getKeyName());
    }

    @Nullable
    public Object getAttribute(@NotNull String name) {
        return attributes.get(name);
    }

    public boolean hasAttribute(@NotNull String name) {
        return attributes.containsKey(name);
    }

    public Model setAttribute(@NotNull String name, @Nullable Object value) {
        attributes.put(name, value);
        return this;
    }

    public @UnmodifiableView Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    // ========== Relation cache ==========

    /**
     * @return true if a value, including null, is cached under the relation name
     */
    public boolean relationLoaded(@NotNull String name) {
        return relations.containsKey(name);
    }

    @Nullable
    public Object getRelation(@NotNull String name) {
        return relations.get(name);
    }

    public Model setRelation(@NotNull String name, @Nullable Object value) {
        relations.put(name, value);
        return this;
    }

    public Model unsetRelation(@NotNull String name) {
        relations.remove(name);
        return this;
    }

    public @UnmodifiableView Map<String, Object> getRelations() {
        return Collections.unmodifiableMap(relations);
    }

    // ========== Relation methods ==========

    /**
     * Defines an ordinary relation method, usually from a subclass constructor:
     * <pre>{@code
     * defineRelation("author", () -> belongsTo("App\\User", "user_id"));
     * }</pre>
     */
    protected void defineRelation(@NotNull String name, @NotNull RelationMethod method) {
        relationMethods.put(Objects.requireNonNull(name), Objects.requireNonNull(method));
    }

    public boolean hasRelationMethod(@NotNull String name) {
        return relationMethods.containsKey(name);
    }

    /**
     * Invokes the relation method named {@code name} without materializing it.
     *
     * @throws UndefinedMethodException if no such method is defined
     */
    public Object callRelationMethod(@NotNull String name) {
        RelationMethod method = relationMethods.get(name);
        if (method == null) {
            throw new UndefinedMethodException(getClass(), name);
        }
        return method.relation();
    }

    // ========== Relationship construction ==========

    public <M extends Model> HasOne<M> hasOne(@NotNull String related, @NotNull String foreignKey) {
        return new HasOne<>(this, context.entities().<M>require(related), foreignKey);
    }

    public <M extends Model> HasMany<M> hasMany(@NotNull String related, @NotNull String foreignKey) {
        return new HasMany<>(this, context.entities().<M>require(related), foreignKey);
    }

    public <M extends Model> BelongsTo<M> belongsTo(@NotNull String related, @NotNull String foreignKey) {
        return new BelongsTo<>(this, context.entities().<M>require(related), foreignKey);
    }

    /**
     * Invokes the relationship-construction method that {@code kind} names.
     */
    public Relation<?> relationFor(@NotNull RelationshipKind kind, @NotNull String related, @NotNull String key) {
        return switch (kind) {
            case HAS_ONE -> hasOne(related, key);
            case HAS_MANY -> hasMany(related, key);
            case BELONGS_TO -> belongsTo(related, key);
        };
    }

    // ========== Property and method access ==========

    /**
     * Reads a property: an attribute if one is set, otherwise the value of a relation of that name,
     * otherwise null.
     */
    @Nullable
    public Object getProperty(@NotNull String name) {
        if (attributes.containsKey(name)) {
            return attributes.get(name);
        }
        return getRelationValue(name);
    }

    /**
     * Calls a method by name. Plain models only know their relation methods, which are
     * returned unmaterialized.
     *
     * @throws UndefinedMethodException if the name is unknown
     */
    public Object call(@NotNull String name, Object... parameters) {
        if (hasRelationMethod(name)) {
            return callRelationMethod(name);
        }
        throw new UndefinedMethodException(getClass(), name);
    }

    /**
     * Returns the materialized value of a relation, loading it at most once.
     *
     * @return the cached or freshly loaded value, or null if no relation has that name
     */
    @Nullable
    public Object getRelationValue(@NotNull String key) {
        if (relationLoaded(key)) {
            return relations.get(key);
        }

        if (hasRelationMethod(key)) {
            return getRelationshipFromMethod(key);
        }
        return null;
    }

    protected Object getRelationshipFromMethod(@NotNull String method) {
        return materialize(method, callRelationMethod(method));
    }

    /**
     * Materializes a relation descriptor and caches the results under {@code name}.
     *
     * @throws InvalidRelationshipContractException if {@code relation} is not a {@link Relation}
     */
    protected final Object materialize(@NotNull String name, Object relation) {
        if (!(relation instanceof Relation<?> descriptor)) {
            throw new InvalidRelationshipContractException(name, relation);
        }

        Object results = descriptor.getResults();
        setRelation(name, results);
        Logging.deepInfo(() -> "Loaded relation " + getClass().getSimpleName() + "." + name + " via " + descriptor);
        return results;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + attributes;
    }
}
