package io.github.flameyossnowy.dynrel.api.dynamic;

import io.github.flameyossnowy.dynrel.api.config.DynamicRelationConfig;
import io.github.flameyossnowy.dynrel.api.exceptions.RelationNotFoundException;
import io.github.flameyossnowy.dynrel.api.model.Model;
import io.github.flameyossnowy.dynrel.api.model.ModelContext;
import io.github.flameyossnowy.dynrel.api.relation.Relation;
import io.github.flameyossnowy.dynrel.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Set;

/**
 * A model whose relations can be declared by name in a {@link DynamicRelationConfig}
 * instead of one relation method each.
 * <pre>{@code
 * public class Post extends DynamicModel {
 *     static final DynamicRelationConfig RELATIONS = DynamicRelationConfig.builder()
 *         .relations("comments", "tags")
 *         .build();
 *
 *     public Post(ModelContext context, Map<String, Object> attributes) {
 *         super(context, attributes, RELATIONS);
 *     }
 * }
 *
 * List<?> comments = (List<?>) post.getProperty("comments"); // hasMany("App\Comment", "post_id")
 * }</pre>
 * Names that are not dynamic behave exactly as on a plain {@link Model}.
 */
public abstract class DynamicModel extends Model {
    /**
     * Resolver helpers that {@link #call(String, Object...)} answers directly.
     */
    private static final Set<String> HELPER_METHODS = Set.of("isDynamicRelation");

    private final DynamicRelationResolver dynamicRelations;

    protected DynamicModel(
        @NotNull ModelContext context,
        @NotNull Map<String, Object> attributes,
        @NotNull DynamicRelationConfig config
    ) {
        super(context, attributes);
        this.dynamicRelations = DynamicRelationResolver.forType(getClass(), config);
    }

    public DynamicRelationResolver dynamicRelations() {
        return dynamicRelations;
    }

    public boolean isDynamicRelation(@NotNull String name) {
        return dynamicRelations.isDynamic(name);
    }

    /**
     * Builds the relation descriptor for a dynamic relation name, as if a relation method
     * of that name existed.
     * <p>
     * Names that are not dynamic are tried as ordinary relations: a value already in the
     * relation cache is returned as is, and an ordinary relation method of that name is
     * materialized.
     *
     * @param name       relation name, possibly an alias
     * @param parameters call arguments, unused by the built-in relationship kinds
     * @return a {@link Relation} for dynamic names, otherwise the materialized value
     * @throws RelationNotFoundException if the name cannot be resolved at all
     */
    public Object dynamicRelationProxy(@NotNull String name, Object... parameters) {
        ResolvedRelation resolved = dynamicRelations.resolve(name);
        if (resolved != null) {
            Logging.deepInfo(() -> "Dynamic relation " + getClass().getSimpleName() + "." + name + " -> "
                + resolved.kind().methodName() + "(" + resolved.targetEntity() + ", " + resolved.key() + ")");
            return relationFor(resolved.kind(), resolved.targetEntity(), resolved.key());
        }

        // getRelationValue() is not called from here, it would route the name back into this proxy
        if (relationLoaded(name)) {
            return getRelation(name);
        }

        if (hasRelationMethod(name)) {
            Logging.info(() -> "'" + name + "' is not a dynamic relation of " + getClass().getSimpleName()
                + ", using its relation method");
            return getRelationshipFromMethod(name, false);
        }

        String canonical = dynamicRelations.resolveAlias(name);
        Logging.warn("Dynamic relation lookup failed on " + getClass().getName() + ": relation '" + canonical + "' not found");
        throw new RelationNotFoundException(name,
            "dynamicRelationProxy failed: relation '" + canonical + "' not found");
    }

    @Override
    public Object call(@NotNull String name, Object... parameters) {
        if (HELPER_METHODS.contains(name)) {
            return callHelper(name, parameters);
        }

        if (dynamicRelations.handles(name)) {
            return dynamicRelationProxy(name, parameters);
        }
        return super.call(name, parameters);
    }

    @Override
    public @Nullable Object getProperty(@NotNull String name) {
        if (dynamicRelations.handles(name)) {
            return getRelationValue(name);
        }
        return super.getProperty(name);
    }

    /**
     * Returns the materialized value of a relation, resolving dynamic names through
     * {@link #dynamicRelationProxy(String, Object...)} and everything else through the
     * relation method of that name.
     *
     * @return the cached or freshly loaded value, or null if no relation has that name
     */
    @Override
    public @Nullable Object getRelationValue(@NotNull String key) {
        if (relationLoaded(key)) {
            return getRelation(key);
        }

        boolean useProxy = dynamicRelations.handles(key);
        if (useProxy || hasRelationMethod(key)) {
            return getRelationshipFromMethod(key, useProxy);
        }
        return null;
    }

    @Override
    protected Object getRelationshipFromMethod(@NotNull String method) {
        return getRelationshipFromMethod(method, false);
    }

    /**
     * Materializes a relation and caches it under {@code method}.
     *
     * @param useProxy build the relation with the dynamic proxy instead of calling the relation method
     */
    protected Object getRelationshipFromMethod(@NotNull String method, boolean useProxy) {
        Object relation = useProxy ? dynamicRelationProxy(method) : callRelationMethod(method);

        // the proxy fell back to an ordinary relation method and already cached its results
        if (useProxy && !(relation instanceof Relation<?>) && relationLoaded(method)) {
            return relation;
        }
        return materialize(method, relation);
    }

    private Object callHelper(String name, Object[] parameters) {
        if (parameters == null || parameters.length != 1 || !(parameters[0] instanceof String relation)) {
            throw new IllegalArgumentException(name + " expects exactly one relation name");
        }

        return dynamicRelations.isDynamic(relation);
    }
}
