package io.github.flameyossnowy.dynrel.api.dynamic;

import io.github.flameyossnowy.dynrel.api.config.DynamicRelationConfig;
import io.github.flameyossnowy.dynrel.api.model.Model;
import io.github.flameyossnowy.dynrel.api.relation.RelationshipKind;
import io.github.flameyossnowy.dynrel.api.utils.Inflector;
import io.github.flameyossnowy.dynrel.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Answers name lookups against one model type's {@link DynamicRelationConfig}.
 * <p>
 * Instances are immutable and shared by every model of the same type, see {@link #forType(Class, DynamicRelationConfig)}.
 */
public final class DynamicRelationResolver {
    private static final Map<Class<?>, String> defaultKeys = new ConcurrentHashMap<>(16);
    private static final Map<Class<?>, DynamicRelationResolver> resolvers = new ConcurrentHashMap<>(16);

    private final Class<? extends Model> modelType;
    private final DynamicRelationConfig config;

    public DynamicRelationResolver(@NotNull Class<? extends Model> modelType, @NotNull DynamicRelationConfig config) {
        this.modelType = Objects.requireNonNull(modelType, "Model type cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
    }

    /**
     * Returns the shared resolver of a model type, creating it on first use or when the
     * type is handed a different config instance.
     */
    @NotNull
    public static DynamicRelationResolver forType(@NotNull Class<? extends Model> modelType, @NotNull DynamicRelationConfig config) {
        return resolvers.compute(modelType, (type, cached) -> {
            if (cached != null && cached.config == config) {
                return cached;
            }

            Logging.deepInfo(() -> "Created dynamic relation resolver for " + type.getName() + ": " + config.relations());
            return new DynamicRelationResolver(modelType, config);
        });
    }

    /**
     * {@code snake_case(SimpleName) + "_id"}, computed once per model type.
     */
    @NotNull
    public static String defaultKeyFor(@NotNull Class<?> modelType) {
        return defaultKeys.computeIfAbsent(modelType, type -> Inflector.snake(type.getSimpleName()) + "_id");
    }

    public Class<? extends Model> modelType() {
        return modelType;
    }

    public DynamicRelationConfig config() {
        return config;
    }

    /**
     * @return the canonical name an alias maps to, or {@code name} itself
     */
    @NotNull
    public String resolveAlias(@NotNull String name) {
        return config.nameMap().getOrDefault(name, name);
    }

    public boolean isDynamic(@NotNull String name) {
        return config.relations().contains(name);
    }

    /**
     * True when {@code name} or the relation it is an alias of is dynamic.
     */
    public boolean handles(@NotNull String name) {
        return isDynamic(name) || isDynamic(resolveAlias(name));
    }

    @NotNull
    public String resolveKey(@NotNull String name) {
        String key = config.keyMap().get(name);
        return key != null ? key : defaultKey();
    }

    @NotNull
    public String defaultKey() {
        String key = config.defaultKey();
        return key != null ? key : defaultKeyFor(modelType);
    }

    @NotNull
    public RelationshipKind resolveType(@NotNull String name) {
        return config.typeMap().getOrDefault(name, config.defaultType());
    }

    /**
     * Returns the mapped entity identifier, or derives one:
     * {@code "comments"} becomes {@code "App\Comment"} with the default namespace.
     */
    @NotNull
    public String resolveTargetEntity(@NotNull String name) {
        String mapped = config.modelMap().get(name);
        if (mapped != null) {
            return mapped;
        }

        String namespace = config.defaultNamespace();
        String separator = config.namespaceSeparator();
        if (!namespace.isEmpty() && !namespace.endsWith(separator)) {
            namespace += separator;
        }

        return namespace + Inflector.studly(Inflector.singular(name));
    }

    /**
     * Resolves everything needed to construct a dynamic relation.
     * The kind is looked up by {@code requestedName}, so an alias can carry its own type override;
     * entity and key are looked up by the canonical name.
     *
     * @return the resolution, or null if the canonical name is not a dynamic relation
     */
    @Nullable
    public ResolvedRelation resolve(@NotNull String requestedName) {
        String canonical = resolveAlias(requestedName);
        if (!isDynamic(canonical)) {
            return null;
        }

        return new ResolvedRelation(
            requestedName,
            canonical,
            resolveTargetEntity(canonical),
            resolveKey(canonical),
            resolveType(requestedName)
        );
    }
}
