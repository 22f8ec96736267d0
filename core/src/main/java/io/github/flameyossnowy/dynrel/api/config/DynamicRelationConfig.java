package io.github.flameyossnowy.dynrel.api.config;

import io.github.flameyossnowy.dynrel.api.relation.RelationshipKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Dynamic relation tables for one model type.
 * <p>
 * Every table is optional. Names missing from a table fall back to the defaults:
 * <ul>
 *   <li>key: {@link #defaultKey()}, or {@code snake_case(ModelName) + "_id"} when that is null</li>
 *   <li>type: {@link #defaultType()}</li>
 *   <li>target entity: {@link #defaultNamespace()} + separator + {@code Studly(singular(name))}</li>
 *   <li>alias: the name itself</li>
 * </ul>
 * Contents are not validated. A bad entity identifier or key only shows up when the relation
 * is materialized.
 *
 * @param relations          names treated as dynamic relations
 * @param keyMap             relation name to key
 * @param typeMap            relation name to relationship kind
 * @param modelMap           relation name to target entity identifier
 * @param nameMap            alias to canonical relation name
 * @param defaultKey         key used when {@code keyMap} has no entry; null derives it from the model type
 * @param defaultType        kind used when {@code typeMap} has no entry
 * @param defaultNamespace   prefix for derived entity identifiers, may be empty
 * @param namespaceSeparator appended to a non-empty namespace that does not already end with it
 */
public record DynamicRelationConfig(
    @NotNull Set<String> relations,
    @NotNull Map<String, String> keyMap,
    @NotNull Map<String, RelationshipKind> typeMap,
    @NotNull Map<String, String> modelMap,
    @NotNull Map<String, String> nameMap,
    @Nullable String defaultKey,
    @NotNull RelationshipKind defaultType,
    @NotNull String defaultNamespace,
    @NotNull String namespaceSeparator
) {
    public static final RelationshipKind DEFAULT_TYPE = RelationshipKind.HAS_MANY;
    public static final String DEFAULT_NAMESPACE = "App";
    public static final String DEFAULT_NAMESPACE_SEPARATOR = "\\";

    public static final DynamicRelationConfig DEFAULTS = builder().build();

    public DynamicRelationConfig {
        relations = Set.copyOf(Objects.requireNonNull(relations, "relations"));
        keyMap = Map.copyOf(Objects.requireNonNull(keyMap, "keyMap"));
        typeMap = Map.copyOf(Objects.requireNonNull(typeMap, "typeMap"));
        modelMap = Map.copyOf(Objects.requireNonNull(modelMap, "modelMap"));
        nameMap = Map.copyOf(Objects.requireNonNull(nameMap, "nameMap"));
        Objects.requireNonNull(defaultType, "defaultType");
        Objects.requireNonNull(defaultNamespace, "defaultNamespace");
        Objects.requireNonNull(namespaceSeparator, "namespaceSeparator");
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a builder holding a copy of this config, for model types that extend another's tables.
     */
    @NotNull
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.relations.addAll(relations);
        builder.keyMap.putAll(keyMap);
        builder.typeMap.putAll(typeMap);
        builder.modelMap.putAll(modelMap);
        builder.nameMap.putAll(nameMap);
        builder.defaultKey = defaultKey;
        builder.defaultType = defaultType;
        builder.defaultNamespace = defaultNamespace;
        builder.namespaceSeparator = namespaceSeparator;
        return builder;
    }

    public static final class Builder {
        private final Set<String> relations = new LinkedHashSet<>(8);
        private final Map<String, String> keyMap = new HashMap<>(8);
        private final Map<String, RelationshipKind> typeMap = new HashMap<>(8);
        private final Map<String, String> modelMap = new HashMap<>(8);
        private final Map<String, String> nameMap = new HashMap<>(8);
        private String defaultKey;
        private RelationshipKind defaultType = DEFAULT_TYPE;
        private String defaultNamespace = DEFAULT_NAMESPACE;
        private String namespaceSeparator = DEFAULT_NAMESPACE_SEPARATOR;

        private Builder() {
        }

        public Builder relations(@NotNull String... names) {
            Collections.addAll(relations, names);
            return this;
        }

        public Builder relations(@NotNull Collection<String> names) {
            relations.addAll(names);
            return this;
        }

        public Builder key(@NotNull String relation, @NotNull String key) {
            keyMap.put(relation, key);
            return this;
        }

        public Builder type(@NotNull String relation, @NotNull RelationshipKind kind) {
            typeMap.put(relation, kind);
            return this;
        }

        public Builder model(@NotNull String relation, @NotNull String entityIdentifier) {
            modelMap.put(relation, entityIdentifier);
            return this;
        }

        /**
         * Makes {@code alias} resolve to the dynamic relation {@code canonical}.
         */
        public Builder alias(@NotNull String alias, @NotNull String canonical) {
            nameMap.put(alias, canonical);
            return this;
        }

        public Builder defaultKey(@Nullable String defaultKey) {
            this.defaultKey = defaultKey;
            return this;
        }

        public Builder defaultType(@NotNull RelationshipKind defaultType) {
            this.defaultType = defaultType;
            return this;
        }

        public Builder defaultNamespace(@NotNull String defaultNamespace) {
            this.defaultNamespace = defaultNamespace;
            return this;
        }

        public Builder namespaceSeparator(@NotNull String namespaceSeparator) {
            this.namespaceSeparator = namespaceSeparator;
            return this;
        }

        public DynamicRelationConfig build() {
            return new DynamicRelationConfig(
                relations,
                keyMap,
                typeMap,
                modelMap,
                nameMap,
                defaultKey,
                defaultType,
                defaultNamespace,
                namespaceSeparator
            );
        }
    }
}
