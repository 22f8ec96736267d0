package io.github.flameyossnowy.dynrel.api.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.flameyossnowy.dynrel.api.exceptions.ConfigLocation;
import io.github.flameyossnowy.dynrel.api.exceptions.ConfigurationException;
import io.github.flameyossnowy.dynrel.api.relation.RelationshipKind;
import io.github.flameyossnowy.dynrel.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Reads {@link DynamicRelationConfig}s from JSON.
 * <pre>{@code
 * {
 *   "relations": ["comments", "user_languages", "author"],
 *   "keys": {"comments": "post_id"},
 *   "types": {"author": "belongsTo"},
 *   "models": {"author": "App\\User"},
 *   "aliases": {"languages": "user_languages"},
 *   "defaultKey": "post_id",
 *   "defaultType": "hasMany",
 *   "namespace": "App",
 *   "namespaceSeparator": "\\"
 * }
 * }</pre>
 * Every field is optional; missing ones keep the values of the base config.
 */
public class DynamicRelationConfigLoader {
    private static final Set<String> KNOWN_FIELDS = Set.of(
        "relations", "keys", "types", "models", "aliases",
        "defaultKey", "defaultType", "namespace", "namespaceSeparator"
    );

    private final ObjectMapper mapper;

    public DynamicRelationConfigLoader() {
        this(new ObjectMapper());
    }

    public DynamicRelationConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @NotNull
    public DynamicRelationConfig fromJson(@NotNull String json) {
        return fromJson(json, DynamicRelationConfig.DEFAULTS);
    }

    /**
     * Reads a config whose missing fields are taken from {@code base}.
     */
    @NotNull
    public DynamicRelationConfig fromJson(@NotNull String json, @NotNull DynamicRelationConfig base) {
        try {
            return read(mapper.readTree(json), base);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(e.getOriginalMessage(), e, ConfigLocation.from(e.getLocation()));
        }
    }

    @NotNull
    public DynamicRelationConfig fromStream(@NotNull InputStream in) {
        try {
            return read(mapper.readTree(in), DynamicRelationConfig.DEFAULTS);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(e.getOriginalMessage(), e, ConfigLocation.from(e.getLocation()));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read dynamic relation config", e, null);
        }
    }

    /**
     * Reads a config from the context class loader.
     *
     * @param resource e.g. {@code dynamic-relations/post.json}
     */
    @NotNull
    public DynamicRelationConfig fromResource(@NotNull String resource) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = DynamicRelationConfigLoader.class.getClassLoader();
        }

        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Dynamic relation config not found: " + resource, null);
            }
            Logging.info(() -> "Loading dynamic relation config from " + resource);
            return fromStream(in);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read dynamic relation config " + resource, e, null);
        }
    }

    private static DynamicRelationConfig read(JsonNode root, DynamicRelationConfig base) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Dynamic relation config must be a JSON object", null);
        }

        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!KNOWN_FIELDS.contains(name)) {
                Logging.warn("Ignoring unknown dynamic relation config field '" + name + "'");
            }
        }

        DynamicRelationConfig.Builder builder = base.toBuilder();

        JsonNode relations = root.get("relations");
        if (relations != null && !relations.isNull()) {
            if (!relations.isArray()) {
                throw new ConfigurationException("'relations' must be an array of names", null);
            }
            for (JsonNode relation : relations) {
                builder.relations(text(relation, "relations[]"));
            }
        }

        readMap(root, "keys", builder::key);
        readMap(root, "models", builder::model);
        readMap(root, "aliases", builder::alias);
        readMap(root, "types", (relation, type) -> builder.type(relation, kind(type)));

        if (root.has("defaultKey")) {
            JsonNode defaultKey = root.get("defaultKey");
            builder.defaultKey(defaultKey.isNull() ? null : text(defaultKey, "defaultKey"));
        }
        if (root.hasNonNull("defaultType")) {
            builder.defaultType(kind(text(root.get("defaultType"), "defaultType")));
        }
        if (root.hasNonNull("namespace")) {
            builder.defaultNamespace(text(root.get("namespace"), "namespace"));
        }
        if (root.hasNonNull("namespaceSeparator")) {
            builder.namespaceSeparator(text(root.get("namespaceSeparator"), "namespaceSeparator"));
        }

        return builder.build();
    }

    private static void readMap(JsonNode root, String field, BiConsumer<String, String> sink) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return;
        }
        if (!node.isObject()) {
            throw new ConfigurationException("'" + field + "' must be an object of name/value pairs", null);
        }

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            sink.accept(entry.getKey(), text(entry.getValue(), field + "." + entry.getKey()));
        }
    }

    private static String text(JsonNode node, String path) {
        if (!node.isTextual()) {
            throw new ConfigurationException("'" + path + "' must be a string, got " + node.getNodeType(), null);
        }
        return node.asText();
    }

    private static RelationshipKind kind(String value) {
        try {
            return RelationshipKind.fromMethodName(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e, null);
        }
    }
}
