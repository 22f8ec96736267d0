package io.github.flameyossnowy.dynrel.api.relation;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;

public enum RelationshipKind {
    HAS_ONE("hasOne"),
    HAS_MANY("hasMany"),
    BELONGS_TO("belongsTo");

    private final String methodName;

    RelationshipKind(String methodName) {
        this.methodName = methodName;
    }

    /**
     * @return the name of the relationship-construction method on the model, e.g. {@code hasMany}
     */
    public String methodName() {
        return methodName;
    }

    /**
     * Parses either a construction method name ({@code "belongsTo"}) or a constant name ({@code "BELONGS_TO"}).
     */
    @NotNull
    public static RelationshipKind fromMethodName(@NotNull String name) {
        for (RelationshipKind kind : values()) {
            if (kind.methodName.equals(name)) {
                return kind;
            }
        }

        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown relationship type: " + name, e);
        }
    }
}
