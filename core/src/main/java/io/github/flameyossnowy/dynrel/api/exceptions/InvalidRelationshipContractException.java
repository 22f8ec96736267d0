package io.github.flameyossnowy.dynrel.api.exceptions;

import io.github.flameyossnowy.dynrel.api.relation.Relation;

/**
 * Thrown when a relationship method yields something other than a {@link Relation}.
 */
public class InvalidRelationshipContractException extends IllegalStateException {
    private final String relationName;
    private final Class<?> actualType;

    public InvalidRelationshipContractException(String relationName, Object actual) {
        super("Relationship method '" + relationName + "' must return an object of type "
            + Relation.class.getName() + ", got "
            + (actual == null ? "null" : actual.getClass().getName()));
        this.relationName = relationName;
        this.actualType = actual == null ? null : actual.getClass();
    }

    public String getRelationName() {
        return relationName;
    }

    public Class<?> getActualType() {
        return actualType;
    }
}
