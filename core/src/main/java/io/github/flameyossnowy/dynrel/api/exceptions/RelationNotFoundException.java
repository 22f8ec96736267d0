package io.github.flameyossnowy.dynrel.api.exceptions;

/**
 * Thrown when a relation name is neither dynamic, already loaded, nor backed by a relation method.
 */
public class RelationNotFoundException extends RuntimeException {
    private final String relationName;

    public RelationNotFoundException(String relationName) {
        super("Relation '" + relationName + "' not found");
        this.relationName = relationName;
    }

    public RelationNotFoundException(String relationName, String message) {
        super(message);
        this.relationName = relationName;
    }

    public String getRelationName() {
        return relationName;
    }
}
