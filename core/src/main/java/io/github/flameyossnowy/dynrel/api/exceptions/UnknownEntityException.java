package io.github.flameyossnowy.dynrel.api.exceptions;

public class UnknownEntityException extends RuntimeException {
    private final String identifier;

    public UnknownEntityException(String identifier) {
        super("Unknown entity '" + identifier + "', is it registered in the EntityRegistry?");
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
