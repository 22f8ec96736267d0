package io.github.flameyossnowy.dynrel.api.exceptions;

import org.jetbrains.annotations.Nullable;

/**
 * Raised when a dynamic relation configuration cannot be read.
 */
public class ConfigurationException extends RuntimeException {
    private final ConfigLocation location;

    public ConfigurationException(String message, @Nullable ConfigLocation location) {
        super(message);
        this.location = location;
    }

    public ConfigurationException(String message, Throwable cause, @Nullable ConfigLocation location) {
        super(message, cause);
        this.location = location;
    }

    /**
     * @return where in the source the problem was detected, or null when unknown
     */
    @Nullable
    public ConfigLocation getLocation() {
        return location;
    }
}
