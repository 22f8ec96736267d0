package io.github.flameyossnowy.dynrel.api.exceptions;

import com.fasterxml.jackson.core.JsonLocation;
import org.jetbrains.annotations.Nullable;

public record ConfigLocation(int lineNumber, int columnNumber, long charOffset) {
    @Nullable
    public static ConfigLocation from(@Nullable JsonLocation location) {
        if (location == null) {
            return null;
        }
        return new ConfigLocation(location.getLineNr(), location.getColumnNr(), location.getCharOffset());
    }
}
