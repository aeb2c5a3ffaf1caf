package com.polyast.core.normalizer;

import com.polyast.core.ast.Location;

import java.util.Optional;

/**
 * Thrown when a collaborator tree is in a state its grammar rules out, e.g. an
 * empty qualified name or an array type of depth zero.
 *
 * @since 1.0.0
 */
public class NormalizationException extends RuntimeException {

    private final transient Location location;

    public NormalizationException(String message, Location location) {
        super(format(message, location));
        this.location = location;
    }

    public NormalizationException(String message, Location location, Throwable cause) {
        super(format(message, location), cause);
        this.location = location;
    }

    /**
     * Returns the position of the offending node, when the collaborator provided one.
     */
    public Optional<Location> location() {
        return Optional.ofNullable(location);
    }

    private static String format(String message, Location location) {
        return location == null ? message : location + ": " + message;
    }
}
