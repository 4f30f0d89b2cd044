package com.gatehouse.security;

import java.util.Optional;

/**
 * The fixed catalog of capability scopes a token can carry.
 * <p>
 * Scopes travel inside tokens and user records as plain strings (e.g. {@code "resources:read"});
 * this enum is the typed view used when a route declares what it requires.
 * The {@value #SUPERUSER} tag is deliberately not part of the catalog: it is never required by a
 * route, it only appears on a principal and satisfies every scope check.
 */
public enum Scope {

    USER_READ("user:read", "Read the current user."),
    USER_WRITE("user:write", "Write to the current user."),
    RESOURCES_READ("resources:read", "Read resources."),
    RESOURCES_WRITE("resources:write", "Write resources."),
    RESOURCES_ADMIN("resources:admin", "Administer resources.");

    /** Principal scope tag that implicitly grants every scope. */
    public static final String SUPERUSER = "superuser";

    private final String value;
    private final String description;

    Scope(String value, String description) {
        this.value = value;
        this.description = description;
    }

    /** The wire representation (e.g., "user:read"). */
    public String value() {
        return value;
    }

    /** Human-readable description, suitable for API documentation. */
    public String description() {
        return description;
    }

    /**
     * Looks up a Scope by its wire value.
     *
     * @param value the string to match (e.g., "resources:write")
     * @return the matching Scope, or empty if not in the catalog
     */
    public static Optional<Scope> fromValue(String value) {
        for (Scope scope : values()) {
            if (scope.value.equals(value)) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }
}
