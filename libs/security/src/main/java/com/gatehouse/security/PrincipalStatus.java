package com.gatehouse.security;

import java.util.Optional;

/**
 * Lifecycle status of a principal. Only {@link #ACTIVE} principals pass guards that require an
 * active user.
 */
public enum PrincipalStatus {

    ACTIVE("active"),
    INACTIVE("inactive");

    private final String value;

    PrincipalStatus(String value) {
        this.value = value;
    }

    /** The stored and serialized representation. */
    public String value() {
        return value;
    }

    /**
     * Parses a stored status value.
     *
     * @param value e.g. "active"
     * @return the status, or empty if the value is unknown
     */
    public static Optional<PrincipalStatus> fromValue(String value) {
        for (PrincipalStatus status : values()) {
            if (status.value.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
