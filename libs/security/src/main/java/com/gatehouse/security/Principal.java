package com.gatehouse.security;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A user record as the access guard sees it: identity, status, stored scopes and password hash.
 *
 * <p>Immutable. A {@code null} scope set is normalised to an empty one and a {@code null} status
 * to {@link PrincipalStatus#ACTIVE}. {@link #toString()} never prints the password hash.
 *
 * @param id unique user id (primary key)
 * @param name optional display name
 * @param email optional email address
 * @param status lifecycle status
 * @param scopes capability tags held by the user, possibly including {@value Scope#SUPERUSER}
 * @param hashedPassword self-describing password hash, or null if the user cannot log in
 * @param data free-form profile data (nullable)
 */
public record Principal(
        String id,
        String name,
        String email,
        PrincipalStatus status,
        Set<String> scopes,
        String hashedPassword,
        Map<String, Object> data) {

    public Principal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (status == null) {
            status = PrincipalStatus.ACTIVE;
        }
        scopes = scopes == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
        data = data == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public boolean isActive() {
        return status == PrincipalStatus.ACTIVE;
    }

    /** Whether the stored scopes carry the {@value Scope#SUPERUSER} tag. */
    public boolean isSuperuser() {
        return scopes.contains(Scope.SUPERUSER);
    }

    public boolean hasScope(String scope) {
        return scopes.contains(scope);
    }

    @Override
    public String toString() {
        return "Principal[id=%s, name=%s, email=%s, status=%s, scopes=%s, hashedPassword=%s]"
                .formatted(id, name, email, status, scopes, hashedPassword == null ? null : "[REDACTED]");
    }
}
