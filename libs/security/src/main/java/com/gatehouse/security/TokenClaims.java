package com.gatehouse.security;

import java.time.Instant;
import java.util.List;

/**
 * The claims carried by an access token.
 *
 * @param subject principal id ({@code sub})
 * @param scopes granted scopes in the order they were granted ({@code scopes})
 * @param expiresAt absolute expiry, whole seconds ({@code exp})
 */
public record TokenClaims(String subject, List<String> scopes, Instant expiresAt) {

    public TokenClaims {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public boolean grants(Scope scope) {
        return scopes.contains(scope.value());
    }
}
