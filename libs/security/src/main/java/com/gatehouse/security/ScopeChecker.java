package com.gatehouse.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Scope arithmetic shared by login (what a new token may carry) and the access guard (whether
 * a token covers a route).
 *
 * <p>The two sides look at different data on purpose. Ordinary scopes are checked against the
 * scopes embedded in the token, so a token never gains power after it is issued. The
 * {@value Scope#SUPERUSER} bypass is checked against the live principal on every request, so
 * granting or revoking superuser takes effect immediately.
 */
public final class ScopeChecker {

    private ScopeChecker() {
        // utility class
    }

    /**
     * Splits an OAuth2 {@code scope} form parameter into individual scopes.
     *
     * @param scopeParameter space-separated scopes, may be null
     * @return the scopes in order, without blanks or duplicates
     */
    public static List<String> parse(String scopeParameter) {
        if (scopeParameter == null || scopeParameter.isBlank()) {
            return List.of();
        }
        Set<String> scopes = new LinkedHashSet<>();
        for (String part : scopeParameter.strip().split("\\s+")) {
            if (!part.isEmpty()) {
                scopes.add(part);
            }
        }
        return List.copyOf(scopes);
    }

    /**
     * Computes the scopes a new token for this principal may carry: every requested scope the
     * principal holds, or every requested scope if the principal is a superuser. Request order is
     * preserved and duplicates are dropped.
     *
     * @param principal the authenticated principal
     * @param requested scopes asked for at login
     * @return the granted scopes
     */
    public static List<String> grant(Principal principal, Collection<String> requested) {
        if (requested == null || requested.isEmpty()) {
            return List.of();
        }
        boolean superuser = principal.isSuperuser();
        Set<String> granted = new LinkedHashSet<>();
        for (String scope : requested) {
            if (superuser || principal.hasScope(scope)) {
                granted.add(scope);
            }
        }
        return List.copyOf(granted);
    }

    /**
     * Returns the required scopes that the token does not grant. Always empty when the live
     * principal is a superuser.
     *
     * @param claims verified token claims
     * @param principal the principal the token resolved to
     * @param required scopes the route requires
     * @return missing scopes, in the order they were required
     */
    public static List<Scope> missingScopes(TokenClaims claims, Principal principal, Collection<Scope> required) {
        if (principal.isSuperuser()) {
            return List.of();
        }
        List<Scope> missing = new ArrayList<>();
        for (Scope scope : required) {
            if (!claims.grants(scope)) {
                missing.add(scope);
            }
        }
        return missing;
    }
}
