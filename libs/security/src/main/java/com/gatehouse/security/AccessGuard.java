package com.gatehouse.security;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-request authorization gate for one route.
 *
 * <p>Given the raw {@code Authorization} header, the guard walks the request through
 * <em>unauthenticated → token decoded → principal resolved → authorized</em> and stops at the
 * first failing step with an {@link AccessDenial}:
 *
 * <ol>
 *   <li>no bearer token: {@link DenialReason#UNAUTHENTICATED}
 *   <li>token fails to decode: {@link DenialReason#INVALID_TOKEN}
 *   <li>subject unknown: {@link DenialReason#PRINCIPAL_NOT_FOUND}; store failure:
 *       {@link DenialReason#STORAGE_ERROR}
 *   <li>a required scope missing from the token (superusers exempt):
 *       {@link DenialReason#INSUFFICIENT_PERMISSIONS}
 *   <li>principal not active, when the guard requires it: {@link DenialReason#INACTIVE_PRINCIPAL}
 * </ol>
 *
 * <p>Guards are immutable and built once per route by {@link AccessGuardFactory}. Running a guard
 * has no side effects beyond one user lookup.
 */
public final class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    private final TokenCodec tokenCodec;
    private final UserStore userStore;
    private final List<Scope> requiredScopes;
    private final boolean requireActive;
    private final String scopedChallenge;

    AccessGuard(TokenCodec tokenCodec, UserStore userStore, Collection<Scope> requiredScopes, boolean requireActive) {
        this.tokenCodec = tokenCodec;
        this.userStore = userStore;
        this.requiredScopes = List.copyOf(new LinkedHashSet<>(requiredScopes));
        this.requireActive = requireActive;
        this.scopedChallenge = this.requiredScopes.isEmpty()
                ? BearerTokenExtractor.SCHEME
                : BearerTokenExtractor.SCHEME + " scope=\"" + this.requiredScopes.stream()
                        .map(Scope::value)
                        .collect(Collectors.joining(" ")) + "\"";
    }

    /**
     * Runs the guard against one request.
     *
     * @param authorizationHeader the raw Authorization header value, may be null
     * @return the granted principal, or the reason for denial
     */
    public AccessDecision authorize(String authorizationHeader) {
        Optional<String> token = BearerTokenExtractor.extract(authorizationHeader);
        if (token.isEmpty()) {
            return deny(DenialReason.UNAUTHENTICATED, BearerTokenExtractor.SCHEME);
        }

        TokenClaims claims;
        try {
            claims = tokenCodec.decode(token.get());
        } catch (InvalidTokenException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            return deny(DenialReason.INVALID_TOKEN, scopedChallenge);
        }

        Optional<Principal> resolved;
        try {
            resolved = userStore.get(claims.subject());
        } catch (StorageException e) {
            log.warn("User lookup failed while authorizing sub={}", claims.subject(), e);
            return deny(DenialReason.STORAGE_ERROR, null);
        }
        if (resolved.isEmpty()) {
            log.debug("Token subject {} does not resolve to a user", claims.subject());
            return deny(DenialReason.PRINCIPAL_NOT_FOUND, scopedChallenge);
        }
        Principal principal = resolved.get();

        List<Scope> missing = ScopeChecker.missingScopes(claims, principal, requiredScopes);
        if (!missing.isEmpty()) {
            log.debug("User {} lacks scopes {}", principal.id(), missing);
            return deny(DenialReason.INSUFFICIENT_PERMISSIONS, scopedChallenge);
        }

        if (requireActive && !principal.isActive()) {
            log.debug("User {} is {}", principal.id(), principal.status().value());
            return deny(DenialReason.INACTIVE_PRINCIPAL, BearerTokenExtractor.SCHEME);
        }
        return AccessDecision.granted(principal);
    }

    public List<Scope> requiredScopes() {
        return requiredScopes;
    }

    public boolean requiresActive() {
        return requireActive;
    }

    private static AccessDecision deny(DenialReason reason, String challenge) {
        return AccessDecision.denied(new AccessDenial(reason, reason.defaultMessage(), challenge));
    }
}
