package com.gatehouse.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gatehouse.security.testing.TestPrincipalFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link AccessGuard}: every step of the authorization state machine, the challenge
 * headers and the live superuser check.
 */
@DisplayName("AccessGuard")
class AccessGuardTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final TokenSettings SETTINGS =
            new TokenSettings("test-secret-key-with-at-least-32-bytes!!", "HS256");

    private final TokenCodec codec = new TokenCodec(SETTINGS, Clock.fixed(NOW, ZoneOffset.UTC));
    private final Map<String, Principal> users = new HashMap<>();
    private AccessGuardFactory guards;

    @BeforeEach
    void setUp() {
        users.clear();
        guards = new AccessGuardFactory(codec, id -> Optional.ofNullable(users.get(id)));
    }

    private void store(Principal principal) {
        users.put(principal.id(), principal);
    }

    private String bearer(String subject, String... scopes) {
        return "Bearer " + codec.issue(subject, List.of(scopes));
    }

    @Nested
    @DisplayName("granted")
    class Granted {

        @Test
        @DisplayName("grants when the token carries every required scope")
        void tokenCoversRoute() {
            store(TestPrincipalFactory.holding("alice", Scope.USER_READ));

            AccessDecision decision = guards.requiringActive(Scope.USER_READ).authorize(bearer("alice", "user:read"));

            assertThat(decision.isGranted()).isTrue();
            assertThat(decision.principal().id()).isEqualTo("alice");
            assertThat(decision.denial()).isNull();
        }

        @Test
        @DisplayName("grants a route without scopes to any valid token")
        void noScopesRequired() {
            store(TestPrincipalFactory.withScopes("alice"));

            assertThat(guards.requiring().authorize(bearer("alice")).isGranted()).isTrue();
        }

        @Test
        @DisplayName("returns the principal as currently stored")
        void returnsLivePrincipal() {
            store(TestPrincipalFactory.holding("alice", Scope.USER_READ));
            String header = bearer("alice", "user:read");
            Principal renamed = new Principal("alice", "Alice Renamed", null, PrincipalStatus.ACTIVE,
                    Set.of("user:read"), null, null);
            store(renamed);

            assertThat(guards.requiring(Scope.USER_READ).authorize(header).principal().name())
                    .isEqualTo("Alice Renamed");
        }
    }

    @Nested
    @DisplayName("denied")
    class Denied {

        @Test
        @DisplayName("without a bearer token")
        void unauthenticated() {
            AccessGuard guard = guards.requiringActive(Scope.USER_READ);

            for (String header : new String[] {null, "", "Basic dXNlcjpwYXNz", "Bearer"}) {
                AccessDecision decision = guard.authorize(header);
                assertThat(decision.isGranted()).isFalse();
                assertThat(decision.denial().reason()).isEqualTo(DenialReason.UNAUTHENTICATED);
                assertThat(decision.denial().message()).isEqualTo("Not authenticated");
                assertThat(decision.denial().challenge()).isEqualTo("Bearer");
            }
        }

        @Test
        @DisplayName("with a token that does not decode")
        void invalidToken() {
            AccessDecision decision = guards.requiringActive(Scope.RESOURCES_READ, Scope.RESOURCES_WRITE)
                    .authorize("Bearer not.a.token");

            assertThat(decision.denial().reason()).isEqualTo(DenialReason.INVALID_TOKEN);
            assertThat(decision.denial().message()).isEqualTo("unable to validate credentials");
            assertThat(decision.denial().challenge()).isEqualTo("Bearer scope=\"resources:read resources:write\"");
        }

        @Test
        @DisplayName("with an expired token")
        void expiredToken() {
            store(TestPrincipalFactory.holding("alice", Scope.USER_READ));
            String expired = "Bearer " + codec.issue("alice", List.of("user:read"), Duration.ofMinutes(5));
            TokenCodec later = new TokenCodec(SETTINGS, Clock.fixed(NOW.plus(Duration.ofMinutes(5)), ZoneOffset.UTC));
            AccessGuardFactory laterGuards = new AccessGuardFactory(later, id -> Optional.ofNullable(users.get(id)));

            AccessDecision decision = laterGuards.requiring(Scope.USER_READ).authorize(expired);

            assertThat(decision.denial().reason()).isEqualTo(DenialReason.INVALID_TOKEN);
        }

        @Test
        @DisplayName("when the subject no longer exists")
        void principalNotFound() {
            AccessDecision decision = guards.requiring(Scope.USER_READ).authorize(bearer("ghost", "user:read"));

            assertThat(decision.denial().reason()).isEqualTo(DenialReason.PRINCIPAL_NOT_FOUND);
            assertThat(decision.denial().message()).isEqualTo("unable to validate credentials");
            assertThat(decision.denial().challenge()).isEqualTo("Bearer scope=\"user:read\"");
        }

        @Test
        @DisplayName("when the token lacks a required scope")
        void insufficientPermissions() {
            store(TestPrincipalFactory.holding("alice", Scope.RESOURCES_READ, Scope.RESOURCES_WRITE));

            AccessDecision decision = guards.requiringActive(Scope.RESOURCES_WRITE)
                    .authorize(bearer("alice", "resources:read"));

            assertThat(decision.denial().reason()).isEqualTo(DenialReason.INSUFFICIENT_PERMISSIONS);
            assertThat(decision.denial().message()).isEqualTo("insufficient permissions");
            assertThat(decision.denial().challenge()).isEqualTo("Bearer scope=\"resources:write\"");
        }

        @Test
        @DisplayName("when the principal is inactive and the route requires active")
        void inactivePrincipal() {
            store(TestPrincipalFactory.inactive("bob", "user:read"));

            AccessDecision decision = guards.requiringActive(Scope.USER_READ).authorize(bearer("bob", "user:read"));

            assertThat(decision.denial().reason()).isEqualTo(DenialReason.INACTIVE_PRINCIPAL);
            assertThat(decision.denial().message()).isEqualTo("unable to validate credentials");
            assertThat(decision.denial().challenge()).isEqualTo("Bearer");
        }

        @Test
        @DisplayName("reports a store failure as a server fault without a challenge")
        void storageError() {
            AccessGuardFactory failing = new AccessGuardFactory(codec, id -> {
                throw new StorageException("connection refused", null);
            });

            AccessDecision decision = failing.requiring(Scope.USER_READ).authorize(bearer("alice", "user:read"));

            assertThat(decision.denial().reason()).isEqualTo(DenialReason.STORAGE_ERROR);
            assertThat(decision.denial().reason().serverFault()).isTrue();
            assertThat(decision.denial().challenge()).isNull();
        }

        @Test
        @DisplayName("checks scopes before status")
        void scopesBeforeStatus() {
            store(TestPrincipalFactory.inactive("bob"));

            AccessDecision decision = guards.requiringActive(Scope.USER_WRITE).authorize(bearer("bob"));

            assertThat(decision.denial().reason()).isEqualTo(DenialReason.INSUFFICIENT_PERMISSIONS);
        }
    }

    @Nested
    @DisplayName("inactive principals")
    class InactivePrincipals {

        @Test
        @DisplayName("pass a guard that does not require active status")
        void allowedWithoutRequireActive() {
            store(TestPrincipalFactory.inactive("bob", "user:read"));

            assertThat(guards.requiring(Scope.USER_READ).authorize(bearer("bob", "user:read")).isGranted()).isTrue();
        }
    }

    @Nested
    @DisplayName("superuser")
    class Superuser {

        @Test
        @DisplayName("bypasses scope checks even with an empty token")
        void bypassesScopes() {
            store(TestPrincipalFactory.superuser("root"));

            AccessDecision decision = guards.requiringActive(Scope.RESOURCES_ADMIN, Scope.USER_WRITE)
                    .authorize(bearer("root"));

            assertThat(decision.isGranted()).isTrue();
        }

        @Test
        @DisplayName("loses the bypass as soon as the stored tag is removed")
        void revocationIsImmediate() {
            store(TestPrincipalFactory.superuser("root"));
            String header = bearer("root", Scope.SUPERUSER);
            AccessGuard guard = guards.requiringActive(Scope.USER_READ);
            assertThat(guard.authorize(header).isGranted()).isTrue();

            store(TestPrincipalFactory.withScopes("root"));

            assertThat(guard.authorize(header).denial().reason()).isEqualTo(DenialReason.INSUFFICIENT_PERMISSIONS);
        }

        @Test
        @DisplayName("gains the bypass for existing tokens as soon as the tag is stored")
        void promotionIsImmediate() {
            store(TestPrincipalFactory.withScopes("alice"));
            String header = bearer("alice");
            AccessGuard guard = guards.requiring(Scope.RESOURCES_WRITE);
            assertThat(guard.authorize(header).isGranted()).isFalse();

            store(TestPrincipalFactory.superuser("alice"));

            assertThat(guard.authorize(header).isGranted()).isTrue();
        }

        @Test
        @DisplayName("is still subject to the active check")
        void inactiveSuperuser() {
            store(TestPrincipalFactory.create("root", PrincipalStatus.INACTIVE, null, Scope.SUPERUSER));

            assertThat(guards.requiringActive(Scope.USER_READ).authorize(bearer("root")).denial().reason())
                    .isEqualTo(DenialReason.INACTIVE_PRINCIPAL);
        }
    }

    @Nested
    @DisplayName("token scopes")
    class TokenScopes {

        @Test
        @DisplayName("stay valid after the stored scope is removed")
        void tokenScopesAreFrozen() {
            store(TestPrincipalFactory.holding("alice", Scope.USER_WRITE));
            String header = bearer("alice", "user:write");

            store(TestPrincipalFactory.withScopes("alice"));

            assertThat(guards.requiringActive(Scope.USER_WRITE).authorize(header).isGranted()).isTrue();
        }
    }

    @Nested
    @DisplayName("factory")
    class Factory {

        @Test
        @DisplayName("deduplicates required scopes and records the active flag")
        void describesGuard() {
            AccessGuard guard = guards.requiringActive(Scope.USER_READ, Scope.USER_READ, Scope.USER_WRITE);

            assertThat(guard.requiredScopes()).containsExactly(Scope.USER_READ, Scope.USER_WRITE);
            assertThat(guard.requiresActive()).isTrue();
            assertThat(guards.requiring(Scope.USER_READ).requiresActive()).isFalse();
        }

        @Test
        @DisplayName("challenges with a bare scheme when no scopes are required")
        void bareChallenge() {
            assertThat(guards.requiring().authorize("Bearer junk").denial().challenge()).isEqualTo("Bearer");
        }

        @Test
        @DisplayName("rejects a decision with both or neither outcome")
        void decisionInvariant() {
            Principal alice = TestPrincipalFactory.withScopes("alice");
            AccessDenial denial = new AccessDenial(DenialReason.INVALID_TOKEN, null, null);

            assertThat(denial.message()).isEqualTo("unable to validate credentials");
            assertThatThrownBy(() -> new AccessDecision(alice, denial)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new AccessDecision(null, null)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
