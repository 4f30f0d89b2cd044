package com.gatehouse.api.support;

import com.gatehouse.api.infrastructure.persistence.JdbcUserRepository;
import com.gatehouse.security.PasswordHasher;
import com.gatehouse.security.Principal;
import com.gatehouse.security.PrincipalStatus;
import com.gatehouse.security.TokenCodec;
import com.gatehouse.security.testing.TestPrincipalFactory;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Creates users with unique ids and issues tokens for them, so that tests sharing one Spring
 * context and one in-memory database do not see each other's data.
 */
public final class TestAccounts {

    public static final String PASSWORD = "correct-password";

    private final JdbcUserRepository users;
    private final PasswordHasher passwordHasher;
    private final TokenCodec tokenCodec;

    public TestAccounts(JdbcUserRepository users, PasswordHasher passwordHasher, TokenCodec tokenCodec) {
        this.users = users;
        this.passwordHasher = passwordHasher;
        this.tokenCodec = tokenCodec;
    }

    /** Stores an active user holding the given scopes, with password {@link #PASSWORD}. */
    public Principal create(String... scopes) {
        return create(PrincipalStatus.ACTIVE, scopes);
    }

    public Principal create(PrincipalStatus status, String... scopes) {
        Principal principal = TestPrincipalFactory.create(
                "user-" + UUID.randomUUID(), status, passwordHasher.hash(PASSWORD), scopes);
        users.insert(principal);
        return principal;
    }

    /** An Authorization header value carrying the given token scopes. */
    public String bearer(Principal principal, String... tokenScopes) {
        return bearer(principal.id(), tokenScopes);
    }

    public String bearer(String subject, String... tokenScopes) {
        return "Bearer " + tokenCodec.issue(subject, List.of(tokenScopes), Duration.ofMinutes(5));
    }
}
