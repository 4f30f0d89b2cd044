package com.gatehouse.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.gatehouse.security.testing.TestPrincipalFactory;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link CredentialAuthenticator}.
 */
@DisplayName("CredentialAuthenticator")
class CredentialAuthenticatorTest {

    private final PasswordHasher hasher = new PasswordHasher(4);
    private UserStore store;
    private CredentialAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        store = mock(UserStore.class);
        authenticator = new CredentialAuthenticator(store, hasher);
    }

    @Test
    @DisplayName("returns the principal for a correct password")
    void validCredentials() {
        Principal alice = TestPrincipalFactory.create("alice", PrincipalStatus.ACTIVE, hasher.hash("s3cret"), "user:read");
        when(store.get("alice")).thenReturn(Optional.of(alice));

        assertThat(authenticator.authenticate("alice", "s3cret")).contains(alice);
    }

    @Test
    @DisplayName("returns empty for a wrong password")
    void wrongPassword() {
        Principal alice = TestPrincipalFactory.create("alice", PrincipalStatus.ACTIVE, hasher.hash("s3cret"));
        when(store.get("alice")).thenReturn(Optional.of(alice));

        assertThat(authenticator.authenticate("alice", "guess")).isEmpty();
    }

    @Test
    @DisplayName("returns empty for an unknown user")
    void unknownUser() {
        when(store.get("ghost")).thenReturn(Optional.empty());

        assertThat(authenticator.authenticate("ghost", "s3cret")).isEmpty();
    }

    @Test
    @DisplayName("returns empty for a user without a password")
    void noStoredPassword() {
        when(store.get("alice")).thenReturn(Optional.of(TestPrincipalFactory.withScopes("alice")));

        assertThat(authenticator.authenticate("alice", "")).isEmpty();
        assertThat(authenticator.authenticate("alice", "anything")).isEmpty();
    }

    @Test
    @DisplayName("authenticates inactive users; status is enforced on protected routes")
    void inactiveUserAuthenticates() {
        Principal bob = TestPrincipalFactory.create("bob", PrincipalStatus.INACTIVE, hasher.hash("pw"));
        when(store.get("bob")).thenReturn(Optional.of(bob));

        assertThat(authenticator.authenticate("bob", "pw")).contains(bob);
    }

    @Test
    @DisplayName("does not query the store for a blank user id")
    void blankUserId() {
        assertThat(authenticator.authenticate(" ", "pw")).isEmpty();
        verify(store, never()).get(" ");
    }

    @Test
    @DisplayName("propagates store failures instead of reporting bad credentials")
    void storageFailure() {
        when(store.get("alice")).thenThrow(new StorageException("database unavailable", null));

        assertThatThrownBy(() -> authenticator.authenticate("alice", "s3cret"))
                .isInstanceOf(StorageException.class);
    }
}
