package com.gatehouse.security;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies a user id and plaintext password against the stored hash.
 *
 * <p>An unknown user, a user without a password and a wrong password all produce the same empty
 * result, so callers cannot reveal which one occurred. Store failures are not folded into that
 * result: they propagate as {@link StorageException}.
 */
public final class CredentialAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(CredentialAuthenticator.class);

    private final UserStore userStore;
    private final PasswordHasher passwordHasher;

    public CredentialAuthenticator(UserStore userStore, PasswordHasher passwordHasher) {
        if (userStore == null || passwordHasher == null) {
            throw new IllegalArgumentException("userStore and passwordHasher must not be null");
        }
        this.userStore = userStore;
        this.passwordHasher = passwordHasher;
    }

    /**
     * @param userId the claimed user id
     * @param password the plaintext password
     * @return the principal when the credentials are valid, otherwise empty
     * @throws StorageException if the user store could not be queried
     */
    public Optional<Principal> authenticate(String userId, String password) {
        if (userId == null || userId.isBlank() || password == null) {
            return Optional.empty();
        }
        Optional<Principal> found = userStore.get(userId);
        if (found.isEmpty()) {
            log.debug("Authentication failed for user={}", userId);
            return Optional.empty();
        }
        if (!passwordHasher.verify(password, found.get().hashedPassword())) {
            log.debug("Authentication failed for user={}", userId);
            return Optional.empty();
        }
        return found;
    }
}
