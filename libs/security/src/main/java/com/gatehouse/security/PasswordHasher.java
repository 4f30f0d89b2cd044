package com.gatehouse.security;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.DelegatingPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * One-way password hashing with constant-time verification.
 *
 * <p>Hashes are self-describing: {@code {bcrypt}$2a$12$<22-char salt><31-char digest>}. The
 * {@code {id}} prefix names the algorithm and the modular-crypt body carries the cost and salt,
 * so changing the cost later does not invalidate hashes that are already stored.
 *
 * <p>Hashes written before the prefix was introduced (bare {@code $2a$}, {@code $2b$} or
 * {@code $2y$} bcrypt strings) are still verified as bcrypt. Anything else that cannot be parsed
 * simply fails verification.
 */
public final class PasswordHasher {

    /** Encoding id written in front of every new hash. */
    public static final String ENCODING_ID = "bcrypt";

    /** Default bcrypt cost factor (log2 rounds). */
    public static final int DEFAULT_STRENGTH = 12;

    private static final Logger log = LoggerFactory.getLogger(PasswordHasher.class);

    private final PasswordEncoder encoder;

    public PasswordHasher() {
        this(DEFAULT_STRENGTH);
    }

    /**
     * @param strength bcrypt cost factor, 4 to 31
     * @throws IllegalArgumentException if the strength is out of range
     */
    public PasswordHasher(int strength) {
        BCryptPasswordEncoder bcrypt = new BCryptPasswordEncoder(strength);
        DelegatingPasswordEncoder delegating =
                new DelegatingPasswordEncoder(ENCODING_ID, Map.of(ENCODING_ID, bcrypt));
        delegating.setDefaultPasswordEncoderForMatches(bcrypt);
        this.encoder = delegating;
    }

    /**
     * Hashes a password with a fresh random salt.
     *
     * @param password the plaintext password
     * @return a self-describing hash safe to persist
     * @throws IllegalArgumentException if the password is null or longer than bcrypt accepts
     */
    public String hash(String password) {
        if (password == null) {
            throw new IllegalArgumentException("password must not be null");
        }
        return encoder.encode(password);
    }

    /**
     * Checks a plaintext password against a stored hash.
     *
     * @param password the plaintext password
     * @param storedHash the hash produced by {@link #hash(String)} or a legacy bcrypt hash
     * @return true only if the password matches; false for any malformed or missing hash
     */
    public boolean verify(String password, String storedHash) {
        if (password == null || storedHash == null || storedHash.isBlank()) {
            return false;
        }
        try {
            return encoder.matches(password, storedHash);
        } catch (IllegalArgumentException e) {
            log.debug("Stored password hash could not be verified: {}", e.getMessage());
            return false;
        }
    }
}
