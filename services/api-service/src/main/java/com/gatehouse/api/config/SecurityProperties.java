package com.gatehouse.api.config;

import com.gatehouse.security.PasswordHasher;
import com.gatehouse.security.TokenSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token, hashing and bootstrap settings, bound from {@code gatehouse.security.*}.
 *
 * <p>When {@code token.secret-key} is blank a random 32-byte URL-safe secret is generated. Tokens
 * signed with a generated secret do not survive a restart.
 *
 * @param token token signing settings
 * @param bcryptStrength bcrypt cost factor for new password hashes
 * @param superuser the account seeded at startup
 */
@ConfigurationProperties(prefix = "gatehouse.security")
@Validated
public record SecurityProperties(
        @Valid Token token,
        @Min(4) @Max(31) int bcryptStrength,
        @Valid Superuser superuser) {

    private static final Logger log = LoggerFactory.getLogger(SecurityProperties.class);

    public SecurityProperties {
        if (token == null) {
            token = new Token(null, null, 0);
        }
        if (bcryptStrength <= 0) {
            bcryptStrength = PasswordHasher.DEFAULT_STRENGTH;
        }
        if (superuser == null) {
            superuser = new Superuser(null, null);
        }
    }

    /**
     * @param secretKey HMAC secret; generated when blank
     * @param algorithm HS256, HS384 or HS512
     * @param expireMinutes lifetime of tokens issued at login (default one day)
     */
    public record Token(String secretKey, String algorithm, @Min(1) long expireMinutes) {

        public static final long DEFAULT_EXPIRE_MINUTES = 60 * 24;

        private static final Map<String, Integer> SECRET_BYTES = Map.of("HS384", 48, "HS512", 64);

        public Token {
            if (algorithm == null || algorithm.isBlank()) {
                algorithm = TokenSettings.DEFAULT_ALGORITHM;
            }
            if (secretKey == null || secretKey.isBlank()) {
                log.warn("gatehouse.security.token.secret-key is not set; generated a random secret."
                        + " Issued tokens will not survive a restart");
                secretKey = randomSecret(algorithm);
            }
            if (expireMinutes <= 0) {
                expireMinutes = DEFAULT_EXPIRE_MINUTES;
            }
        }

        public Duration expiry() {
            return Duration.ofMinutes(expireMinutes);
        }

        public TokenSettings toSettings() {
            return new TokenSettings(secretKey, algorithm);
        }

        @Override
        public String toString() {
            return "Token[secretKey=[REDACTED], algorithm=" + algorithm + ", expireMinutes=" + expireMinutes + "]";
        }

        private static String randomSecret(String algorithm) {
            byte[] bytes = new byte[SECRET_BYTES.getOrDefault(algorithm, 32)];
            new SecureRandom().nextBytes(bytes);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        }
    }

    /**
     * @param id user id of the seeded superuser (default {@code admin})
     * @param password initial password (default {@code admin})
     */
    public record Superuser(@NotBlank String id, @NotBlank String password) {

        public static final String DEFAULT_ID = "admin";
        public static final String DEFAULT_PASSWORD = "admin";

        public Superuser {
            if (id == null || id.isBlank()) {
                id = DEFAULT_ID;
            }
            if (password == null || password.isBlank()) {
                password = DEFAULT_PASSWORD;
            }
        }

        public boolean usesDefaultPassword() {
            return DEFAULT_PASSWORD.equals(password);
        }

        @Override
        public String toString() {
            return "Superuser[id=" + id + ", password=[REDACTED]]";
        }
    }
}
