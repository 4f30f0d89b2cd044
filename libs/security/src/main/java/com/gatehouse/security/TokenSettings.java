package com.gatehouse.security;

import com.nimbusds.jose.JWSAlgorithm;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Process-wide signing configuration for {@link TokenCodec}: a symmetric secret and an HMAC
 * algorithm. Built once at startup and never mutated.
 *
 * <p>The secret must be at least as long as the algorithm's output (32 bytes for HS256, 48 for
 * HS384, 64 for HS512). There is no key versioning: changing the secret invalidates every token
 * issued under the old one.
 *
 * @param secretKey the shared secret, used as UTF-8 bytes
 * @param algorithm one of {@code HS256}, {@code HS384}, {@code HS512}
 */
public record TokenSettings(String secretKey, String algorithm) {

    /** Algorithm used when none is configured. */
    public static final String DEFAULT_ALGORITHM = "HS256";

    private static final Map<String, Integer> MIN_SECRET_BYTES =
            Map.of("HS256", 32, "HS384", 48, "HS512", 64);

    public TokenSettings {
        if (algorithm == null || algorithm.isBlank()) {
            algorithm = DEFAULT_ALGORITHM;
        }
        Integer minBytes = MIN_SECRET_BYTES.get(algorithm);
        if (minBytes == null) {
            throw new IllegalArgumentException(
                    "Unsupported signing algorithm '%s', expected one of %s"
                            .formatted(algorithm, MIN_SECRET_BYTES.keySet()));
        }
        if (secretKey == null || secretKey.getBytes(StandardCharsets.UTF_8).length < minBytes) {
            throw new IllegalArgumentException(
                    "Signing secret must be at least %d bytes for %s".formatted(minBytes, algorithm));
        }
    }

    byte[] secretBytes() {
        return secretKey.getBytes(StandardCharsets.UTF_8);
    }

    JWSAlgorithm jwsAlgorithm() {
        return JWSAlgorithm.parse(algorithm);
    }

    @Override
    public String toString() {
        return "TokenSettings[secretKey=[REDACTED], algorithm=" + algorithm + "]";
    }
}
