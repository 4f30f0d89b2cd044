package com.gatehouse.security;

import java.util.Optional;

/**
 * Extracts bearer tokens from HTTP {@code Authorization} header values.
 * <p>
 * The header must be the {@code Bearer} scheme (any case), whitespace, then the token. The rest
 * of the header after the scheme is returned as-is; validating it is the codec's job.
 */
public final class BearerTokenExtractor {

    /** The authentication scheme name, as used in challenges. */
    public static final String SCHEME = "Bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the bearer token from an Authorization header value.
     *
     * @param authorizationHeader the full Authorization header value (may be null)
     * @return the token string, or empty if the header is missing, uses another scheme, or has
     *     no token
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        int separator = indexOfWhitespace(trimmed);
        if (separator < 0) {
            return Optional.empty();
        }
        if (!trimmed.substring(0, separator).equalsIgnoreCase(SCHEME)) {
            return Optional.empty();
        }
        String token = trimmed.substring(separator).strip();
        if (token.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(token);
    }

    private static int indexOfWhitespace(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isWhitespace(value.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
