package com.gatehouse.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link TokenSettings}: algorithm defaults and secret length rules.
 */
@DisplayName("TokenSettings")
class TokenSettingsTest {

    private static final String SECRET_32 = "0123456789abcdef0123456789abcdef";

    @Test
    @DisplayName("defaults the algorithm to HS256")
    void defaultsAlgorithm() {
        assertThat(new TokenSettings(SECRET_32, null).algorithm()).isEqualTo("HS256");
        assertThat(new TokenSettings(SECRET_32, " ").algorithm()).isEqualTo("HS256");
    }

    @Test
    @DisplayName("rejects secrets shorter than the algorithm requires")
    void rejectsShortSecrets() {
        assertThatThrownBy(() -> new TokenSettings("too-short", "HS256"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("32 bytes");
        assertThatThrownBy(() -> new TokenSettings(SECRET_32, "HS512"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("64 bytes");
        assertThatThrownBy(() -> new TokenSettings(null, "HS256"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("rejects non-HMAC algorithms")
    void rejectsUnsupportedAlgorithms() {
        assertThatThrownBy(() -> new TokenSettings(SECRET_32, "RS256"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("RS256");
        assertThatThrownBy(() -> new TokenSettings(SECRET_32, "none"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("never prints the secret")
    void toStringHidesSecret() {
        assertThat(new TokenSettings(SECRET_32, "HS256").toString())
                .doesNotContain(SECRET_32)
                .contains("HS256");
    }
}
