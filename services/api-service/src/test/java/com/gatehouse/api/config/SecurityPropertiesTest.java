package com.gatehouse.api.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.gatehouse.security.TokenSettings;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link SecurityProperties} defaults, without a Spring context.
 */
@DisplayName("SecurityProperties")
class SecurityPropertiesTest {

    @Test
    @DisplayName("applies defaults for every missing section")
    void defaults() {
        var props = new SecurityProperties(null, 0, null);

        assertThat(props.bcryptStrength()).isEqualTo(12);
        assertThat(props.token().algorithm()).isEqualTo("HS256");
        assertThat(props.token().expiry()).isEqualTo(Duration.ofDays(1));
        assertThat(props.superuser().id()).isEqualTo("admin");
        assertThat(props.superuser().usesDefaultPassword()).isTrue();
    }

    @Test
    @DisplayName("generates a random secret long enough for the algorithm")
    void generatesSecret() {
        var hs256 = new SecurityProperties.Token(null, null, 0);
        var other = new SecurityProperties.Token("", null, 0);
        var hs512 = new SecurityProperties.Token(" ", "HS512", 0);

        assertThat(hs256.secretKey()).isNotBlank().isNotEqualTo(other.secretKey());
        assertThat(hs256.secretKey().getBytes(StandardCharsets.UTF_8).length).isGreaterThanOrEqualTo(32);
        assertThat(hs512.toSettings()).isInstanceOf(TokenSettings.class);
    }

    @Test
    @DisplayName("keeps a configured secret and hides it from toString")
    void keepsConfiguredSecret() {
        var token = new SecurityProperties.Token("configured-secret-with-more-than-32-bytes", "HS256", 15);

        assertThat(token.secretKey()).isEqualTo("configured-secret-with-more-than-32-bytes");
        assertThat(token.expiry()).isEqualTo(Duration.ofMinutes(15));
        assertThat(token.toString()).doesNotContain("configured-secret");
    }

    @Test
    @DisplayName("hides the superuser password from toString")
    void superuserToString() {
        var superuser = new SecurityProperties.Superuser("root", "s3cret-pass");

        assertThat(superuser.usesDefaultPassword()).isFalse();
        assertThat(superuser.toString()).contains("root").doesNotContain("s3cret-pass");
    }
}
