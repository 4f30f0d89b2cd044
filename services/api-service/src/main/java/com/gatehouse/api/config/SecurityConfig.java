package com.gatehouse.api.config;

import com.gatehouse.security.AccessGuardFactory;
import com.gatehouse.security.CredentialAuthenticator;
import com.gatehouse.security.PasswordHasher;
import com.gatehouse.security.TokenCodec;
import com.gatehouse.security.UserStore;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free security core into the Spring context.
 *
 * <p>The codec, hasher and guard factory are immutable and shared by every request.
 */
@Configuration
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PasswordHasher passwordHasher(SecurityProperties properties) {
        return new PasswordHasher(properties.bcryptStrength());
    }

    @Bean
    public TokenCodec tokenCodec(SecurityProperties properties, Clock clock) {
        log.info("Signing access tokens with {}, lifetime {} minutes",
                properties.token().algorithm(), properties.token().expireMinutes());
        return new TokenCodec(properties.token().toSettings(), clock);
    }

    @Bean
    public CredentialAuthenticator credentialAuthenticator(UserStore userStore, PasswordHasher passwordHasher) {
        return new CredentialAuthenticator(userStore, passwordHasher);
    }

    @Bean
    public AccessGuardFactory accessGuardFactory(TokenCodec tokenCodec, UserStore userStore) {
        return new AccessGuardFactory(tokenCodec, userStore);
    }
}
